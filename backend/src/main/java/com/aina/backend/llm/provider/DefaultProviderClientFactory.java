package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProvidersProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Slf4j
public class DefaultProviderClientFactory implements ProviderClientFactory {

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final RestClient.Builder restClientBuilder;
  private final ObjectMapper objectMapper;

  public DefaultProviderClientFactory(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
    this.restClientBuilder = restClientBuilder;
    this.objectMapper = objectMapper;
  }

  @Override
  public LlmProviderAdapter create(String providerId, LlmProvidersProperties.Provider providerConfig) {
    if (providerConfig.getType() == null) {
      throw new IllegalStateException("Provider '" + providerId + "' has no type configured");
    }
    RestClient.Builder builder =
        restClientBuilder.clone().requestFactory(requestFactory(providerConfig.getTimeout()));
    log.info("Creating {} client for provider {}", providerConfig.getType(), providerId);
    return switch (providerConfig.getType()) {
      case OPENAI_COMPATIBLE -> new OpenAiCompatibleProviderAdapter(providerId, providerConfig, builder);
      case VERTEX_ENDPOINT -> new VertexEndpointProviderAdapter(providerId, providerConfig, builder, objectMapper);
      case OLLAMA -> new OllamaProviderAdapter(providerId, providerConfig, builder, objectMapper);
    };
  }

  private SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(CONNECT_TIMEOUT);
    if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
      factory.setReadTimeout(timeout);
    }
    return factory;
  }
}
