package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import com.aina.backend.llm.model.InvocationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Custom model deployed on a Vertex AI endpoint (Salamandra, ALIA) and queried through its
 * {@code :predict} method with a ChatML prompt.
 *
 * <p>Calls are authorized with Google application default credentials, scoped to
 * {@value #CLOUD_PLATFORM_SCOPE}; the request metadata is taken per call so expired tokens are
 * refreshed. A configured {@code api-key} is sent as a static bearer token instead.
 */
public class VertexEndpointProviderAdapter implements LlmProviderAdapter {

  static final String DEFAULT_PREDICT_PATH = ":predict";
  static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

  @FunctionalInterface
  interface CredentialsLoader {
    GoogleCredentials load() throws IOException;
  }

  private final String providerId;
  private final URI predictUri;
  private final CredentialsLoader credentialsLoader;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;
  private volatile GoogleCredentials credentials;

  public VertexEndpointProviderAdapter(
      String providerId,
      LlmProvidersProperties.Provider providerConfig,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    this(providerId, providerConfig, restClientBuilder, objectMapper, credentialsLoader(providerConfig));
  }

  VertexEndpointProviderAdapter(
      String providerId,
      LlmProvidersProperties.Provider providerConfig,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper,
      CredentialsLoader credentialsLoader) {
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == LlmProviderType.VERTEX_ENDPOINT,
        () -> "Invalid provider type for Vertex endpoint adapter: " + providerConfig.getType());
    Assert.state(
        StringUtils.hasText(providerConfig.getBaseUrl()),
        () -> "base-url must point to the Vertex endpoint of provider '" + providerId + "'");
    this.providerId = providerId;
    String path =
        StringUtils.hasText(providerConfig.getCompletionsPath())
            ? providerConfig.getCompletionsPath()
            : DEFAULT_PREDICT_PATH;
    this.predictUri = URI.create(stripTrailingSlash(providerConfig.getBaseUrl()) + path);
    this.credentialsLoader = credentialsLoader;
    this.restClient = restClientBuilder.build();
    this.objectMapper = objectMapper;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public LlmProviderType type() {
    return LlmProviderType.VERTEX_ENDPOINT;
  }

  @Override
  public ProviderPrompt format(InvocationRequest request, ProviderCallOptions options) {
    return ProviderPrompt.rendered(ChatMlPromptFormatter.format(request));
  }

  @Override
  public ProviderCompletion complete(ProviderPrompt prompt, ProviderCallOptions options) {
    ObjectNode body = objectMapper.createObjectNode();
    ObjectNode instance = body.putArray("instances").addObject();
    instance.put("prompt", prompt.rendered());
    instance.put("max_tokens", options.maxOutputTokens());
    instance.put("temperature", options.temperature());
    instance.put("top_p", options.topP());

    Map<String, List<String>> authHeaders = requestMetadata();
    JsonNode response;
    try {
      response =
          restClient
              .post()
              .uri(predictUri)
              .contentType(MediaType.APPLICATION_JSON)
              .headers(
                  headers ->
                      authHeaders.forEach(
                          (name, values) -> {
                            if (values != null && !values.isEmpty()) {
                              headers.set(name, values.get(0));
                            }
                          }))
              .body(body)
              .retrieve()
              .body(JsonNode.class);
    } catch (RuntimeException ex) {
      throw ProviderErrors.translate(providerId, ex);
    }
    return new ProviderCompletion(
        ChatMlPromptFormatter.stripEcho(predictionText(response), prompt.rendered()), null, null, null);
  }

  private Map<String, List<String>> requestMetadata() {
    try {
      Map<String, List<String>> metadata = credentials().getRequestMetadata(predictUri);
      return metadata != null ? metadata : Map.of();
    } catch (IOException ex) {
      throw new ProviderException(
          providerId,
          ProviderFailureReason.AUTH,
          null,
          "Cannot obtain Google credentials: " + ex.getMessage(),
          ex);
    }
  }

  private GoogleCredentials credentials() throws IOException {
    GoogleCredentials current = credentials;
    if (current == null) {
      synchronized (this) {
        if (credentials == null) {
          credentials = credentialsLoader.load();
        }
        current = credentials;
      }
    }
    return current;
  }

  private static CredentialsLoader credentialsLoader(LlmProvidersProperties.Provider providerConfig) {
    String apiKey = providerConfig != null ? providerConfig.getApiKey() : null;
    if (StringUtils.hasText(apiKey)) {
      return () -> GoogleCredentials.create(new AccessToken(apiKey, null));
    }
    return () -> GoogleCredentials.getApplicationDefault().createScoped(CLOUD_PLATFORM_SCOPE);
  }

  private String predictionText(JsonNode response) {
    if (response == null) {
      return "";
    }
    JsonNode predictions = response.path("predictions");
    if (!predictions.isArray() || predictions.isEmpty()) {
      return "";
    }
    JsonNode first = predictions.get(0);
    return first.isTextual() ? first.asText() : first.toString();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
