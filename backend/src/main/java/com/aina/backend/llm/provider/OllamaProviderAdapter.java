package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.model.InvocationRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/** Locally served model behind Ollama's {@code /api/generate}, fed a raw ChatML prompt. */
public class OllamaProviderAdapter implements LlmProviderAdapter {

  static final String DEFAULT_GENERATE_PATH = "/api/generate";
  static final String DEFAULT_BASE_URL = "http://localhost:11434";

  private final String providerId;
  private final String model;
  private final URI generateUri;
  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public OllamaProviderAdapter(
      String providerId,
      LlmProvidersProperties.Provider providerConfig,
      RestClient.Builder restClientBuilder,
      ObjectMapper objectMapper) {
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == LlmProviderType.OLLAMA,
        () -> "Invalid provider type for Ollama adapter: " + providerConfig.getType());
    Assert.state(
        StringUtils.hasText(providerConfig.getModel()),
        () -> "model must be configured for provider '" + providerId + "'");
    this.providerId = providerId;
    this.model = providerConfig.getModel();
    String baseUrl =
        StringUtils.hasText(providerConfig.getBaseUrl()) ? providerConfig.getBaseUrl() : DEFAULT_BASE_URL;
    String path =
        StringUtils.hasText(providerConfig.getCompletionsPath())
            ? providerConfig.getCompletionsPath()
            : DEFAULT_GENERATE_PATH;
    this.generateUri =
        URI.create((baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl) + path);
    this.restClient = restClientBuilder.build();
    this.objectMapper = objectMapper;
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public LlmProviderType type() {
    return LlmProviderType.OLLAMA;
  }

  @Override
  public ProviderPrompt format(InvocationRequest request, ProviderCallOptions options) {
    return ProviderPrompt.rendered(ChatMlPromptFormatter.format(request));
  }

  @Override
  public ProviderCompletion complete(ProviderPrompt prompt, ProviderCallOptions options) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", model);
    body.put("prompt", prompt.rendered());
    body.put("stream", false);
    ObjectNode sampling = body.putObject("options");
    sampling.put("num_predict", options.maxOutputTokens());
    sampling.put("temperature", options.temperature());
    sampling.put("top_p", options.topP());
    sampling.putArray("stop").add(ChatMlPromptFormatter.IM_END);

    JsonNode response;
    try {
      response =
          restClient
              .post()
              .uri(generateUri)
              .contentType(MediaType.APPLICATION_JSON)
              .body(body)
              .retrieve()
              .body(JsonNode.class);
    } catch (RuntimeException ex) {
      throw ProviderErrors.translate(providerId, ex);
    }
    if (response == null) {
      return new ProviderCompletion("", null, null, null);
    }
    return new ProviderCompletion(
        ChatMlPromptFormatter.stripEcho(response.path("response").asText(""), prompt.rendered()),
        countOrNull(response, "prompt_eval_count"),
        countOrNull(response, "eval_count"),
        response.hasNonNull("done_reason") ? response.get("done_reason").asText() : null);
  }

  private static Integer countOrNull(JsonNode response, String field) {
    JsonNode value = response.get(field);
    return value != null && value.canConvertToInt() && value.asInt() > 0 ? value.asInt() : null;
  }
}
