package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.model.InvocationRequest;
import java.util.ArrayList;
import java.util.List;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Chat-completions backends speaking the OpenAI protocol; Gemini is reached through its
 * OpenAI-compatible endpoint.
 */
public class OpenAiCompatibleProviderAdapter implements LlmProviderAdapter {

  static final String JSON_INSTRUCTION = "Respon estrictament en format JSON sense text addicional.";

  private final String providerId;
  private final String model;
  private final OpenAiChatModel chatModel;

  public OpenAiCompatibleProviderAdapter(
      String providerId, LlmProvidersProperties.Provider providerConfig, RestClient.Builder restClientBuilder) {
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.state(
        providerConfig.getType() == LlmProviderType.OPENAI_COMPATIBLE,
        () -> "Invalid provider type for OpenAI-compatible adapter: " + providerConfig.getType());
    Assert.state(
        StringUtils.hasText(providerConfig.getApiKey()),
        () -> "API key must be configured for provider '" + providerId + "'");

    this.providerId = providerId;
    this.model = providerConfig.getModel();
    OpenAiApi.Builder apiBuilder =
        OpenAiApi.builder().apiKey(providerConfig.getApiKey()).restClientBuilder(restClientBuilder);
    if (StringUtils.hasText(providerConfig.getBaseUrl())) {
      apiBuilder.baseUrl(providerConfig.getBaseUrl());
    }
    if (StringUtils.hasText(providerConfig.getCompletionsPath())) {
      apiBuilder.completionsPath(providerConfig.getCompletionsPath());
    }
    OpenAiChatOptions.Builder defaultOptions = OpenAiChatOptions.builder();
    if (StringUtils.hasText(model)) {
      defaultOptions.model(model);
    }
    // retries are owned by ProviderCallExecutor
    this.chatModel =
        OpenAiChatModel.builder()
            .openAiApi(apiBuilder.build())
            .defaultOptions(defaultOptions.build())
            .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
            .build();
  }

  @Override
  public String providerId() {
    return providerId;
  }

  @Override
  public LlmProviderType type() {
    return LlmProviderType.OPENAI_COMPATIBLE;
  }

  @Override
  public ProviderPrompt format(InvocationRequest request, ProviderCallOptions options) {
    String systemPrompt = request.systemPrompt();
    if (options.jsonResponse()) {
      systemPrompt =
          StringUtils.hasText(systemPrompt)
              ? systemPrompt + "\n\n" + JSON_INSTRUCTION
              : ChatMlPromptFormatter.JSON_SYSTEM_PROMPT;
    }
    return ProviderPrompt.messages(systemPrompt, request.prompt());
  }

  @Override
  public ProviderCompletion complete(ProviderPrompt prompt, ProviderCallOptions options) {
    List<Message> messages = new ArrayList<>();
    if (StringUtils.hasText(prompt.systemPrompt())) {
      messages.add(new SystemMessage(prompt.systemPrompt()));
    }
    messages.add(new UserMessage(prompt.isRendered() ? prompt.rendered() : prompt.userPrompt()));

    ChatResponse response;
    try {
      response = chatModel.call(new Prompt(messages, buildOptions(options)));
    } catch (RuntimeException ex) {
      throw ProviderErrors.translate(providerId, ex);
    }
    return toCompletion(response);
  }

  OpenAiChatOptions buildOptions(ProviderCallOptions options) {
    OpenAiChatOptions.Builder builder =
        OpenAiChatOptions.builder()
            .temperature(options.temperature())
            .topP(options.topP())
            .maxTokens(options.maxOutputTokens());
    if (StringUtils.hasText(model)) {
      builder.model(model);
    }
    if (options.jsonResponse()) {
      builder.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
    }
    return builder.build();
  }

  private ProviderCompletion toCompletion(ChatResponse response) {
    if (response == null || response.getResult() == null) {
      return new ProviderCompletion("", null, null, null);
    }
    Generation generation = response.getResult();
    String text = generation.getOutput() != null ? generation.getOutput().getText() : "";
    String finishReason =
        generation.getMetadata() != null ? generation.getMetadata().getFinishReason() : null;
    Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
    return new ProviderCompletion(
        text,
        usage != null ? positiveOrNull(usage.getPromptTokens()) : null,
        usage != null ? positiveOrNull(usage.getCompletionTokens()) : null,
        finishReason);
  }

  private static Integer positiveOrNull(Integer value) {
    return value != null && value > 0 ? value : null;
  }
}
