package com.aina.backend.llm.model;

/**
 * One call into the invocation engine.
 *
 * @param provider target provider id; the configured default provider when {@code null}
 * @param skipAutoStrategies disables fallback and map-reduce for this call; set on the calls the
 *     engine issues itself so that they never recurse into another strategy
 */
public record InvocationRequest(
    String prompt,
    String systemPrompt,
    boolean jsonResponse,
    Integer maxOutputTokens,
    Double temperature,
    Double topP,
    InvocationModule module,
    String userId,
    String sessionId,
    String provider,
    boolean skipAutoStrategies) {

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .prompt(prompt)
        .systemPrompt(systemPrompt)
        .jsonResponse(jsonResponse)
        .maxOutputTokens(maxOutputTokens)
        .temperature(temperature)
        .topP(topP)
        .module(module)
        .userId(userId)
        .sessionId(sessionId)
        .provider(provider)
        .skipAutoStrategies(skipAutoStrategies);
  }

  /**
   * Text measured against the context window: the system prompt, when present, is sent along.
   */
  public String fullPromptText() {
    if (systemPrompt == null || systemPrompt.isBlank()) {
      return prompt;
    }
    return systemPrompt + "\n\n" + prompt;
  }

  public static final class Builder {
    private String prompt;
    private String systemPrompt;
    private boolean jsonResponse;
    private Integer maxOutputTokens;
    private Double temperature;
    private Double topP;
    private InvocationModule module;
    private String userId;
    private String sessionId;
    private String provider;
    private boolean skipAutoStrategies;

    private Builder() {}

    public Builder prompt(String prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder systemPrompt(String systemPrompt) {
      this.systemPrompt = systemPrompt;
      return this;
    }

    public Builder jsonResponse(boolean jsonResponse) {
      this.jsonResponse = jsonResponse;
      return this;
    }

    public Builder maxOutputTokens(Integer maxOutputTokens) {
      this.maxOutputTokens = maxOutputTokens;
      return this;
    }

    public Builder temperature(Double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder topP(Double topP) {
      this.topP = topP;
      return this;
    }

    public Builder module(InvocationModule module) {
      this.module = module;
      return this;
    }

    public Builder userId(String userId) {
      this.userId = userId;
      return this;
    }

    public Builder sessionId(String sessionId) {
      this.sessionId = sessionId;
      return this;
    }

    public Builder provider(String provider) {
      this.provider = provider;
      return this;
    }

    public Builder skipAutoStrategies(boolean skipAutoStrategies) {
      this.skipAutoStrategies = skipAutoStrategies;
      return this;
    }

    public InvocationRequest build() {
      return new InvocationRequest(
          prompt,
          systemPrompt,
          jsonResponse,
          maxOutputTokens,
          temperature,
          topP,
          module,
          userId,
          sessionId,
          provider,
          skipAutoStrategies);
    }
  }
}
