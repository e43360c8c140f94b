package com.aina.backend.llm.exception;

public class ContextWindowExceededException extends LlmInvocationException {

  private final int promptTokens;
  private final int maxTokens;
  private final String providerId;

  public ContextWindowExceededException(int promptTokens, int maxTokens, String providerId) {
    this(promptTokens, maxTokens, providerId, null);
  }

  public ContextWindowExceededException(
      int promptTokens, int maxTokens, String providerId, Throwable cause) {
    super(
        "Prompt exceeds context window: "
            + promptTokens
            + " tokens > "
            + maxTokens
            + " tokens for "
            + providerId,
        cause);
    this.promptTokens = promptTokens;
    this.maxTokens = maxTokens;
    this.providerId = providerId;
  }

  public int promptTokens() {
    return promptTokens;
  }

  public int maxTokens() {
    return maxTokens;
  }

  public String providerId() {
    return providerId;
  }
}
