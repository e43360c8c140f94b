package com.aina.backend.llm.budget;

public record BudgetCheck(
    String providerId, boolean fits, int estimatedPromptTokens, int availableInputTokens) {

  /** Reason recorded when a request is moved to another provider because of its size. */
  public String overflowReason() {
    return "context_window_exceeded: " + estimatedPromptTokens + " > " + availableInputTokens;
  }
}
