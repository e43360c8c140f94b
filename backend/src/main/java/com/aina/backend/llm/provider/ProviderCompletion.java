package com.aina.backend.llm.provider;

/**
 * Raw provider answer. Token counts are {@code null} when the backend does not report them.
 */
public record ProviderCompletion(
    String text, Integer tokensIn, Integer tokensOut, String finishReason) {

  public ProviderCompletion {
    text = text != null ? text : "";
  }
}
