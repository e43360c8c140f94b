package com.aina.backend.llm.token;

public interface TokenEstimator {

  /**
   * Number of tokens {@code text} occupies; {@code 0} for {@code null} or empty text.
   */
  int estimate(String text);

  /**
   * Average characters per token, used where a token budget has to be turned into a character
   * span.
   */
  double charsPerToken();
}
