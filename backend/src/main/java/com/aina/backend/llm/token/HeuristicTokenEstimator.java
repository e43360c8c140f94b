package com.aina.backend.llm.token;

/**
 * Deterministic length-based estimate used when no exact tokenizer is available for a provider.
 */
public final class HeuristicTokenEstimator implements TokenEstimator {

  public static final double CATALAN_CHARS_PER_TOKEN = 4.5;

  private final double charsPerToken;

  public HeuristicTokenEstimator() {
    this(CATALAN_CHARS_PER_TOKEN);
  }

  public HeuristicTokenEstimator(double charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive");
    }
    this.charsPerToken = charsPerToken;
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (int) Math.ceil(text.length() / charsPerToken);
  }

  @Override
  public double charsPerToken() {
    return charsPerToken;
  }
}
