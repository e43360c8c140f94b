package com.aina.backend.llm.provider;

import java.time.Duration;

/** Sampling parameters resolved for a single provider call. */
public record ProviderCallOptions(
    int maxOutputTokens, double temperature, double topP, boolean jsonResponse, Duration timeout) {

  public static final double JSON_TEMPERATURE = 0.1;
  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final double DEFAULT_TOP_P = 0.95;

  /**
   * JSON mode pins temperature and top-p so that the output stays parseable; otherwise request
   * values win over the defaults.
   */
  public static ProviderCallOptions resolve(
      int maxOutputTokens,
      Double temperature,
      Double topP,
      boolean jsonResponse,
      Duration timeout) {
    if (jsonResponse) {
      return new ProviderCallOptions(maxOutputTokens, JSON_TEMPERATURE, DEFAULT_TOP_P, true, timeout);
    }
    return new ProviderCallOptions(
        maxOutputTokens,
        temperature != null ? temperature : DEFAULT_TEMPERATURE,
        topP != null ? topP : DEFAULT_TOP_P,
        false,
        timeout);
  }
}
