package com.aina.backend.llm;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.token.HeuristicTokenEstimator;
import com.aina.backend.llm.token.TokenEstimators;
import java.math.BigDecimal;
import java.util.List;

public final class LlmTestFixtures {

  private LlmTestFixtures() {}

  public static ModelDescriptor descriptor(String id, int contextLimit, int maxOutput, String... fallbackChain) {
    return descriptor(id, contextLimit, maxOutput, true, fallbackChain);
  }

  public static ModelDescriptor descriptor(
      String id, int contextLimit, int maxOutput, boolean mapReduceCapable, String... fallbackChain) {
    return new ModelDescriptor(
        id,
        id,
        LlmProviderType.OPENAI_COMPATIBLE,
        id + "-model",
        contextLimit,
        maxOutput,
        new BigDecimal("0.000001"),
        new BigDecimal("0.000002"),
        "USD",
        List.of(fallbackChain),
        null,
        mapReduceCapable);
  }

  /** Heuristic estimator with one character per token, so token counts equal string lengths. */
  public static TokenEstimators charTokens() {
    return new TokenEstimators(null, new HeuristicTokenEstimator(1.0));
  }

  public static String repeat(char c, int length) {
    return String.valueOf(c).repeat(length);
  }
}
