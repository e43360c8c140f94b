package com.aina.backend.llm.api;

import java.math.BigDecimal;
import java.util.List;

public record ProvidersResponse(String defaultProvider, List<Provider> providers) {

  public record Provider(
      String id,
      String displayName,
      String type,
      String modelVersion,
      int contextLimitTokens,
      int defaultMaxOutputTokens,
      BigDecimal inputPerMillionTokens,
      BigDecimal outputPerMillionTokens,
      String currency,
      List<String> fallbackChain,
      boolean mapReduceCapable) {}
}
