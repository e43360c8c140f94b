package com.aina.backend.llm.model;

import java.math.BigDecimal;

public record CostEstimate(
    BigDecimal inputCost, BigDecimal outputCost, BigDecimal totalCost, String currency) {

  public static CostEstimate zero(String currency) {
    return new CostEstimate(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, currency);
  }

  public CostEstimate plus(CostEstimate other) {
    if (other == null) {
      return this;
    }
    return new CostEstimate(
        inputCost.add(other.inputCost()),
        outputCost.add(other.outputCost()),
        totalCost.add(other.totalCost()),
        currency);
  }
}
