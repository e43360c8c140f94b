package com.aina.backend.llm.telemetry;

import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.model.CostEstimate;
import java.math.BigDecimal;
import java.math.RoundingMode;

public class CostCalculator {

  static final int SCALE = 10;

  public CostEstimate estimate(ModelDescriptor descriptor, int tokensIn, int tokensOut) {
    BigDecimal input = multiply(descriptor.costPerInputToken(), tokensIn);
    BigDecimal output = multiply(descriptor.costPerOutputToken(), tokensOut);
    return new CostEstimate(
        input, output, input.add(output).setScale(SCALE, RoundingMode.HALF_UP), descriptor.currency());
  }

  private static BigDecimal multiply(BigDecimal costPerToken, int tokens) {
    return costPerToken
        .multiply(BigDecimal.valueOf(Math.max(0, tokens)))
        .setScale(SCALE, RoundingMode.HALF_UP);
  }
}
