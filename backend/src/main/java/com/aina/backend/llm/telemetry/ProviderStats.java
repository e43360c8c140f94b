package com.aina.backend.llm.telemetry;

import java.math.BigDecimal;

public record ProviderStats(
    long requests,
    long errors,
    double averageLatencyMs,
    long tokensIn,
    long tokensOut,
    BigDecimal estimatedCost) {}
