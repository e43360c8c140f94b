package com.aina.backend.llm.telemetry;

import java.math.BigDecimal;
import java.util.Map;

/** Aggregates over the calls currently held by {@link RecentInvocationLog}. */
public record InvocationStats(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    double averageLatencyMs,
    long totalTokensIn,
    long totalTokensOut,
    BigDecimal totalEstimatedCost,
    long fallbackCount,
    Map<String, ProviderStats> byProvider) {}
