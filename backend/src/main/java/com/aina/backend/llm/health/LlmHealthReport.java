package com.aina.backend.llm.health;

import java.time.Instant;
import java.util.Map;

public record LlmHealthReport(
    Instant timestamp,
    ProviderHealthStatus status,
    Map<String, ProviderHealth> providers,
    long responseTimeMs) {}
