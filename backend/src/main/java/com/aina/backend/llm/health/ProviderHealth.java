package com.aina.backend.llm.health;

import com.aina.backend.llm.config.LlmProviderType;

public record ProviderHealth(
    String providerId,
    LlmProviderType type,
    String modelVersion,
    ProviderHealthStatus status,
    String message,
    long latencyMs) {}
