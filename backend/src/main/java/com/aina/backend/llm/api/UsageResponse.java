package com.aina.backend.llm.api;

public record UsageResponse(int promptTokens, int completionTokens, int totalTokens) {}
