package com.aina.backend.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of an invocation. {@code provider} is the provider that actually produced
 * {@code text}, which differs from the requested one after a fallback.
 */
public record InvocationResult(
    String requestId,
    String text,
    JsonNode json,
    String provider,
    String modelVersion,
    int tokensIn,
    int tokensOut,
    long latencyMs,
    CostEstimate costEstimate,
    InvocationMetadata metadata) {

  public int totalTokens() {
    return tokensIn + tokensOut;
  }

  public boolean fallbackUsed() {
    return metadata != null && metadata.fallbackUsed();
  }

  public InvocationResult withMetadata(InvocationMetadata newMetadata) {
    return new InvocationResult(
        requestId, text, json, provider, modelVersion, tokensIn, tokensOut, latencyMs, costEstimate, newMetadata);
  }
}
