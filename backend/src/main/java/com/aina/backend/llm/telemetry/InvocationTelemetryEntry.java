package com.aina.backend.llm.telemetry;

import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationModule;
import com.aina.backend.llm.model.InvocationStrategy;
import java.time.Instant;

/** One provider call as seen by telemetry. {@code error} is {@code null} for successful calls. */
public record InvocationTelemetryEntry(
    String requestId,
    Instant timestamp,
    String provider,
    String modelVersion,
    InvocationModule module,
    String userId,
    String sessionId,
    InvocationStrategy strategy,
    int tokensIn,
    int tokensOut,
    long latencyMs,
    CostEstimate costEstimate,
    boolean fallbackUsed,
    String originalProvider,
    String fallbackReason,
    String error) {

  public boolean success() {
    return error == null;
  }

  public int totalTokens() {
    return tokensIn + tokensOut;
  }
}
