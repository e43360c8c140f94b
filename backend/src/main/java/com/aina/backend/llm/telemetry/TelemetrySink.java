package com.aina.backend.llm.telemetry;

/** Receives invocation telemetry off the request path. Implementations may throw; failures are logged. */
public interface TelemetrySink {

  void log(InvocationTelemetryEntry entry);
}
