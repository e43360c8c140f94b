package com.aina.backend.llm.telemetry;

import com.aina.backend.llm.json.RepairStage;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeUnit;

public class InvocationMetrics {

  private final MeterRegistry meterRegistry;

  public InvocationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordCall(String providerId, boolean success, long latencyMs, int tokensIn, int tokensOut) {
    String outcome = success ? "success" : "error";
    meterRegistry.counter("llm.invocations", "provider", providerId, "outcome", outcome).increment();
    meterRegistry
        .timer("llm.invocation.latency", "provider", providerId, "outcome", outcome)
        .record(latencyMs, TimeUnit.MILLISECONDS);
    if (success) {
      summary("llm.tokens.input", providerId).record(tokensIn);
      summary("llm.tokens.output", providerId).record(tokensOut);
    }
  }

  public void recordFallback(String fromProvider, String toProvider) {
    meterRegistry.counter("llm.fallbacks", "from", fromProvider, "to", toProvider).increment();
  }

  public void recordMapReduce(String providerId, int chunks) {
    summary("llm.mapreduce.chunks", providerId).record(chunks);
  }

  public void recordJsonRepair(RepairStage stage) {
    if (stage.repaired()) {
      meterRegistry.counter("llm.json.repairs", "stage", stage.name().toLowerCase()).increment();
    }
  }

  private DistributionSummary summary(String name, String providerId) {
    return meterRegistry.summary(name, "provider", providerId);
  }
}
