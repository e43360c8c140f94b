package com.aina.backend.llm.telemetry;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingTelemetrySink implements TelemetrySink {

  @Override
  public void log(InvocationTelemetryEntry entry) {
    if (entry.success()) {
      log.info(
          "llm_call requestId={} provider={} model={} module={} strategy={} tokensIn={} tokensOut={} latencyMs={} cost={} fallback={} originalProvider={}",
          entry.requestId(),
          entry.provider(),
          entry.modelVersion(),
          entry.module(),
          entry.strategy(),
          entry.tokensIn(),
          entry.tokensOut(),
          entry.latencyMs(),
          entry.costEstimate() != null ? entry.costEstimate().totalCost().toPlainString() : "0",
          entry.fallbackUsed(),
          entry.originalProvider());
    } else {
      log.info(
          "llm_call requestId={} provider={} model={} module={} strategy={} latencyMs={} error={}",
          entry.requestId(),
          entry.provider(),
          entry.modelVersion(),
          entry.module(),
          entry.strategy(),
          entry.latencyMs(),
          entry.error());
    }
  }
}
