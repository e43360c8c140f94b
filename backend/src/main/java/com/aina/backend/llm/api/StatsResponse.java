package com.aina.backend.llm.api;

import com.aina.backend.llm.telemetry.InvocationStats;
import com.aina.backend.llm.telemetry.InvocationTelemetryEntry;
import java.util.List;

public record StatsResponse(
    InvocationStats summary,
    List<InvocationTelemetryEntry> recentRequests,
    List<InvocationTelemetryEntry> recentErrors) {}
