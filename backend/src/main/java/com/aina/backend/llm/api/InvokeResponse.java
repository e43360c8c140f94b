package com.aina.backend.llm.api;

import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvokeResponse(
    String requestId,
    @Schema(description = "Provider that produced the answer; differs from the requested one after a fallback.")
        String provider,
    String modelVersion,
    String text,
    @Schema(description = "Parsed JSON answer in JSON mode, the raw text otherwise.") JsonNode data,
    UsageResponse usage,
    long latencyMs,
    CostEstimate cost,
    InvocationMetadata metadata) {}
