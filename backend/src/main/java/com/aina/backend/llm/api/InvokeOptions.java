package com.aina.backend.llm.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;

@Schema(description = "Optional sampling overrides. JSON responses always use temperature 0.1.")
public record InvokeOptions(
    @Schema(description = "Maximum number of completion tokens.", example = "1024") @Positive
        Integer maxTokens,
    @Schema(description = "Sampling temperature.", example = "0.7")
        @DecimalMin("0.0")
        @DecimalMax("2.0")
        Double temperature,
    @Schema(description = "Nucleus sampling probability mass.", example = "0.95")
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        Double topP) {}
