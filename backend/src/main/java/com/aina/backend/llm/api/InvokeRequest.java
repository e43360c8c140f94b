package com.aina.backend.llm.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

@Schema(
    description = "Single model call routed through the context-window aware invocation engine.",
    example =
        """
        {
          "prompt": "Resumeix l'expedient següent en tres punts.",
          "systemPrompt": "Ets un tècnic de l'administració local.",
          "jsonResponse": false,
          "module": "elaboracio",
          "provider": "gemini-2.5-flash",
          "options": {
            "maxTokens": 1024,
            "temperature": 0.3
          }
        }
        """)
public record InvokeRequest(
    @Schema(description = "User prompt.", requiredMode = Schema.RequiredMode.REQUIRED) @NotBlank
        String prompt,
    @Schema(description = "Optional system prompt.") String systemPrompt,
    @Schema(description = "Ask for a JSON answer; defaults to true.") Boolean jsonResponse,
    @Schema(description = "Calling pipeline: valoracio, elaboracio or kit.") String module,
    @Schema(description = "Caller identifier recorded in telemetry.") String userId,
    @Schema(description = "Caller session recorded in telemetry.") String sessionId,
    @Schema(description = "Provider identifier; defaults to the configured provider.") String provider,
    @Schema(description = "Optional sampling overrides.") @Valid InvokeOptions options) {

  public boolean jsonResponseOrDefault() {
    return jsonResponse == null || jsonResponse;
  }
}
