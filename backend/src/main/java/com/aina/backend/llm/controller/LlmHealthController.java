package com.aina.backend.llm.controller;

import com.aina.backend.llm.health.LlmHealthReport;
import com.aina.backend.llm.health.LlmHealthService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/llm/health")
public class LlmHealthController {

  private final LlmHealthService healthService;

  public LlmHealthController(LlmHealthService healthService) {
    this.healthService = healthService;
  }

  @GetMapping
  @Operation(
      summary = "Check every configured provider.",
      description = "Sends a minimal prompt to each provider in parallel; every check is a billed call.")
  public LlmHealthReport health() {
    return healthService.check();
  }
}
