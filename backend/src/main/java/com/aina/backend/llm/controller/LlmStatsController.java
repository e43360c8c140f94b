package com.aina.backend.llm.controller;

import com.aina.backend.llm.api.StatsResponse;
import com.aina.backend.llm.telemetry.RecentInvocationLog;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/llm/stats")
@Validated
public class LlmStatsController {

  private static final int RECENT_ERRORS = 5;

  private final RecentInvocationLog recentInvocationLog;

  public LlmStatsController(RecentInvocationLog recentInvocationLog) {
    this.recentInvocationLog = recentInvocationLog;
  }

  @GetMapping
  public StatsResponse stats(
      @RequestParam(defaultValue = "10") @Min(1) @Max(1000) int limit) {
    return new StatsResponse(
        recentInvocationLog.summary(),
        recentInvocationLog.recent(limit),
        recentInvocationLog.errors(Math.min(limit, RECENT_ERRORS)));
  }
}
