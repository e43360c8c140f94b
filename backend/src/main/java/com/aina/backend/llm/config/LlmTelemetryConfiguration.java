package com.aina.backend.llm.config;

import com.aina.backend.llm.telemetry.AsyncTelemetryDispatcher;
import com.aina.backend.llm.telemetry.CostCalculator;
import com.aina.backend.llm.telemetry.InvocationMetrics;
import com.aina.backend.llm.telemetry.LoggingTelemetrySink;
import com.aina.backend.llm.telemetry.RecentInvocationLog;
import com.aina.backend.llm.telemetry.TelemetrySink;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LlmTelemetryProperties.class)
public class LlmTelemetryConfiguration {

  @Bean
  public CostCalculator costCalculator() {
    return new CostCalculator();
  }

  @Bean
  public InvocationMetrics invocationMetrics(MeterRegistry meterRegistry) {
    return new InvocationMetrics(meterRegistry);
  }

  @Bean
  public RecentInvocationLog recentInvocationLog(LlmTelemetryProperties properties) {
    return new RecentInvocationLog(properties.getRecentLogSize());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "app.llm.telemetry",
      name = "log-entries",
      havingValue = "true",
      matchIfMissing = true)
  public LoggingTelemetrySink loggingTelemetrySink() {
    return new LoggingTelemetrySink();
  }

  @Bean
  public AsyncTelemetryDispatcher asyncTelemetryDispatcher(
      List<TelemetrySink> sinks, LlmTelemetryProperties properties, MeterRegistry meterRegistry) {
    return new AsyncTelemetryDispatcher(sinks, properties.getQueueCapacity(), meterRegistry);
  }
}
