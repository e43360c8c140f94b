package com.aina.backend.llm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.llm.telemetry")
public class LlmTelemetryProperties {

  /**
   * Entries waiting for the telemetry worker; new entries are dropped once the queue is full.
   */
  private int queueCapacity = 1000;

  /**
   * Number of invocations kept in memory for the stats endpoint.
   */
  private int recentLogSize = 1000;

  /**
   * Whether each invocation is also written as a log line.
   */
  private boolean logEntries = true;

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public int getRecentLogSize() {
    return recentLogSize;
  }

  public void setRecentLogSize(int recentLogSize) {
    this.recentLogSize = recentLogSize;
  }

  public boolean isLogEntries() {
    return logEntries;
  }

  public void setLogEntries(boolean logEntries) {
    this.logEntries = logEntries;
  }
}
