package com.aina.backend.llm.health;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Locale;

public enum ProviderHealthStatus {
  HEALTHY,
  DEGRADED,
  UNAVAILABLE,
  ERROR;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Any error makes the whole check an error; otherwise any degraded or unavailable provider degrades it. */
  public static ProviderHealthStatus overall(Collection<ProviderHealthStatus> statuses) {
    if (statuses.contains(ERROR)) {
      return ERROR;
    }
    if (statuses.contains(DEGRADED) || statuses.contains(UNAVAILABLE)) {
      return DEGRADED;
    }
    return HEALTHY;
  }
}
