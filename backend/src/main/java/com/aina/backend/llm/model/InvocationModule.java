package com.aina.backend.llm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Pipeline family issuing the call; recorded in telemetry only. */
public enum InvocationModule {
  VALORACIO,
  ELABORACIO,
  KIT;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static InvocationModule fromCode(String code) {
    if (code == null || code.isBlank()) {
      return null;
    }
    return InvocationModule.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
