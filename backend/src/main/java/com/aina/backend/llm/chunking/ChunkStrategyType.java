package com.aina.backend.llm.chunking;

import java.util.Locale;

public enum ChunkStrategyType {
  PARAGRAPH,
  SENTENCE,
  FIXED;

  public static ChunkStrategyType fromCode(String code, ChunkStrategyType fallback) {
    if (code == null || code.isBlank()) {
      return fallback;
    }
    try {
      return ChunkStrategyType.valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown chunk strategy: " + code, ex);
    }
  }
}
