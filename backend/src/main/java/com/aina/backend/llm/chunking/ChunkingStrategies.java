package com.aina.backend.llm.chunking;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class ChunkingStrategies {

  private final Map<ChunkStrategyType, ChunkingStrategy> strategies =
      new EnumMap<>(ChunkStrategyType.class);

  public ChunkingStrategies(List<ChunkingStrategy> strategies) {
    strategies.forEach(strategy -> this.strategies.put(strategy.type(), strategy));
    for (ChunkStrategyType type : ChunkStrategyType.values()) {
      if (!this.strategies.containsKey(type)) {
        throw new IllegalStateException("No chunking strategy registered for " + type);
      }
    }
  }

  public static ChunkingStrategies defaults() {
    return new ChunkingStrategies(
        List.of(
            new ParagraphChunkingStrategy(),
            new SentenceChunkingStrategy(),
            new FixedSizeChunkingStrategy()));
  }

  public ChunkingStrategy get(ChunkStrategyType type) {
    return strategies.get(type);
  }
}
