package com.aina.backend.llm.chunking;

import java.util.List;

public record ChunkPlan(
    int chunkSizeTokens, int overlapTokens, ChunkStrategyType strategy, List<Chunk> chunks) {

  public ChunkPlan {
    if (chunkSizeTokens <= 0) {
      throw new IllegalArgumentException("chunkSizeTokens must be positive");
    }
    chunks = chunks != null ? List.copyOf(chunks) : List.of();
  }

  public int size() {
    return chunks.size();
  }

  /** Concatenation of all chunk cores; equals the planned source text. */
  public String reassemble() {
    StringBuilder builder = new StringBuilder();
    for (Chunk chunk : chunks) {
      builder.append(chunk.core());
    }
    return builder.toString();
  }
}
