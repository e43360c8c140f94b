package com.aina.backend.llm.chunking;

import com.aina.backend.llm.token.TokenEstimator;
import java.util.List;

public interface ChunkingStrategy {

  ChunkStrategyType type();

  /**
   * Splits {@code text} into ordered chunks whose cores tile the text exactly.
   *
   * @param chunkTokens token budget of a whole chunk, overlap included
   * @param overlapTokens tokens of the previous chunk repeated at the head of the next one
   */
  List<Chunk> chunk(String text, int chunkTokens, int overlapTokens, TokenEstimator estimator);
}
