package com.aina.backend.llm.chunking;

import com.aina.backend.llm.chunking.TextSpans.Span;
import com.aina.backend.llm.token.TokenEstimator;
import java.util.List;

/**
 * Fixed character windows sized from the estimator's chars-per-token ratio. Windows may end in
 * the middle of a word or sentence.
 */
public class FixedSizeChunkingStrategy extends SegmentPackingChunkingStrategy {

  @Override
  public ChunkStrategyType type() {
    return ChunkStrategyType.FIXED;
  }

  @Override
  protected List<Span> segment(String text, int coreBudgetTokens, TokenEstimator estimator) {
    return TextSpans.windows(0, text.length(), windowChars(coreBudgetTokens, estimator));
  }

  @Override
  protected boolean snapOverlapToWords() {
    return false;
  }
}
