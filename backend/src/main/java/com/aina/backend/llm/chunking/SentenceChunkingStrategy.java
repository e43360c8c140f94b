package com.aina.backend.llm.chunking;

import com.aina.backend.llm.chunking.TextSpans.Span;
import com.aina.backend.llm.token.TokenEstimator;
import java.util.List;

public class SentenceChunkingStrategy extends SegmentPackingChunkingStrategy {

  @Override
  public ChunkStrategyType type() {
    return ChunkStrategyType.SENTENCE;
  }

  @Override
  protected List<Span> segment(String text, int coreBudgetTokens, TokenEstimator estimator) {
    return TextSpans.splitAfter(text, 0, text.length(), TextSpans.SENTENCE_BREAK);
  }
}
