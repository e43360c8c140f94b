package com.aina.backend.llm.chunking;

import com.aina.backend.llm.chunking.TextSpans.Span;
import com.aina.backend.llm.token.TokenEstimator;
import java.util.List;
import java.util.regex.Pattern;

/** Packs paragraphs separated by blank lines; oversized paragraphs fall back to sentences. */
public class ParagraphChunkingStrategy extends SegmentPackingChunkingStrategy {

  @Override
  public ChunkStrategyType type() {
    return ChunkStrategyType.PARAGRAPH;
  }

  @Override
  protected List<Span> segment(String text, int coreBudgetTokens, TokenEstimator estimator) {
    return TextSpans.splitAfter(text, 0, text.length(), TextSpans.PARAGRAPH_BREAK);
  }

  @Override
  protected List<Pattern> refinements() {
    return List.of(TextSpans.SENTENCE_BREAK);
  }
}
