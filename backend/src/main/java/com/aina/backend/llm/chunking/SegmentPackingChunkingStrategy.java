package com.aina.backend.llm.chunking;

import com.aina.backend.llm.chunking.TextSpans.Span;
import com.aina.backend.llm.token.TokenEstimator;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cuts the text into natural segments and greedily packs consecutive segments into chunks.
 * Segments larger than a chunk are split by the finer separators of {@link #refinements()} and
 * finally into fixed character windows.
 */
abstract class SegmentPackingChunkingStrategy implements ChunkingStrategy {

  protected abstract List<Span> segment(String text, int coreBudgetTokens, TokenEstimator estimator);

  /** Finer separators tried, in order, on a segment that exceeds the chunk budget. */
  protected List<Pattern> refinements() {
    return List.of();
  }

  /** Whether the overlap start is moved forward to the next word boundary. */
  protected boolean snapOverlapToWords() {
    return true;
  }

  @Override
  public List<Chunk> chunk(String text, int chunkTokens, int overlapTokens, TokenEstimator estimator) {
    if (chunkTokens <= 0) {
      throw new IllegalArgumentException("chunkTokens must be positive");
    }
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    int overlap = Math.max(0, Math.min(overlapTokens, chunkTokens - 1));
    int coreBudget = chunkTokens - overlap;

    List<Span> segments = new ArrayList<>();
    for (Span span : segment(text, coreBudget, estimator)) {
      segments.addAll(fitToBudget(text, span, coreBudget, estimator, 0));
    }

    List<Chunk> chunks = new ArrayList<>();
    int coreStart = -1;
    int coreEnd = -1;
    int coreTokens = 0;
    int previousStart = 0;
    int previousEnd = 0;
    for (Span segment : segments) {
      int segmentTokens = estimator.estimate(text.substring(segment.start(), segment.end()));
      int budget = chunks.isEmpty() ? chunkTokens : coreBudget;
      if (coreStart >= 0 && coreTokens + segmentTokens > budget) {
        Chunk chunk = buildChunk(text, chunks.size(), previousStart, previousEnd, coreStart, coreEnd, overlap, estimator);
        chunks.add(chunk);
        previousStart = coreStart;
        previousEnd = coreEnd;
        coreStart = -1;
        coreTokens = 0;
      }
      if (coreStart < 0) {
        coreStart = segment.start();
      }
      coreEnd = segment.end();
      coreTokens += segmentTokens;
    }
    if (coreStart >= 0) {
      chunks.add(buildChunk(text, chunks.size(), previousStart, previousEnd, coreStart, coreEnd, overlap, estimator));
    }
    return chunks;
  }

  private List<Span> fitToBudget(
      String text, Span span, int coreBudget, TokenEstimator estimator, int refinementLevel) {
    if (estimator.estimate(text.substring(span.start(), span.end())) <= coreBudget) {
      return List.of(span);
    }
    List<Pattern> refinements = refinements();
    if (refinementLevel < refinements.size()) {
      List<Span> pieces =
          TextSpans.splitAfter(text, span.start(), span.end(), refinements.get(refinementLevel));
      List<Span> fitted = new ArrayList<>();
      for (Span piece : pieces) {
        fitted.addAll(fitToBudget(text, piece, coreBudget, estimator, refinementLevel + 1));
      }
      return fitted;
    }
    return TextSpans.windows(span.start(), span.end(), windowChars(coreBudget, estimator));
  }

  private Chunk buildChunk(
      String text,
      int index,
      int previousStart,
      int previousEnd,
      int coreStart,
      int coreEnd,
      int overlapTokens,
      TokenEstimator estimator) {
    int overlapStart = coreStart;
    if (index > 0 && overlapTokens > 0) {
      overlapStart = overlapStart(text, previousStart, previousEnd, overlapTokens, estimator);
    }
    String chunkText = text.substring(overlapStart, coreEnd);
    return new Chunk(index, overlapStart, coreStart, coreEnd, chunkText, estimator.estimate(chunkText));
  }

  private int overlapStart(
      String text, int previousStart, int previousEnd, int overlapTokens, TokenEstimator estimator) {
    int maxChars = (int) Math.floor(overlapTokens * estimator.charsPerToken());
    int candidate = Math.max(previousStart, previousEnd - maxChars);
    if (snapOverlapToWords() && candidate > previousStart && !Character.isWhitespace(text.charAt(candidate - 1))) {
      int boundary = candidate;
      while (boundary < previousEnd && !Character.isWhitespace(text.charAt(boundary))) {
        boundary++;
      }
      while (boundary < previousEnd && Character.isWhitespace(text.charAt(boundary))) {
        boundary++;
      }
      candidate = boundary;
    }
    while (candidate < previousEnd
        && estimator.estimate(text.substring(candidate, previousEnd)) > overlapTokens) {
      candidate++;
    }
    return candidate;
  }

  static int windowChars(int tokens, TokenEstimator estimator) {
    return Math.max(1, (int) Math.floor(tokens * estimator.charsPerToken()));
  }
}
