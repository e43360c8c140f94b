package com.aina.backend.llm.chunking;

/**
 * Span of the source text sent as one sub-call. {@code text} is {@code source[overlapStart, end)};
 * the core {@code source[start, end)} excludes the overlap carried over from the previous chunk.
 */
public record Chunk(
    int index, int overlapStart, int start, int end, String text, int estimatedTokens) {

  public Chunk {
    if (overlapStart < 0 || overlapStart > start || start > end) {
      throw new IllegalArgumentException(
          "Invalid chunk bounds: overlapStart=" + overlapStart + ", start=" + start + ", end=" + end);
    }
    if (text == null || text.length() != end - overlapStart) {
      throw new IllegalArgumentException("Chunk text does not match its bounds");
    }
  }

  public int overlapLength() {
    return start - overlapStart;
  }

  public String core() {
    return text.substring(overlapLength());
  }
}
