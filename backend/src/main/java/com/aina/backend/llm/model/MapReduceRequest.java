package com.aina.backend.llm.model;

import com.aina.backend.llm.chunking.ChunkStrategyType;

/**
 * Explicit map-reduce over a long text.
 *
 * @param template sampling, output and caller fields copied onto every sub-call; its prompt is
 *     ignored and its {@code jsonResponse} flag applies to the reduce call only, map calls always
 *     ask for JSON
 * @param includeMetadata append {@code [Chunk i/N, ~T tokens]} to every map prompt
 */
public record MapReduceRequest(
    String text,
    String mapInstruction,
    String reduceInstruction,
    InvocationRequest template,
    ChunkStrategyType chunkStrategy,
    Integer chunkSizeTokens,
    Integer overlapTokens,
    boolean includeMetadata) {

  public MapReduceRequest {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
    if (mapInstruction == null || mapInstruction.isBlank()) {
      throw new IllegalArgumentException("mapInstruction must not be blank");
    }
    if (reduceInstruction == null || reduceInstruction.isBlank()) {
      throw new IllegalArgumentException("reduceInstruction must not be blank");
    }
    template = template != null ? template : InvocationRequest.builder().build();
  }

  public static MapReduceRequest of(
      String text, String mapInstruction, String reduceInstruction, InvocationRequest template) {
    return new MapReduceRequest(text, mapInstruction, reduceInstruction, template, null, null, null, true);
  }

  public MapReduceRequest withInstructions(String newMapInstruction, String newReduceInstruction) {
    return new MapReduceRequest(
        text, newMapInstruction, newReduceInstruction, template, chunkStrategy, chunkSizeTokens, overlapTokens, includeMetadata);
  }

  public MapReduceRequest withText(String newText) {
    return new MapReduceRequest(
        newText, mapInstruction, reduceInstruction, template, chunkStrategy, chunkSizeTokens, overlapTokens, includeMetadata);
  }
}
