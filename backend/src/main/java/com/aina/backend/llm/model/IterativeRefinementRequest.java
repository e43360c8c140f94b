package com.aina.backend.llm.model;

import com.aina.backend.llm.chunking.ChunkStrategyType;

public record IterativeRefinementRequest(
    String text,
    String initialInstruction,
    String refineInstruction,
    InvocationRequest template,
    ChunkStrategyType chunkStrategy,
    Integer chunkSizeTokens,
    Integer overlapTokens) {

  public IterativeRefinementRequest {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
    if (initialInstruction == null || initialInstruction.isBlank()) {
      throw new IllegalArgumentException("initialInstruction must not be blank");
    }
    if (refineInstruction == null || refineInstruction.isBlank()) {
      throw new IllegalArgumentException("refineInstruction must not be blank");
    }
    template = template != null ? template : InvocationRequest.builder().build();
  }

  public static IterativeRefinementRequest of(
      String text, String initialInstruction, String refineInstruction, InvocationRequest template) {
    return new IterativeRefinementRequest(
        text, initialInstruction, refineInstruction, template, null, null, null);
  }
}
