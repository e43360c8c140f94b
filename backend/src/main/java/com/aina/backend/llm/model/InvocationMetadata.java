package com.aina.backend.llm.model;

public record InvocationMetadata(
    InvocationStrategy strategy,
    boolean fallbackUsed,
    String originalProvider,
    String fallbackReason,
    Integer totalChunks,
    Integer reduceDepth,
    boolean jsonRepaired) {

  public static InvocationMetadata direct() {
    return of(InvocationStrategy.DIRECT);
  }

  public static InvocationMetadata of(InvocationStrategy strategy) {
    return new InvocationMetadata(strategy, false, null, null, null, null, false);
  }

  public InvocationMetadata withFallback(String originalProvider, String fallbackReason) {
    return new InvocationMetadata(
        InvocationStrategy.FALLBACK,
        true,
        originalProvider,
        fallbackReason,
        totalChunks,
        reduceDepth,
        jsonRepaired);
  }

  public InvocationMetadata withChunks(
      InvocationStrategy chunkedStrategy, int totalChunks, Integer reduceDepth) {
    return new InvocationMetadata(
        chunkedStrategy,
        fallbackUsed,
        originalProvider,
        fallbackReason,
        totalChunks,
        reduceDepth,
        jsonRepaired);
  }

  public InvocationMetadata withOriginalProvider(String originalProvider) {
    return new InvocationMetadata(
        strategy, fallbackUsed, originalProvider, fallbackReason, totalChunks, reduceDepth, jsonRepaired);
  }

  public InvocationMetadata withJsonRepaired(boolean repaired) {
    return new InvocationMetadata(
        strategy, fallbackUsed, originalProvider, fallbackReason, totalChunks, reduceDepth, repaired);
  }
}
