package com.aina.backend.llm.chunking;

import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.token.TokenEstimator;
import com.aina.backend.llm.token.TokenEstimators;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Sizes chunks for a target provider: whatever is left of its context window once the output
 * budget, the instruction overhead and a safety margin are reserved, capped by the configured
 * chunk size.
 */
@Slf4j
public class AdaptiveChunkPlanner {

  private final ContextWindowProperties properties;
  private final ChunkingStrategies strategies;
  private final TokenEstimators tokenEstimators;

  public AdaptiveChunkPlanner(
      ContextWindowProperties properties,
      ChunkingStrategies strategies,
      TokenEstimators tokenEstimators) {
    this.properties = properties;
    this.strategies = strategies;
    this.tokenEstimators = tokenEstimators;
  }

  public int adaptiveChunkSize(ModelDescriptor target, Integer maxOutputTokens) {
    int maxOutput = target.resolveMaxOutputTokens(maxOutputTokens);
    int safetyMargin = (int) Math.floor(target.contextLimitTokens() * properties.getSafetyMarginRatio());
    return target.contextLimitTokens()
        - maxOutput
        - properties.getInstructionOverheadTokens()
        - safetyMargin;
  }

  public int effectiveChunkSize(ModelDescriptor target, Integer maxOutputTokens, Integer requestedChunkSize) {
    return effectiveChunkSize(target, maxOutputTokens, requestedChunkSize, 0);
  }

  /**
   * Like {@link #effectiveChunkSize(ModelDescriptor, Integer, Integer)}, with {@code reservedTokens}
   * of every call taken by text that travels alongside the chunk.
   */
  public int effectiveChunkSize(
      ModelDescriptor target, Integer maxOutputTokens, Integer requestedChunkSize, int reservedTokens) {
    int adaptive = adaptiveChunkSize(target, maxOutputTokens) - reservedTokens;
    if (adaptive <= 0) {
      throw new IllegalStateException(
          "Provider '"
              + target.providerId()
              + "' leaves no room for chunks: context "
              + target.contextLimitTokens()
              + ", output "
              + target.resolveMaxOutputTokens(maxOutputTokens)
              + ", overhead "
              + properties.getInstructionOverheadTokens()
              + ", reserved "
              + reservedTokens);
    }
    int configured =
        requestedChunkSize != null && requestedChunkSize > 0
            ? requestedChunkSize
            : properties.getDefaultChunkSize();
    return Math.min(adaptive, configured);
  }

  public int estimateTokens(ModelDescriptor target, String text) {
    return tokenEstimators.forDescriptor(target).estimate(text);
  }

  public int effectiveOverlap(int chunkSize, Integer requestedOverlap) {
    int configured =
        requestedOverlap != null && requestedOverlap >= 0
            ? requestedOverlap
            : properties.getDefaultOverlapTokens();
    int ceiling = (int) Math.floor(chunkSize * properties.getMaxOverlapRatio());
    return Math.max(0, Math.min(configured, ceiling));
  }

  public ChunkPlan plan(String text, ModelDescriptor target, Integer maxOutputTokens) {
    return plan(text, target, maxOutputTokens, null, null, null);
  }

  public ChunkPlan plan(
      String text,
      ModelDescriptor target,
      Integer maxOutputTokens,
      ChunkStrategyType strategyType,
      Integer requestedChunkSize,
      Integer requestedOverlap) {
    return plan(text, target, maxOutputTokens, strategyType, requestedChunkSize, requestedOverlap, 0);
  }

  public ChunkPlan plan(
      String text,
      ModelDescriptor target,
      Integer maxOutputTokens,
      ChunkStrategyType strategyType,
      Integer requestedChunkSize,
      Integer requestedOverlap,
      int reservedTokens) {
    int chunkSize = effectiveChunkSize(target, maxOutputTokens, requestedChunkSize, reservedTokens);
    int overlap = effectiveOverlap(chunkSize, requestedOverlap);
    ChunkStrategyType type = strategyType != null ? strategyType : properties.getDefaultChunkStrategy();
    TokenEstimator estimator = tokenEstimators.forDescriptor(target);
    List<Chunk> chunks = strategies.get(type).chunk(text, chunkSize, overlap, estimator);
    log.debug(
        "Planned {} {} chunks of <= {} tokens (overlap {}) for provider {}",
        chunks.size(),
        type,
        chunkSize,
        overlap,
        target.providerId());
    return new ChunkPlan(chunkSize, overlap, type, chunks);
  }
}
