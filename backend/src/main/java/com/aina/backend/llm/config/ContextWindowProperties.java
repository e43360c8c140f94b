package com.aina.backend.llm.config;

import com.aina.backend.llm.chunking.ChunkStrategyType;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.llm.context-window")
public class ContextWindowProperties {

  /**
   * Retry an oversized request on the first provider of the fallback chain that can hold it.
   */
  private boolean autoFallback = true;

  /**
   * Split an oversized request into chunks when no fallback provider can hold it.
   */
  private boolean autoMapReduce = false;

  /**
   * Upper bound for chunk size in tokens; the planner may pick a smaller, provider-derived size.
   */
  private int defaultChunkSize = 12000;

  private ChunkStrategyType defaultChunkStrategy = ChunkStrategyType.PARAGRAPH;

  private int defaultOverlapTokens = 500;

  /**
   * Tokens reserved for the map/reduce instruction wrapped around each chunk.
   */
  private int instructionOverheadTokens = 200;

  /**
   * Fraction of the context window kept free when sizing chunks.
   */
  private double safetyMarginRatio = 0.1;

  /**
   * Upper bound of overlap as a fraction of the chunk size.
   */
  private double maxOverlapRatio = 0.1;

  /**
   * Characters per token assumed by the heuristic estimator (Catalan text).
   */
  private double charsPerToken = 4.5;

  /**
   * Maximum number of map sub-calls in flight for a single map-reduce run.
   */
  private int mapConcurrency = 4;

  /**
   * How many times combined map results may be re-chunked when they overflow the reduce call.
   */
  private int maxReduceDepth = 2;

  /**
   * Provider used for map/reduce sub-calls when the selected one cannot serve them.
   */
  private String mapReduceProvider;

  private int mapReduceMaxOutputTokens = 512;

  public boolean isAutoFallback() {
    return autoFallback;
  }

  public void setAutoFallback(boolean autoFallback) {
    this.autoFallback = autoFallback;
  }

  public boolean isAutoMapReduce() {
    return autoMapReduce;
  }

  public void setAutoMapReduce(boolean autoMapReduce) {
    this.autoMapReduce = autoMapReduce;
  }

  public int getDefaultChunkSize() {
    return defaultChunkSize;
  }

  public void setDefaultChunkSize(int defaultChunkSize) {
    this.defaultChunkSize = defaultChunkSize;
  }

  public ChunkStrategyType getDefaultChunkStrategy() {
    return defaultChunkStrategy;
  }

  public void setDefaultChunkStrategy(ChunkStrategyType defaultChunkStrategy) {
    this.defaultChunkStrategy = defaultChunkStrategy;
  }

  public int getDefaultOverlapTokens() {
    return defaultOverlapTokens;
  }

  public void setDefaultOverlapTokens(int defaultOverlapTokens) {
    this.defaultOverlapTokens = defaultOverlapTokens;
  }

  public int getInstructionOverheadTokens() {
    return instructionOverheadTokens;
  }

  public void setInstructionOverheadTokens(int instructionOverheadTokens) {
    this.instructionOverheadTokens = instructionOverheadTokens;
  }

  public double getSafetyMarginRatio() {
    return safetyMarginRatio;
  }

  public void setSafetyMarginRatio(double safetyMarginRatio) {
    this.safetyMarginRatio = safetyMarginRatio;
  }

  public double getMaxOverlapRatio() {
    return maxOverlapRatio;
  }

  public void setMaxOverlapRatio(double maxOverlapRatio) {
    this.maxOverlapRatio = maxOverlapRatio;
  }

  public double getCharsPerToken() {
    return charsPerToken;
  }

  public void setCharsPerToken(double charsPerToken) {
    this.charsPerToken = charsPerToken;
  }

  public int getMapConcurrency() {
    return mapConcurrency;
  }

  public void setMapConcurrency(int mapConcurrency) {
    this.mapConcurrency = mapConcurrency;
  }

  public int getMaxReduceDepth() {
    return maxReduceDepth;
  }

  public void setMaxReduceDepth(int maxReduceDepth) {
    this.maxReduceDepth = maxReduceDepth;
  }

  public String getMapReduceProvider() {
    return mapReduceProvider;
  }

  public void setMapReduceProvider(String mapReduceProvider) {
    this.mapReduceProvider = mapReduceProvider;
  }

  public int getMapReduceMaxOutputTokens() {
    return mapReduceMaxOutputTokens;
  }

  public void setMapReduceMaxOutputTokens(int mapReduceMaxOutputTokens) {
    this.mapReduceMaxOutputTokens = mapReduceMaxOutputTokens;
  }
}
