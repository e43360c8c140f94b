package com.aina.backend.llm.config;

import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.chunking.AdaptiveChunkPlanner;
import com.aina.backend.llm.chunking.ChunkingStrategies;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.fallback.FallbackSelector;
import com.aina.backend.llm.json.StructuredOutputNormalizer;
import com.aina.backend.llm.orchestration.ChunkTargetResolver;
import com.aina.backend.llm.orchestration.IterativeRefinementOrchestrator;
import com.aina.backend.llm.orchestration.MapReduceOrchestrator;
import com.aina.backend.llm.token.HeuristicTokenEstimator;
import com.aina.backend.llm.token.TokenEstimators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ContextWindowProperties.class)
public class ContextWindowConfiguration {

  private static final AtomicInteger MAP_WORKER_SEQUENCE = new AtomicInteger();

  @Bean
  public EncodingRegistry encodingRegistry() {
    return Encodings.newDefaultEncodingRegistry();
  }

  @Bean
  public TokenEstimators tokenEstimators(
      EncodingRegistry encodingRegistry, ContextWindowProperties properties) {
    return new TokenEstimators(
        encodingRegistry, new HeuristicTokenEstimator(properties.getCharsPerToken()));
  }

  @Bean
  public ContextBudgetValidator contextBudgetValidator(TokenEstimators tokenEstimators) {
    return new ContextBudgetValidator(tokenEstimators);
  }

  @Bean
  public FallbackSelector fallbackSelector(
      ModelDescriptorTable modelDescriptorTable, ContextBudgetValidator contextBudgetValidator) {
    return new FallbackSelector(modelDescriptorTable, contextBudgetValidator);
  }

  @Bean
  public AdaptiveChunkPlanner adaptiveChunkPlanner(
      ContextWindowProperties properties, TokenEstimators tokenEstimators) {
    return new AdaptiveChunkPlanner(properties, ChunkingStrategies.defaults(), tokenEstimators);
  }

  @Bean
  public ChunkTargetResolver chunkTargetResolver(
      ModelDescriptorTable modelDescriptorTable, ContextWindowProperties properties) {
    return new ChunkTargetResolver(modelDescriptorTable, properties);
  }

  /** Shared by all map-reduce runs; each run caps its own fan-out. */
  private static ExecutorService mapExecutor(ContextWindowProperties properties) {
    int threads = Math.max(4, properties.getMapConcurrency() * 4);
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("llm-map-" + MAP_WORKER_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }

  @Bean
  public MapReduceOrchestrator mapReduceOrchestrator(
      AdaptiveChunkPlanner adaptiveChunkPlanner,
      ContextBudgetValidator contextBudgetValidator,
      ChunkTargetResolver chunkTargetResolver,
      ContextWindowProperties properties,
      ObjectMapper objectMapper) {
    return new MapReduceOrchestrator(
        adaptiveChunkPlanner,
        contextBudgetValidator,
        chunkTargetResolver,
        properties,
        mapExecutor(properties),
        objectMapper);
  }

  @Bean
  public IterativeRefinementOrchestrator iterativeRefinementOrchestrator(
      AdaptiveChunkPlanner adaptiveChunkPlanner, ChunkTargetResolver chunkTargetResolver) {
    return new IterativeRefinementOrchestrator(adaptiveChunkPlanner, chunkTargetResolver);
  }

  @Bean
  public StructuredOutputNormalizer structuredOutputNormalizer(ObjectMapper objectMapper) {
    return new StructuredOutputNormalizer(objectMapper);
  }
}
