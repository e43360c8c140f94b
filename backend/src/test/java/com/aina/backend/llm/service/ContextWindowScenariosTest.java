package com.aina.backend.llm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.chunking.AdaptiveChunkPlanner;
import com.aina.backend.llm.chunking.ChunkingStrategies;
import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.fallback.FallbackSelector;
import com.aina.backend.llm.json.StructuredOutputNormalizer;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.model.InvocationStrategy;
import com.aina.backend.llm.orchestration.ChunkTargetResolver;
import com.aina.backend.llm.orchestration.IterativeRefinementOrchestrator;
import com.aina.backend.llm.orchestration.MapReduceOrchestrator;
import com.aina.backend.llm.provider.LlmProviderAdapter;
import com.aina.backend.llm.provider.ProviderCallExecutor;
import com.aina.backend.llm.provider.ProviderClientCache;
import com.aina.backend.llm.provider.ProviderCompletion;
import com.aina.backend.llm.provider.ProviderPrompt;
import com.aina.backend.llm.telemetry.AsyncTelemetryDispatcher;
import com.aina.backend.llm.telemetry.CostCalculator;
import com.aina.backend.llm.telemetry.InvocationMetrics;
import com.aina.backend.llm.token.HeuristicTokenEstimator;
import com.aina.backend.llm.token.TokenEstimators;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Sizing scenarios with the Catalan heuristic of 4.5 characters per token. */
class ContextWindowScenariosTest {

  private ContextWindowProperties contextProperties;
  private ExecutorService mapExecutor;
  private final Map<String, LlmProviderAdapter> adapters = new HashMap<>();
  private LlmInvocationService service;

  @BeforeEach
  void setUp() {
    LlmProvidersProperties providersProperties = new LlmProvidersProperties();
    providersProperties.setDefaultProvider("salamandra-4k");
    providersProperties.getProviders().put("salamandra-4k", provider(4096, 512, "alia-32k"));
    providersProperties.getProviders().put("alia-16k", provider(16_384, 8192, "alia-32k"));
    providersProperties.getProviders().put("alia-32k", provider(32_768, 8192));

    contextProperties = new ContextWindowProperties();
    contextProperties.setAutoFallback(true);
    contextProperties.setAutoMapReduce(true);
    contextProperties.setDefaultChunkSize(12_000);
    contextProperties.setDefaultOverlapTokens(500);

    providersProperties.getProviders().keySet().forEach(id -> adapters.put(id, adapter(id)));
    mapExecutor = Executors.newFixedThreadPool(4);

    TokenEstimators estimators = new TokenEstimators(null, new HeuristicTokenEstimator(4.5));
    ModelDescriptorTable table = ModelDescriptorTable.fromProperties(providersProperties);
    ContextBudgetValidator validator = new ContextBudgetValidator(estimators);
    AdaptiveChunkPlanner planner =
        new AdaptiveChunkPlanner(contextProperties, ChunkingStrategies.defaults(), estimators);
    ChunkTargetResolver targetResolver = new ChunkTargetResolver(table, contextProperties);
    ObjectMapper objectMapper = new ObjectMapper();
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    service =
        new LlmInvocationService(
            table,
            validator,
            new FallbackSelector(table, validator),
            new MapReduceOrchestrator(
                planner, validator, targetResolver, contextProperties, mapExecutor, objectMapper),
            new IterativeRefinementOrchestrator(planner, targetResolver),
            new StructuredOutputNormalizer(objectMapper),
            new ProviderClientCache(providersProperties, (providerId, config) -> adapters.get(providerId)),
            new ProviderCallExecutor(providersProperties),
            new AsyncTelemetryDispatcher(List.of(), 100, meterRegistry),
            new CostCalculator(),
            new InvocationMetrics(meterRegistry),
            estimators,
            contextProperties,
            providersProperties);
  }

  @AfterEach
  void tearDown() {
    mapExecutor.shutdownNow();
  }

  @Test
  void threeThousandTokenPromptOnFourKWindowIsSentDirectly() {
    InvocationResult result =
        service.invoke(InvocationRequest.builder().prompt("a".repeat(13_500)).provider("salamandra-4k").build());

    assertThat(result.provider()).isEqualTo("salamandra-4k");
    assertThat(result.fallbackUsed()).isFalse();
    assertThat(result.metadata().strategy()).isEqualTo(InvocationStrategy.DIRECT);
    verify(adapters.get("alia-32k"), never()).complete(any(), any());
  }

  @Test
  void fiftyThousandCharacterDocumentMovesToThirtyTwoKWindow() {
    InvocationResult result =
        service.invoke(InvocationRequest.builder().prompt("a".repeat(50_000)).provider("alia-16k").build());

    assertThat(result.fallbackUsed()).isTrue();
    assertThat(result.provider()).isEqualTo("alia-32k");
    assertThat(result.metadata().originalProvider()).isEqualTo("alia-16k");
    assertThat(result.metadata().fallbackReason()).isEqualTo("context_window_exceeded: 11112 > 8192");
    verify(adapters.get("alia-16k"), never()).complete(any(), any());
  }

  @Test
  void eightyThousandTokenPromptIsMapReducedInAboutSevenChunks() {
    InvocationResult result =
        service.invoke(InvocationRequest.builder().prompt("a".repeat(360_000)).provider("alia-32k").build());

    assertThat(result.metadata().strategy()).isEqualTo(InvocationStrategy.MAP_REDUCE);
    assertThat(result.metadata().totalChunks()).isBetween(7, 8);
    assertThat(result.metadata().originalProvider()).isEqualTo("alia-32k");
    verify(adapters.get("alia-32k"), times(result.metadata().totalChunks() + 1)).complete(any(), any());
  }

  private static LlmProvidersProperties.Provider provider(
      int contextLimit, int maxOutput, String... fallbackChain) {
    LlmProvidersProperties.Provider provider = new LlmProvidersProperties.Provider();
    provider.setType(LlmProviderType.OPENAI_COMPATIBLE);
    provider.setContextLimitTokens(contextLimit);
    provider.setDefaultMaxOutputTokens(maxOutput);
    provider.setTimeout(Duration.ofSeconds(5));
    provider.setFallbackChain(List.of(fallbackChain));
    provider.getPricing().setInputPerMillionTokens(BigDecimal.ONE);
    provider.getPricing().setOutputPerMillionTokens(BigDecimal.ONE);
    return provider;
  }

  private static LlmProviderAdapter adapter(String providerId) {
    LlmProviderAdapter adapter = mock(LlmProviderAdapter.class);
    when(adapter.providerId()).thenReturn(providerId);
    when(adapter.format(any(), any()))
        .thenAnswer(
            invocation -> {
              InvocationRequest request = invocation.getArgument(0);
              return ProviderPrompt.messages(request.systemPrompt(), request.prompt());
            });
    when(adapter.complete(any(), any()))
        .thenReturn(new ProviderCompletion("Resposta de " + providerId, 50, 10, "stop"));
    return adapter;
  }
}
