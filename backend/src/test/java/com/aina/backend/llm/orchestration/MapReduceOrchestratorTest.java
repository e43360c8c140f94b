package com.aina.backend.llm.orchestration;

import static com.aina.backend.llm.LlmTestFixtures.charTokens;
import static com.aina.backend.llm.LlmTestFixtures.descriptor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.chunking.AdaptiveChunkPlanner;
import com.aina.backend.llm.chunking.ChunkStrategyType;
import com.aina.backend.llm.chunking.ChunkingStrategies;
import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.model.InvocationStrategy;
import com.aina.backend.llm.model.MapReduceRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MapReduceOrchestratorTest {

  private ContextWindowProperties properties;
  private ModelDescriptorTable table;
  private ExecutorService mapExecutor;
  private MapReduceOrchestrator orchestrator;
  private final List<InvocationRequest> calls = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    properties = new ContextWindowProperties();
    properties.setInstructionOverheadTokens(0);
    properties.setSafetyMarginRatio(0.0);
    properties.setDefaultOverlapTokens(0);
    properties.setMapConcurrency(2);
    properties.setMaxReduceDepth(2);
    properties.setMapReduceMaxOutputTokens(50);
    properties.setMapReduceProvider("worker");

    table =
        new ModelDescriptorTable(
            List.of(
                descriptor("gemini", 100_000, 1000, false),
                descriptor("worker", 1000, 50, "gemini"),
                descriptor("narrow", 300, 50, "gemini")),
            "gemini");
    AdaptiveChunkPlanner planner =
        new AdaptiveChunkPlanner(properties, ChunkingStrategies.defaults(), charTokens());
    mapExecutor = Executors.newFixedThreadPool(8);
    orchestrator =
        new MapReduceOrchestrator(
            planner,
            new ContextBudgetValidator(charTokens()),
            new ChunkTargetResolver(table, properties),
            properties,
            mapExecutor,
            new ObjectMapper());
  }

  @AfterEach
  void tearDown() {
    orchestrator.shutdown();
  }

  @Test
  void reduceSeesPartialResultsInChunkOrderRegardlessOfCompletionOrder() {
    InvocationResult result =
        orchestrator.run(
            table.require("worker"),
            request(digits(5)),
            (target, request) -> {
              calls.add(request);
              if (request.jsonResponse()) {
                int index = chunkDigit(request);
                sleep((5 - index) * 30L);
                return result(target, "P" + index);
              }
              return result(target, "FINAL");
            });

    InvocationRequest reduce = calls.stream().filter(call -> !call.jsonResponse()).findFirst().orElseThrow();
    String prompt = reduce.prompt();
    assertThat(prompt).startsWith("REDUCE\n\n---\nResults from 5 chunks:\n\n");
    assertThat(prompt.indexOf("P0")).isLessThan(prompt.indexOf("P1"));
    assertThat(prompt.indexOf("P1")).isLessThan(prompt.indexOf("P2"));
    assertThat(prompt.indexOf("P3")).isLessThan(prompt.indexOf("P4"));

    assertThat(result.text()).isEqualTo("FINAL");
    assertThat(result.metadata().strategy()).isEqualTo(InvocationStrategy.MAP_REDUCE);
    assertThat(result.metadata().totalChunks()).isEqualTo(5);
    assertThat(result.metadata().reduceDepth()).isZero();
    assertThat(result.tokensIn()).isEqualTo(60);
    assertThat(result.tokensOut()).isEqualTo(30);
    assertThat(result.costEstimate().totalCost()).isEqualByComparingTo("0.06");
  }

  @Test
  void mapCallsAskForJsonAndCarryChunkMetadata() {
    orchestrator.run(
        table.require("worker"),
        request(digits(3)),
        (target, request) -> {
          calls.add(request);
          return result(target, "ok");
        });

    List<InvocationRequest> maps = calls.stream().filter(InvocationRequest::jsonResponse).toList();
    assertThat(maps).hasSize(3);
    assertThat(maps)
        .allSatisfy(
            map -> {
              assertThat(map.prompt()).startsWith("MAP\n\n---\n");
              assertThat(map.skipAutoStrategies()).isTrue();
              assertThat(map.provider()).isEqualTo("worker");
              assertThat(map.maxOutputTokens()).isEqualTo(50);
              assertThat(map.userId()).isEqualTo("anna");
            });
    assertThat(maps).anySatisfy(map -> assertThat(map.prompt()).endsWith("[Chunk 2/3, ~100 tokens]"));
  }

  @Test
  void concurrentMapCallsAreBoundedByMapConcurrency() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxInFlight = new AtomicInteger();

    orchestrator.run(
        table.require("worker"),
        request(digits(8)),
        (target, request) -> {
          if (request.jsonResponse()) {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            sleep(40);
            inFlight.decrementAndGet();
          }
          return result(target, "ok");
        });

    assertThat(maxInFlight.get()).isBetween(1, 2);
  }

  @Test
  void failedChunkBecomesErrorPlaceholder() {
    InvocationResult result =
        orchestrator.run(
            table.require("worker"),
            request(digits(4)),
            (target, request) -> {
              calls.add(request);
              if (request.jsonResponse() && chunkDigit(request) == 2) {
                throw new ProviderException("worker", ProviderFailureReason.SERVER, 500, "boom");
              }
              return result(target, request.jsonResponse() ? "ok" : "FINAL");
            });

    InvocationRequest reduce = calls.stream().filter(call -> !call.jsonResponse()).findFirst().orElseThrow();
    assertThat(reduce.prompt()).contains("{\"error\":\"Failed to process chunk 3: ");
    assertThat(result.text()).isEqualTo("FINAL");
    // three successful maps and the reduce
    assertThat(result.tokensIn()).isEqualTo(40);
  }

  @Test
  void allMapCallsFailingRethrowsFirstError() {
    assertThatThrownBy(
            () ->
                orchestrator.run(
                    table.require("worker"),
                    request(digits(3)),
                    (target, request) -> {
                      throw new ProviderException(
                          "worker", ProviderFailureReason.TIMEOUT, null, "chunk " + chunkDigit(request));
                    }))
        .isInstanceOf(ProviderException.class)
        .hasMessageContaining("chunk 0");
  }

  @Test
  void oversizedCombinedResultsAreReducedAgain() {
    InvocationResult result =
        orchestrator.run(
            table.require("narrow"),
            request(digits(5)),
            (target, request) -> {
              if (!request.jsonResponse()) {
                return result(target, "FINAL");
              }
              return result(target, request.prompt().startsWith("MAP") ? "y".repeat(100) : "S");
            });

    assertThat(result.text()).isEqualTo("FINAL");
    assertThat(result.metadata().reduceDepth()).isEqualTo(1);
    assertThat(result.metadata().totalChunks()).isEqualTo(5);
  }

  @Test
  void reduceDepthIsBounded() {
    properties.setMaxReduceDepth(1);

    assertThatThrownBy(
            () ->
                orchestrator.run(
                    table.require("narrow"),
                    request(digits(5)),
                    (target, request) -> result(target, "y".repeat(100))))
        .isInstanceOf(ContextWindowExceededException.class);
  }

  @Test
  void providerWithoutChunkSupportIsReplaced() {
    InvocationResult result =
        orchestrator.run(
            table.require("gemini"),
            request(digits(2)),
            (target, request) -> {
              calls.add(request);
              return result(target, "ok");
            });

    assertThat(calls).extracting(InvocationRequest::provider).containsOnly("worker");
    assertThat(result.provider()).isEqualTo("worker");
  }

  private static MapReduceRequest request(String text) {
    InvocationRequest template = InvocationRequest.builder().userId("anna").sessionId("s1").build();
    return new MapReduceRequest(text, "MAP", "REDUCE", template, ChunkStrategyType.FIXED, 100, 0, true);
  }

  /** Chunk {@code i} is made of the digit {@code i}, one hundred times. */
  private static String digits(int chunks) {
    return IntStream.range(0, chunks)
        .mapToObj(i -> String.valueOf(i).repeat(100))
        .collect(Collectors.joining());
  }

  private static int chunkDigit(InvocationRequest request) {
    String prompt = request.prompt();
    return Character.getNumericValue(prompt.charAt(prompt.indexOf("\n---\n") + 5));
  }

  private static InvocationResult result(ModelDescriptor target, String text) {
    return new InvocationResult(
        "req-1",
        text,
        null,
        target.providerId(),
        target.modelVersion(),
        10,
        5,
        20,
        new CostEstimate(new BigDecimal("0.005"), new BigDecimal("0.005"), new BigDecimal("0.01"), "USD"),
        InvocationMetadata.direct());
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
