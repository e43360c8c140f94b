package com.aina.backend.llm.orchestration;

import com.aina.backend.llm.budget.BudgetCheck;
import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.chunking.AdaptiveChunkPlanner;
import com.aina.backend.llm.chunking.Chunk;
import com.aina.backend.llm.chunking.ChunkPlan;
import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.model.InvocationStrategy;
import com.aina.backend.llm.model.MapReduceRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a long text into chunks, runs the map instruction over each chunk in parallel and
 * combines the partial results, in chunk order, with one reduce call.
 */
@Slf4j
public class MapReduceOrchestrator {

  static final String MAP_SEPARATOR = "\n\n---\n";
  static final String RESULTS_SEPARATOR = "\n\n---\n\n";

  private final AdaptiveChunkPlanner planner;
  private final ContextBudgetValidator validator;
  private final ChunkTargetResolver targetResolver;
  private final ContextWindowProperties properties;
  private final ExecutorService mapExecutor;
  private final ObjectMapper objectMapper;

  public MapReduceOrchestrator(
      AdaptiveChunkPlanner planner,
      ContextBudgetValidator validator,
      ChunkTargetResolver targetResolver,
      ContextWindowProperties properties,
      ExecutorService mapExecutor,
      ObjectMapper objectMapper) {
    this.planner = planner;
    this.validator = validator;
    this.targetResolver = targetResolver;
    this.properties = properties;
    this.mapExecutor = mapExecutor;
    this.objectMapper = objectMapper;
  }

  @PreDestroy
  void shutdown() {
    mapExecutor.shutdownNow();
  }

  public InvocationResult run(ModelDescriptor requested, MapReduceRequest request, SubCallInvoker invoker) {
    ModelDescriptor target = targetResolver.resolve(requested);
    return run(target, request, invoker, 0);
  }

  private InvocationResult run(
      ModelDescriptor target, MapReduceRequest request, SubCallInvoker invoker, int depth) {
    int subCallOutputTokens = subCallOutputTokens(request.template());
    ChunkPlan plan =
        planner.plan(
            request.text(),
            target,
            subCallOutputTokens,
            request.chunkStrategy(),
            request.chunkSizeTokens(),
            request.overlapTokens());
    log.info(
        "Map-reduce over {} chunks on {} (depth {}, chunk size {} tokens)",
        plan.size(),
        target.providerId(),
        depth,
        plan.chunkSizeTokens());

    List<MapOutcome> outcomes = mapChunks(target, request, plan, subCallOutputTokens, invoker);

    RuntimeException firstError = null;
    int failures = 0;
    List<String> partials = new ArrayList<>(outcomes.size());
    Usage usage = new Usage();
    for (MapOutcome outcome : outcomes) {
      if (outcome.error() != null) {
        failures++;
        if (firstError == null) {
          firstError = outcome.error();
        }
        partials.add(errorPlaceholder(outcome.index(), outcome.error()));
      } else {
        partials.add(outcome.result().text());
        usage.add(outcome.result());
      }
    }
    if (failures == outcomes.size() && firstError != null) {
      log.warn("All {} map calls failed on {}", failures, target.providerId());
      throw firstError;
    }
    if (failures > 0) {
      log.warn("{} of {} map calls failed on {}", failures, outcomes.size(), target.providerId());
    }

    String combined = String.join(RESULTS_SEPARATOR, partials);
    InvocationRequest reduceRequest =
        request
            .template()
            .toBuilder()
            .prompt(
                request.reduceInstruction()
                    + MAP_SEPARATOR
                    + "Results from "
                    + plan.size()
                    + " chunks:\n\n"
                    + combined)
            .maxOutputTokens(subCallOutputTokens)
            .provider(target.providerId())
            .skipAutoStrategies(true)
            .build();

    BudgetCheck reduceCheck = validator.validate(reduceRequest, target);
    InvocationResult reduced;
    int reduceDepth = depth;
    if (reduceCheck.fits()) {
      reduced = invoker.invoke(target, reduceRequest);
    } else if (depth < properties.getMaxReduceDepth()) {
      log.info(
          "Combined map results do not fit {} ({} > {}), reducing them again",
          target.providerId(),
          reduceCheck.estimatedPromptTokens(),
          reduceCheck.availableInputTokens());
      MapReduceRequest nested =
          request.withText(combined).withInstructions(request.reduceInstruction(), request.reduceInstruction());
      reduced = run(target, nested, invoker, depth + 1);
      reduceDepth = reduced.metadata() != null && reduced.metadata().reduceDepth() != null
          ? reduced.metadata().reduceDepth()
          : depth + 1;
    } else {
      log.warn(
          "Combined map results still exceed {} after {} reduce levels",
          target.providerId(),
          depth);
      throw new ContextWindowExceededException(
          reduceCheck.estimatedPromptTokens(), reduceCheck.availableInputTokens(), target.providerId());
    }
    usage.add(reduced);

    InvocationMetadata metadata =
        InvocationMetadata.direct().withChunks(InvocationStrategy.MAP_REDUCE, plan.size(), reduceDepth);
    return new InvocationResult(
        reduced.requestId(),
        reduced.text(),
        reduced.json(),
        reduced.provider(),
        reduced.modelVersion(),
        usage.tokensIn,
        usage.tokensOut,
        usage.latencyMs,
        usage.cost != null ? usage.cost : reduced.costEstimate(),
        metadata.withJsonRepaired(reduced.metadata() != null && reduced.metadata().jsonRepaired()));
  }

  private List<MapOutcome> mapChunks(
      ModelDescriptor target,
      MapReduceRequest request,
      ChunkPlan plan,
      int subCallOutputTokens,
      SubCallInvoker invoker) {
    Semaphore permits = new Semaphore(Math.max(1, properties.getMapConcurrency()));
    List<Future<MapOutcome>> futures = new ArrayList<>(plan.size());
    try {
      for (Chunk chunk : plan.chunks()) {
        InvocationRequest mapRequest =
            request
                .template()
                .toBuilder()
                .prompt(mapPrompt(request, plan, chunk))
                .jsonResponse(true)
                .maxOutputTokens(subCallOutputTokens)
                .provider(target.providerId())
                .skipAutoStrategies(true)
                .build();
        permits.acquire();
        try {
          futures.add(
              mapExecutor.submit(
                  () -> {
                    try {
                      return MapOutcome.success(chunk.index(), invoker.invoke(target, mapRequest));
                    } catch (RuntimeException ex) {
                      log.warn(
                          "Map call for chunk {}/{} failed: {}",
                          chunk.index() + 1,
                          plan.size(),
                          ex.getMessage());
                      return MapOutcome.failure(chunk.index(), ex);
                    } finally {
                      permits.release();
                    }
                  }));
        } catch (RuntimeException ex) {
          permits.release();
          throw ex;
        }
      }
    } catch (InterruptedException ex) {
      futures.forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while scheduling map calls", ex);
    }

    List<MapOutcome> outcomes = new ArrayList<>(futures.size());
    for (int i = 0; i < futures.size(); i++) {
      outcomes.add(await(futures.get(i), i));
    }
    return outcomes;
  }

  private MapOutcome await(Future<MapOutcome> future, int index) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for map call " + (index + 1), ex);
    } catch (ExecutionException | CancellationException ex) {
      Throwable cause = ex instanceof ExecutionException ? ex.getCause() : ex;
      return MapOutcome.failure(
          index, cause instanceof RuntimeException runtime ? runtime : new IllegalStateException(cause));
    }
  }

  private String mapPrompt(MapReduceRequest request, ChunkPlan plan, Chunk chunk) {
    String prompt = request.mapInstruction() + MAP_SEPARATOR + chunk.text();
    if (request.includeMetadata()) {
      prompt +=
          "\n\n[Chunk "
              + (chunk.index() + 1)
              + "/"
              + plan.size()
              + ", ~"
              + chunk.estimatedTokens()
              + " tokens]";
    }
    return prompt;
  }

  private String errorPlaceholder(int index, RuntimeException error) {
    return objectMapper
        .createObjectNode()
        .put("error", "Failed to process chunk " + (index + 1) + ": " + error.getMessage())
        .toString();
  }

  private int subCallOutputTokens(InvocationRequest template) {
    Integer requested = template.maxOutputTokens();
    return requested != null && requested > 0 ? requested : properties.getMapReduceMaxOutputTokens();
  }

  private record MapOutcome(int index, InvocationResult result, RuntimeException error) {
    static MapOutcome success(int index, InvocationResult result) {
      return new MapOutcome(index, result, null);
    }

    static MapOutcome failure(int index, RuntimeException error) {
      return new MapOutcome(index, null, error);
    }
  }

  private static final class Usage {
    int tokensIn;
    int tokensOut;
    long latencyMs;
    CostEstimate cost;

    void add(InvocationResult result) {
      tokensIn += result.tokensIn();
      tokensOut += result.tokensOut();
      latencyMs += result.latencyMs();
      cost = cost == null ? result.costEstimate() : cost.plus(result.costEstimate());
    }
  }
}
