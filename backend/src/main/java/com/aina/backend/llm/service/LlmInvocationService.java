package com.aina.backend.llm.service;

import com.aina.backend.llm.budget.BudgetCheck;
import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.config.ContextWindowProperties;
import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.fallback.FallbackCandidate;
import com.aina.backend.llm.fallback.FallbackSelector;
import com.aina.backend.llm.json.NormalizedOutput;
import com.aina.backend.llm.json.StructuredOutputNormalizer;
import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.model.InvocationStrategy;
import com.aina.backend.llm.model.IterativeRefinementRequest;
import com.aina.backend.llm.model.MapReduceRequest;
import com.aina.backend.llm.orchestration.IterativeRefinementOrchestrator;
import com.aina.backend.llm.orchestration.MapReduceInstructions;
import com.aina.backend.llm.orchestration.MapReduceOrchestrator;
import com.aina.backend.llm.orchestration.SubCallInvoker;
import com.aina.backend.llm.provider.LlmProviderAdapter;
import com.aina.backend.llm.provider.ProviderCallExecutor;
import com.aina.backend.llm.provider.ProviderCallOptions;
import com.aina.backend.llm.provider.ProviderClientCache;
import com.aina.backend.llm.provider.ProviderCompletion;
import com.aina.backend.llm.provider.ProviderPrompt;
import com.aina.backend.llm.telemetry.AsyncTelemetryDispatcher;
import com.aina.backend.llm.telemetry.CostCalculator;
import com.aina.backend.llm.telemetry.InvocationMetrics;
import com.aina.backend.llm.telemetry.InvocationTelemetryEntry;
import com.aina.backend.llm.token.TokenEstimator;
import com.aina.backend.llm.token.TokenEstimators;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for every model call. Checks the request against the provider's context window
 * and, when it does not fit, moves it to a larger provider or splits it into chunks before
 * failing with {@link ContextWindowExceededException}.
 */
@Service
public class LlmInvocationService {

  private static final Logger log = LoggerFactory.getLogger(LlmInvocationService.class);

  private final ModelDescriptorTable descriptors;
  private final ContextBudgetValidator budgetValidator;
  private final FallbackSelector fallbackSelector;
  private final MapReduceOrchestrator mapReduceOrchestrator;
  private final IterativeRefinementOrchestrator refinementOrchestrator;
  private final StructuredOutputNormalizer outputNormalizer;
  private final ProviderClientCache providerClients;
  private final ProviderCallExecutor callExecutor;
  private final AsyncTelemetryDispatcher telemetryDispatcher;
  private final CostCalculator costCalculator;
  private final InvocationMetrics metrics;
  private final TokenEstimators tokenEstimators;
  private final ContextWindowProperties contextWindowProperties;
  private final LlmProvidersProperties providersProperties;

  public LlmInvocationService(
      ModelDescriptorTable descriptors,
      ContextBudgetValidator budgetValidator,
      FallbackSelector fallbackSelector,
      MapReduceOrchestrator mapReduceOrchestrator,
      IterativeRefinementOrchestrator refinementOrchestrator,
      StructuredOutputNormalizer outputNormalizer,
      ProviderClientCache providerClients,
      ProviderCallExecutor callExecutor,
      AsyncTelemetryDispatcher telemetryDispatcher,
      CostCalculator costCalculator,
      InvocationMetrics metrics,
      TokenEstimators tokenEstimators,
      ContextWindowProperties contextWindowProperties,
      LlmProvidersProperties providersProperties) {
    this.descriptors = descriptors;
    this.budgetValidator = budgetValidator;
    this.fallbackSelector = fallbackSelector;
    this.mapReduceOrchestrator = mapReduceOrchestrator;
    this.refinementOrchestrator = refinementOrchestrator;
    this.outputNormalizer = outputNormalizer;
    this.providerClients = providerClients;
    this.callExecutor = callExecutor;
    this.telemetryDispatcher = telemetryDispatcher;
    this.costCalculator = costCalculator;
    this.metrics = metrics;
    this.tokenEstimators = tokenEstimators;
    this.contextWindowProperties = contextWindowProperties;
    this.providersProperties = providersProperties;
  }

  public InvocationResult invoke(InvocationRequest request) {
    if (request == null || !StringUtils.hasText(request.prompt())) {
      throw new IllegalArgumentException("prompt must not be empty");
    }
    ModelDescriptor descriptor = descriptors.resolve(request.provider());
    String requestId = UUID.randomUUID().toString();

    BudgetCheck check = budgetValidator.validate(request, descriptor);
    if (check.fits()) {
      return callProvider(descriptor, request, InvocationMetadata.direct(), requestId);
    }

    log.warn(
        "Request {} exceeds the context window of {}: {} > {} tokens",
        requestId,
        descriptor.providerId(),
        check.estimatedPromptTokens(),
        check.availableInputTokens());
    if (request.skipAutoStrategies()) {
      throw new ContextWindowExceededException(
          check.estimatedPromptTokens(), check.availableInputTokens(), descriptor.providerId());
    }

    ProviderException fallbackFailure = null;
    if (contextWindowProperties.isAutoFallback()) {
      Optional<FallbackCandidate> candidate = fallbackSelector.select(request, descriptor, check);
      if (candidate.isPresent()) {
        ModelDescriptor target = candidate.get().descriptor();
        InvocationMetadata metadata =
            InvocationMetadata.direct().withFallback(descriptor.providerId(), candidate.get().reason());
        try {
          InvocationResult result =
              callProvider(
                  target,
                  request.toBuilder().provider(target.providerId()).skipAutoStrategies(true).build(),
                  metadata,
                  requestId);
          metrics.recordFallback(descriptor.providerId(), target.providerId());
          return result;
        } catch (ProviderException ex) {
          log.warn(
              "Fallback from {} to {} failed for request {}: {}",
              descriptor.providerId(),
              target.providerId(),
              requestId,
              ex.getMessage());
          fallbackFailure = ex;
        }
      } else {
        log.info("No fallback provider of {} can hold request {}", descriptor.providerId(), requestId);
      }
    }

    if (contextWindowProperties.isAutoMapReduce()) {
      MapReduceInstructions instructions =
          MapReduceInstructions.forUserTask(request.prompt(), request.systemPrompt());
      InvocationRequest template =
          request.toBuilder().prompt(null).systemPrompt(null).provider(descriptor.providerId()).build();
      MapReduceRequest mapReduceRequest =
          new MapReduceRequest(
              request.prompt(),
              instructions.mapInstruction(),
              instructions.reduceInstruction(),
              template,
              null,
              null,
              null,
              true);
      try {
        log.info("Starting automatic map-reduce for request {} on {}", requestId, descriptor.providerId());
        InvocationResult result = runMapReduce(descriptor, mapReduceRequest, requestId);
        return result.withMetadata(result.metadata().withOriginalProvider(descriptor.providerId()));
      } catch (RuntimeException ex) {
        log.error("Automatic map-reduce failed for request {}: {}", requestId, ex.getMessage());
        throw new ContextWindowExceededException(
            check.estimatedPromptTokens(), check.availableInputTokens(), descriptor.providerId(), ex);
      }
    }

    throw new ContextWindowExceededException(
        check.estimatedPromptTokens(),
        check.availableInputTokens(),
        descriptor.providerId(),
        fallbackFailure);
  }

  public InvocationResult mapReduce(MapReduceRequest request) {
    ModelDescriptor descriptor = descriptors.resolve(request.template().provider());
    return runMapReduce(descriptor, request, UUID.randomUUID().toString());
  }

  public InvocationResult iterativeRefinement(IterativeRefinementRequest request) {
    ModelDescriptor descriptor = descriptors.resolve(request.template().provider());
    String requestId = UUID.randomUUID().toString();
    InvocationResult result =
        refinementOrchestrator.run(
            descriptor, request, subCallInvoker(requestId, InvocationStrategy.ITERATIVE_REFINEMENT));
    return withRequestId(result, requestId);
  }

  public Collection<ModelDescriptor> providers() {
    return descriptors.all();
  }

  public String defaultProvider() {
    return descriptors.defaultProvider();
  }

  private InvocationResult runMapReduce(
      ModelDescriptor descriptor, MapReduceRequest request, String requestId) {
    InvocationResult result =
        mapReduceOrchestrator.run(
            descriptor, request, subCallInvoker(requestId, InvocationStrategy.MAP_REDUCE));
    if (result.metadata() != null && result.metadata().totalChunks() != null) {
      metrics.recordMapReduce(result.provider(), result.metadata().totalChunks());
    }
    log.info(
        "Map-reduce for request {} finished on {}: {} chunks, reduce depth {}",
        requestId,
        result.provider(),
        result.metadata() != null ? result.metadata().totalChunks() : null,
        result.metadata() != null ? result.metadata().reduceDepth() : null);
    return withRequestId(result, requestId);
  }

  private SubCallInvoker subCallInvoker(String requestId, InvocationStrategy strategy) {
    return (target, subRequest) -> {
      BudgetCheck check = budgetValidator.validate(subRequest, target);
      if (!check.fits()) {
        throw new ContextWindowExceededException(
            check.estimatedPromptTokens(), check.availableInputTokens(), target.providerId());
      }
      return callProvider(target, subRequest, InvocationMetadata.of(strategy), requestId);
    };
  }

  private InvocationResult callProvider(
      ModelDescriptor descriptor,
      InvocationRequest request,
      InvocationMetadata metadata,
      String requestId) {
    LlmProviderAdapter adapter = providerClients.get(descriptor.providerId());
    ProviderCallOptions options =
        ProviderCallOptions.resolve(
            descriptor.resolveMaxOutputTokens(request.maxOutputTokens()),
            request.temperature(),
            request.topP(),
            request.jsonResponse(),
            timeoutOf(descriptor));
    ProviderPrompt prompt = adapter.format(request, options);

    long start = System.nanoTime();
    ProviderCompletion completion;
    try {
      completion = callExecutor.execute(descriptor.providerId(), () -> adapter.complete(prompt, options));
    } catch (ProviderException ex) {
      long latencyMs = elapsedMillis(start);
      metrics.recordCall(descriptor.providerId(), false, latencyMs, 0, 0);
      telemetryDispatcher.dispatch(
          telemetryEntry(
              requestId,
              descriptor,
              request,
              metadata,
              0,
              0,
              latencyMs,
              CostEstimate.zero(descriptor.currency()),
              ex.getMessage()));
      throw ex;
    }
    long latencyMs = elapsedMillis(start);

    TokenEstimator estimator = tokenEstimators.forDescriptor(descriptor);
    int tokensIn =
        completion.tokensIn() != null
            ? completion.tokensIn()
            : estimator.estimate(prompt.isRendered() ? prompt.rendered() : request.fullPromptText());
    int tokensOut =
        completion.tokensOut() != null ? completion.tokensOut() : estimator.estimate(completion.text());
    CostEstimate cost = costCalculator.estimate(descriptor, tokensIn, tokensOut);

    JsonNode json = null;
    InvocationMetadata resultMetadata = metadata;
    if (request.jsonResponse()) {
      NormalizedOutput normalized = outputNormalizer.normalize(completion.text());
      json = normalized.json();
      metrics.recordJsonRepair(normalized.stage());
      resultMetadata = metadata.withJsonRepaired(normalized.repaired());
    }

    metrics.recordCall(descriptor.providerId(), true, latencyMs, tokensIn, tokensOut);
    telemetryDispatcher.dispatch(
        telemetryEntry(
            requestId, descriptor, request, metadata, tokensIn, tokensOut, latencyMs, cost, null));
    return new InvocationResult(
        requestId,
        completion.text(),
        json,
        descriptor.providerId(),
        descriptor.modelVersion(),
        tokensIn,
        tokensOut,
        latencyMs,
        cost,
        resultMetadata);
  }

  private InvocationTelemetryEntry telemetryEntry(
      String requestId,
      ModelDescriptor descriptor,
      InvocationRequest request,
      InvocationMetadata metadata,
      int tokensIn,
      int tokensOut,
      long latencyMs,
      CostEstimate cost,
      String error) {
    return new InvocationTelemetryEntry(
        requestId,
        Instant.now(),
        descriptor.providerId(),
        descriptor.modelVersion(),
        request.module(),
        request.userId(),
        request.sessionId(),
        metadata.strategy(),
        tokensIn,
        tokensOut,
        latencyMs,
        cost,
        metadata.fallbackUsed(),
        metadata.originalProvider(),
        metadata.fallbackReason(),
        error);
  }

  private Duration timeoutOf(ModelDescriptor descriptor) {
    LlmProvidersProperties.Provider config = providersProperties.getProviders().get(descriptor.providerId());
    return config != null ? config.getTimeout() : null;
  }

  private static InvocationResult withRequestId(InvocationResult result, String requestId) {
    return new InvocationResult(
        requestId,
        result.text(),
        result.json(),
        result.provider(),
        result.modelVersion(),
        result.tokensIn(),
        result.tokensOut(),
        result.latencyMs(),
        result.costEstimate(),
        result.metadata());
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
