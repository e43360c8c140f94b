package com.aina.backend.llm.orchestration;

import com.aina.backend.llm.chunking.AdaptiveChunkPlanner;
import com.aina.backend.llm.chunking.Chunk;
import com.aina.backend.llm.chunking.ChunkPlan;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.exception.ContextWindowExceededException;
import com.aina.backend.llm.model.CostEstimate;
import com.aina.backend.llm.model.InvocationMetadata;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.model.InvocationResult;
import com.aina.backend.llm.model.InvocationStrategy;
import com.aina.backend.llm.model.IterativeRefinementRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks the chunks of a long text in order, feeding each step the previous step's answer.
 * Only the latest answer is carried forward, so chunks are sized to leave room for it: a step
 * carries the refine instruction plus a result of up to the output budget.
 */
@Slf4j
public class IterativeRefinementOrchestrator {

  private final AdaptiveChunkPlanner planner;
  private final ChunkTargetResolver targetResolver;

  public IterativeRefinementOrchestrator(AdaptiveChunkPlanner planner, ChunkTargetResolver targetResolver) {
    this.planner = planner;
    this.targetResolver = targetResolver;
  }

  public InvocationResult run(
      ModelDescriptor requested, IterativeRefinementRequest request, SubCallInvoker invoker) {
    ModelDescriptor target = targetResolver.resolve(requested);
    InvocationRequest template = request.template();
    int carriedTokens = carriedTokens(target, request);
    ChunkPlan plan =
        planner.plan(
            request.text(),
            target,
            template.maxOutputTokens(),
            request.chunkStrategy(),
            request.chunkSizeTokens(),
            request.overlapTokens(),
            carriedTokens);
    log.info("Iterative refinement over {} chunks on {}", plan.size(), target.providerId());

    InvocationResult current = null;
    RuntimeException firstError = null;
    int tokensIn = 0;
    int tokensOut = 0;
    long latencyMs = 0;
    CostEstimate cost = null;
    for (Chunk chunk : plan.chunks()) {
      String prompt =
          current == null
              ? initialPrompt(request.initialInstruction(), chunk.text())
              : refinePrompt(request.refineInstruction(), current.text(), chunk.text());
      InvocationRequest step =
          template
              .toBuilder()
              .prompt(prompt)
              .provider(target.providerId())
              .skipAutoStrategies(true)
              .build();
      try {
        InvocationResult result = invoker.invoke(target, step);
        tokensIn += result.tokensIn();
        tokensOut += result.tokensOut();
        latencyMs += result.latencyMs();
        cost = cost == null ? result.costEstimate() : cost.plus(result.costEstimate());
        current = result;
      } catch (ContextWindowExceededException ex) {
        log.warn(
            "Refinement step {}/{} does not fit {}: {}",
            chunk.index() + 1,
            plan.size(),
            target.providerId(),
            ex.getMessage());
        throw ex;
      } catch (RuntimeException ex) {
        log.warn(
            "Refinement step {}/{} failed, keeping previous result: {}",
            chunk.index() + 1,
            plan.size(),
            ex.getMessage());
        if (firstError == null) {
          firstError = ex;
        }
      }
    }
    if (current == null) {
      if (firstError != null) {
        throw firstError;
      }
      throw new IllegalArgumentException("text produced no chunks");
    }

    InvocationMetadata metadata =
        InvocationMetadata.direct()
            .withChunks(InvocationStrategy.ITERATIVE_REFINEMENT, plan.size(), null)
            .withJsonRepaired(current.metadata() != null && current.metadata().jsonRepaired());
    return new InvocationResult(
        current.requestId(),
        current.text(),
        current.json(),
        current.provider(),
        current.modelVersion(),
        tokensIn,
        tokensOut,
        latencyMs,
        cost,
        metadata);
  }

  private int carriedTokens(ModelDescriptor target, IterativeRefinementRequest request) {
    InvocationRequest template = request.template();
    int initial =
        planner.estimateTokens(
            target,
            template.toBuilder().prompt(initialPrompt(request.initialInstruction(), "")).build().fullPromptText());
    int refine =
        planner.estimateTokens(
                target,
                template
                    .toBuilder()
                    .prompt(refinePrompt(request.refineInstruction(), "", ""))
                    .build()
                    .fullPromptText())
            + target.resolveMaxOutputTokens(template.maxOutputTokens());
    return Math.max(initial, refine);
  }

  private static String initialPrompt(String instruction, String chunk) {
    return instruction + "\n\n---\n" + chunk;
  }

  private static String refinePrompt(String instruction, String currentResult, String chunk) {
    return instruction
        + "\n\nCurrent result:\n"
        + currentResult
        + "\n\n---\nNew chunk to process:\n"
        + chunk;
  }
}
