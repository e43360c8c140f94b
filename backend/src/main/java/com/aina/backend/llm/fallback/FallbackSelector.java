package com.aina.backend.llm.fallback;

import com.aina.backend.llm.budget.BudgetCheck;
import com.aina.backend.llm.budget.ContextBudgetValidator;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.model.InvocationRequest;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class FallbackSelector {

  private final ModelDescriptorTable descriptors;
  private final ContextBudgetValidator validator;

  public FallbackSelector(ModelDescriptorTable descriptors, ContextBudgetValidator validator) {
    this.descriptors = descriptors;
    this.validator = validator;
  }

  /**
   * Walks the fallback chain of {@code original} in order and returns the first provider whose
   * own window holds the request.
   */
  public Optional<FallbackCandidate> select(
      InvocationRequest request, ModelDescriptor original, BudgetCheck originalCheck) {
    for (String candidateId : original.fallbackChain()) {
      ModelDescriptor candidate = descriptors.require(candidateId);
      BudgetCheck check = validator.validate(request, candidate);
      if (check.fits()) {
        log.info(
            "Request does not fit {} ({} > {} tokens), falling back to {}",
            original.providerId(),
            originalCheck.estimatedPromptTokens(),
            originalCheck.availableInputTokens(),
            candidateId);
        return Optional.of(new FallbackCandidate(candidate, check, originalCheck.overflowReason()));
      }
      log.debug(
          "Fallback candidate {} is too small as well ({} > {})",
          candidateId,
          check.estimatedPromptTokens(),
          check.availableInputTokens());
    }
    return Optional.empty();
  }
}
