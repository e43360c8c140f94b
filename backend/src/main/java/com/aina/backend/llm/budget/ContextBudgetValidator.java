package com.aina.backend.llm.budget;

import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.token.TokenEstimators;
import lombok.extern.slf4j.Slf4j;

/** Decides whether a request fits a provider's context window once the output budget is reserved. */
@Slf4j
public class ContextBudgetValidator {

  private final TokenEstimators tokenEstimators;

  public ContextBudgetValidator(TokenEstimators tokenEstimators) {
    this.tokenEstimators = tokenEstimators;
  }

  public BudgetCheck validate(InvocationRequest request, ModelDescriptor descriptor) {
    int estimated = tokenEstimators.forDescriptor(descriptor).estimate(request.fullPromptText());
    int available = descriptor.availableInputTokens(request.maxOutputTokens());
    boolean fits = estimated <= available;
    log.debug(
        "Context budget for {}: estimated={} available={} fits={}",
        descriptor.providerId(),
        estimated,
        available,
        fits);
    return new BudgetCheck(descriptor.providerId(), fits, estimated, available);
  }
}
