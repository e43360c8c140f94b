package com.aina.backend.llm.fallback;

import com.aina.backend.llm.budget.BudgetCheck;
import com.aina.backend.llm.descriptor.ModelDescriptor;

/**
 * Provider chosen for an oversized request.
 *
 * @param reason why the original provider was abandoned, {@code context_window_exceeded: X > Y}
 */
public record FallbackCandidate(ModelDescriptor descriptor, BudgetCheck check, String reason) {}
