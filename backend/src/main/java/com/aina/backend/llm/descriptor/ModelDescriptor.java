package com.aina.backend.llm.descriptor;

import com.aina.backend.llm.config.LlmProviderType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Static capacity and cost facts for one provider.
 *
 * @param costPerInputToken cost of a single prompt token in {@code currency}
 * @param costPerOutputToken cost of a single completion token in {@code currency}
 * @param fallbackChain providers tried in order when a request does not fit this one
 * @param tokenizer jtokkit encoding name, or {@code null} for the character heuristic
 * @param mapReduceCapable whether map/reduce sub-calls may target this provider
 */
public record ModelDescriptor(
    String providerId,
    String displayName,
    LlmProviderType type,
    String modelVersion,
    int contextLimitTokens,
    int defaultMaxOutputTokens,
    BigDecimal costPerInputToken,
    BigDecimal costPerOutputToken,
    String currency,
    List<String> fallbackChain,
    String tokenizer,
    boolean mapReduceCapable) {

  public ModelDescriptor {
    if (!StringUtils.hasText(providerId)) {
      throw new IllegalArgumentException("providerId must not be blank");
    }
    if (defaultMaxOutputTokens <= 0) {
      throw new IllegalArgumentException(
          "defaultMaxOutputTokens must be positive for provider '" + providerId + "'");
    }
    if (contextLimitTokens <= defaultMaxOutputTokens) {
      throw new IllegalArgumentException(
          "contextLimitTokens ("
              + contextLimitTokens
              + ") must exceed defaultMaxOutputTokens ("
              + defaultMaxOutputTokens
              + ") for provider '"
              + providerId
              + "'");
    }
    costPerInputToken = Objects.requireNonNullElse(costPerInputToken, BigDecimal.ZERO);
    costPerOutputToken = Objects.requireNonNullElse(costPerOutputToken, BigDecimal.ZERO);
    if (costPerInputToken.signum() < 0 || costPerOutputToken.signum() < 0) {
      throw new IllegalArgumentException("costs must not be negative for provider '" + providerId + "'");
    }
    currency = StringUtils.hasText(currency) ? currency : "USD";
    fallbackChain = fallbackChain != null ? List.copyOf(fallbackChain) : List.of();
    tokenizer = StringUtils.hasText(tokenizer) ? tokenizer.trim() : null;
    displayName = StringUtils.hasText(displayName) ? displayName : providerId;
  }

  /**
   * Tokens left for the prompt once {@code maxOutputTokens} (or the default output budget) is
   * reserved.
   */
  public int availableInputTokens(Integer maxOutputTokens) {
    return contextLimitTokens - resolveMaxOutputTokens(maxOutputTokens);
  }

  public int resolveMaxOutputTokens(Integer maxOutputTokens) {
    return maxOutputTokens != null && maxOutputTokens > 0 ? maxOutputTokens : defaultMaxOutputTokens;
  }
}
