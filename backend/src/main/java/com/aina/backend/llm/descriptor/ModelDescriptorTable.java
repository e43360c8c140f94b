package com.aina.backend.llm.descriptor;

import com.aina.backend.llm.config.LlmProvidersProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.util.StringUtils;

/**
 * Read-only registry of {@link ModelDescriptor}s, validated once at startup.
 */
public class ModelDescriptorTable {

  private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000);
  private static final int COST_SCALE = 12;

  private final Map<String, ModelDescriptor> descriptors;
  private final String defaultProvider;

  public ModelDescriptorTable(Collection<ModelDescriptor> descriptors, String defaultProvider) {
    Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
    for (ModelDescriptor descriptor : descriptors) {
      if (byId.putIfAbsent(descriptor.providerId(), descriptor) != null) {
        throw new IllegalStateException("Duplicate provider descriptor: " + descriptor.providerId());
      }
    }
    if (byId.isEmpty()) {
      throw new IllegalStateException("At least one LLM provider must be configured");
    }
    if (!StringUtils.hasText(defaultProvider) || !byId.containsKey(defaultProvider)) {
      throw new IllegalStateException("Default provider '" + defaultProvider + "' is not configured");
    }
    this.descriptors = Collections.unmodifiableMap(byId);
    this.defaultProvider = defaultProvider;
    validateFallbackChains();
  }

  public static ModelDescriptorTable fromProperties(LlmProvidersProperties properties) {
    List<ModelDescriptor> descriptors = new ArrayList<>(properties.getProviders().size());
    properties
        .getProviders()
        .forEach((providerId, provider) -> descriptors.add(toDescriptor(providerId, provider)));
    return new ModelDescriptorTable(descriptors, properties.getDefaultProvider());
  }

  private static ModelDescriptor toDescriptor(
      String providerId, LlmProvidersProperties.Provider provider) {
    if (provider.getType() == null) {
      throw new IllegalStateException("Provider type must be defined for '" + providerId + "'");
    }
    LlmProvidersProperties.Pricing pricing =
        provider.getPricing() != null ? provider.getPricing() : new LlmProvidersProperties.Pricing();
    try {
      return new ModelDescriptor(
          providerId,
          provider.getDisplayName(),
          provider.getType(),
          StringUtils.hasText(provider.getModel()) ? provider.getModel() : providerId,
          provider.getContextLimitTokens(),
          provider.getDefaultMaxOutputTokens(),
          perToken(pricing.getInputPerMillionTokens()),
          perToken(pricing.getOutputPerMillionTokens()),
          pricing.getCurrency(),
          provider.getFallbackChain(),
          provider.getTokenizer(),
          provider.isMapReduceCapable());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException(ex.getMessage(), ex);
    }
  }

  private static BigDecimal perToken(BigDecimal perMillion) {
    if (perMillion == null) {
      return BigDecimal.ZERO;
    }
    return perMillion.divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP);
  }

  public ModelDescriptor require(String providerId) {
    if (!StringUtils.hasText(providerId)) {
      throw new IllegalArgumentException("Provider identifier must be defined");
    }
    ModelDescriptor descriptor = descriptors.get(providerId);
    if (descriptor == null) {
      throw new IllegalArgumentException("Unknown provider: " + providerId);
    }
    return descriptor;
  }

  public Optional<ModelDescriptor> find(String providerId) {
    return Optional.ofNullable(providerId).map(descriptors::get);
  }

  /**
   * Resolves the requested provider, or the default one when none is requested.
   */
  public ModelDescriptor resolve(String requestedProvider) {
    return require(StringUtils.hasText(requestedProvider) ? requestedProvider : defaultProvider);
  }

  public ModelDescriptor defaultDescriptor() {
    return descriptors.get(defaultProvider);
  }

  public String defaultProvider() {
    return defaultProvider;
  }

  public Collection<ModelDescriptor> all() {
    return descriptors.values();
  }

  public int largestContextLimit() {
    return descriptors.values().stream()
        .mapToInt(ModelDescriptor::contextLimitTokens)
        .max()
        .orElse(0);
  }

  private void validateFallbackChains() {
    for (ModelDescriptor descriptor : descriptors.values()) {
      Set<String> seen = new HashSet<>();
      for (String candidate : descriptor.fallbackChain()) {
        if (!descriptors.containsKey(candidate)) {
          throw new IllegalStateException(
              "Fallback chain of '"
                  + descriptor.providerId()
                  + "' references unknown provider '"
                  + candidate
                  + "'");
        }
        if (candidate.equals(descriptor.providerId())) {
          throw new IllegalStateException(
              "Fallback chain of '" + descriptor.providerId() + "' references itself");
        }
        if (!seen.add(candidate)) {
          throw new IllegalStateException(
              "Fallback chain of '" + descriptor.providerId() + "' repeats '" + candidate + "'");
        }
      }
    }

    Map<String, VisitState> states = new HashMap<>();
    for (String providerId : descriptors.keySet()) {
      detectCycle(providerId, states, new ArrayList<>());
    }

    int largest = largestContextLimit();
    Map<String, Boolean> reachable = new HashMap<>();
    for (ModelDescriptor descriptor : descriptors.values()) {
      if (!reachesLargest(descriptor.providerId(), largest, reachable)) {
        throw new IllegalStateException(
            "Provider '"
                + descriptor.providerId()
                + "' cannot reach a provider with the largest context window ("
                + largest
                + " tokens) through its fallback chain");
      }
    }
  }

  private void detectCycle(String providerId, Map<String, VisitState> states, List<String> path) {
    VisitState state = states.get(providerId);
    if (state == VisitState.DONE) {
      return;
    }
    path.add(providerId);
    if (state == VisitState.IN_PROGRESS) {
      throw new IllegalStateException("Fallback chains contain a cycle: " + String.join(" -> ", path));
    }
    states.put(providerId, VisitState.IN_PROGRESS);
    for (String next : descriptors.get(providerId).fallbackChain()) {
      detectCycle(next, states, path);
    }
    states.put(providerId, VisitState.DONE);
    path.remove(path.size() - 1);
  }

  // the graph is acyclic at this point, so plain recursion terminates
  private boolean reachesLargest(String providerId, int largest, Map<String, Boolean> memo) {
    Boolean cached = memo.get(providerId);
    if (cached != null) {
      return cached;
    }
    ModelDescriptor descriptor = descriptors.get(providerId);
    boolean result = descriptor.contextLimitTokens() == largest;
    if (!result) {
      for (String next : descriptor.fallbackChain()) {
        if (reachesLargest(next, largest, memo)) {
          result = true;
          break;
        }
      }
    }
    memo.put(providerId, result);
    return result;
  }

  private enum VisitState {
    IN_PROGRESS,
    DONE
  }
}
