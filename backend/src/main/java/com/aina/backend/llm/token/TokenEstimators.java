package com.aina.backend.llm.token;

import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.knuddels.jtokkit.api.EncodingRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Picks the token estimator for a provider: its configured tokenizer when there is one, the
 * character heuristic otherwise.
 */
public class TokenEstimators {

  private final EncodingRegistry encodingRegistry;
  private final TokenEstimator heuristic;
  private final Map<String, TokenEstimator> byTokenizer = new ConcurrentHashMap<>();

  public TokenEstimators(EncodingRegistry encodingRegistry, TokenEstimator heuristic) {
    this.encodingRegistry = encodingRegistry;
    this.heuristic = heuristic;
  }

  public TokenEstimator forDescriptor(ModelDescriptor descriptor) {
    if (descriptor == null || descriptor.tokenizer() == null || encodingRegistry == null) {
      return heuristic;
    }
    return byTokenizer.computeIfAbsent(
        descriptor.tokenizer(), name -> new JtokkitTokenEstimator(encodingRegistry, name, heuristic));
  }
}
