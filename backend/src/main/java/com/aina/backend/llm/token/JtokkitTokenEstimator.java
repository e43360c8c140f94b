package com.aina.backend.llm.token;

import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.ModelType;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class JtokkitTokenEstimator implements TokenEstimator {

  private final String tokenizerName;
  private final Encoding encoding;
  private final TokenEstimator fallback;

  public JtokkitTokenEstimator(
      EncodingRegistry encodingRegistry, String tokenizerName, TokenEstimator fallback) {
    this.tokenizerName = tokenizerName;
    this.encoding = resolveEncoding(encodingRegistry, tokenizerName);
    this.fallback = fallback;
  }

  @Override
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    try {
      return encoding.countTokensOrdinary(text);
    } catch (RuntimeException ordinaryFailure) {
      log.debug("Falling back to strict token counting due to {}", ordinaryFailure.getMessage());
      try {
        return encoding.countTokens(text);
      } catch (RuntimeException strictFailure) {
        log.debug(
            "Tokenizer {} failed, using heuristic estimate: {}",
            tokenizerName,
            strictFailure.getMessage());
        return fallback.estimate(text);
      }
    }
  }

  @Override
  public double charsPerToken() {
    return fallback.charsPerToken();
  }

  private static Encoding resolveEncoding(EncodingRegistry registry, String tokenizerName) {
    return registry
        .getEncodingForModel(tokenizerName)
        .orElseGet(
            () ->
                ModelType.fromName(tokenizerName)
                    .map(registry::getEncodingForModel)
                    .orElseGet(
                        () ->
                            EncodingType.fromName(tokenizerName)
                                .map(registry::getEncoding)
                                .orElseGet(
                                    () ->
                                        registry
                                            .getEncoding(tokenizerName)
                                            .orElseThrow(
                                                () ->
                                                    new IllegalArgumentException(
                                                        "Unknown tokenizer '"
                                                            + tokenizerName
                                                            + "', configure a supported tokenizer")))));
  }
}
