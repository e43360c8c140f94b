package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProviderType;
import com.aina.backend.llm.config.LlmProvidersProperties;
import java.time.Duration;

/** Everything that makes two provider clients different. */
public record ProviderClientKey(
    String providerId, LlmProviderType type, String baseUrl, String model, Duration timeout) {

  public static ProviderClientKey of(String providerId, LlmProvidersProperties.Provider config) {
    return new ProviderClientKey(
        providerId, config.getType(), config.getBaseUrl(), config.getModel(), config.getTimeout());
  }
}
