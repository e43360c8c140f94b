package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProvidersProperties;

@FunctionalInterface
public interface ProviderClientFactory {

  LlmProviderAdapter create(String providerId, LlmProvidersProperties.Provider providerConfig);
}
