package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProvidersProperties;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily constructed provider clients, one per {@link ProviderClientKey}. Concurrent first use of
 * a key builds the client once.
 */
public class ProviderClientCache {

  private final LlmProvidersProperties properties;
  private final ProviderClientFactory factory;
  private final Map<ProviderClientKey, LlmProviderAdapter> clients = new ConcurrentHashMap<>();

  public ProviderClientCache(LlmProvidersProperties properties, ProviderClientFactory factory) {
    this.properties = properties;
    this.factory = factory;
  }

  public LlmProviderAdapter get(String providerId) {
    LlmProvidersProperties.Provider config = properties.getProviders().get(providerId);
    if (config == null) {
      throw new IllegalArgumentException("Unknown provider: " + providerId);
    }
    return clients.computeIfAbsent(
        ProviderClientKey.of(providerId, config), key -> factory.create(providerId, config));
  }

  public int size() {
    return clients.size();
  }
}
