package com.aina.backend.llm.config;

import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.health.LlmHealthService;
import com.aina.backend.llm.provider.DefaultProviderClientFactory;
import com.aina.backend.llm.provider.ProviderCallExecutor;
import com.aina.backend.llm.provider.ProviderClientCache;
import com.aina.backend.llm.provider.ProviderClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(LlmProvidersProperties.class)
public class LlmProviderConfiguration {

  @Bean
  public ModelDescriptorTable modelDescriptorTable(LlmProvidersProperties properties) {
    return ModelDescriptorTable.fromProperties(properties);
  }

  @Bean
  public ProviderClientFactory providerClientFactory(ObjectMapper objectMapper) {
    return new DefaultProviderClientFactory(RestClient.builder(), objectMapper);
  }

  @Bean
  public ProviderClientCache providerClientCache(
      LlmProvidersProperties properties, ProviderClientFactory providerClientFactory) {
    return new ProviderClientCache(properties, providerClientFactory);
  }

  @Bean
  public ProviderCallExecutor providerCallExecutor(LlmProvidersProperties properties) {
    return new ProviderCallExecutor(properties);
  }

  @Bean
  public LlmHealthService llmHealthService(
      ModelDescriptorTable modelDescriptorTable,
      ProviderClientCache providerClientCache,
      ProviderCallExecutor providerCallExecutor,
      LlmProvidersProperties properties) {
    return new LlmHealthService(modelDescriptorTable, providerClientCache, providerCallExecutor, properties);
  }
}
