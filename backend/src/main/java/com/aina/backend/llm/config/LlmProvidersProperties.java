package com.aina.backend.llm.config;

import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.llm")
@Validated
public class LlmProvidersProperties {

  /**
   * Identifier of the provider used when the caller does not explicitly request one.
   */
  @NotBlank private String defaultProvider;

  private Map<String, Provider> providers = new LinkedHashMap<>();

  /**
   * Worker threads shared by all blocking provider calls.
   */
  private int callConcurrency = 16;

  private int callQueueCapacity = 256;

  public String getDefaultProvider() {
    return defaultProvider;
  }

  public void setDefaultProvider(String defaultProvider) {
    this.defaultProvider = defaultProvider;
  }

  public Map<String, Provider> getProviders() {
    return providers;
  }

  public void setProviders(Map<String, Provider> providers) {
    this.providers = providers;
  }

  public int getCallConcurrency() {
    return callConcurrency;
  }

  public void setCallConcurrency(int callConcurrency) {
    this.callConcurrency = callConcurrency;
  }

  public int getCallQueueCapacity() {
    return callQueueCapacity;
  }

  public void setCallQueueCapacity(int callQueueCapacity) {
    this.callQueueCapacity = callQueueCapacity;
  }

  public static class Provider {

    private LlmProviderType type;
    private String displayName;
    private String baseUrl;
    private String apiKey;
    private String completionsPath;
    private String model;
    private Duration timeout = Duration.ofSeconds(60);

    /**
     * Combined input and output token budget accepted per call.
     */
    private int contextLimitTokens;

    /**
     * Output budget reserved when the request does not carry its own.
     */
    private int defaultMaxOutputTokens = 4096;

    /**
     * Optional jtokkit encoding used for token counting; the character heuristic is used when
     * empty.
     */
    private String tokenizer;

    /**
     * Whether map/reduce sub-calls may be sent to this provider. When false the orchestrators
     * substitute {@code app.llm.context-window.map-reduce-provider}.
     */
    private boolean mapReduceCapable = true;

    private List<String> fallbackChain = new ArrayList<>();
    private Pricing pricing = new Pricing();
    private Retry retry = new Retry();

    public LlmProviderType getType() {
      return type;
    }

    public void setType(LlmProviderType type) {
      this.type = type;
    }

    public String getDisplayName() {
      return displayName;
    }

    public void setDisplayName(String displayName) {
      this.displayName = displayName;
    }

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(String apiKey) {
      this.apiKey = apiKey;
    }

    public String getCompletionsPath() {
      return completionsPath;
    }

    public void setCompletionsPath(String completionsPath) {
      this.completionsPath = completionsPath;
    }

    public String getModel() {
      return model;
    }

    public void setModel(String model) {
      this.model = model;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getContextLimitTokens() {
      return contextLimitTokens;
    }

    public void setContextLimitTokens(int contextLimitTokens) {
      this.contextLimitTokens = contextLimitTokens;
    }

    public int getDefaultMaxOutputTokens() {
      return defaultMaxOutputTokens;
    }

    public void setDefaultMaxOutputTokens(int defaultMaxOutputTokens) {
      this.defaultMaxOutputTokens = defaultMaxOutputTokens;
    }

    public String getTokenizer() {
      return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
      this.tokenizer = tokenizer;
    }

    public boolean isMapReduceCapable() {
      return mapReduceCapable;
    }

    public void setMapReduceCapable(boolean mapReduceCapable) {
      this.mapReduceCapable = mapReduceCapable;
    }

    public List<String> getFallbackChain() {
      return fallbackChain;
    }

    public void setFallbackChain(List<String> fallbackChain) {
      this.fallbackChain = fallbackChain;
    }

    public Pricing getPricing() {
      return pricing;
    }

    public void setPricing(Pricing pricing) {
      this.pricing = pricing;
    }

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }
  }

  public static class Pricing {
    private BigDecimal inputPerMillionTokens = BigDecimal.ZERO;
    private BigDecimal outputPerMillionTokens = BigDecimal.ZERO;
    private String currency = "USD";

    public BigDecimal getInputPerMillionTokens() {
      return inputPerMillionTokens;
    }

    public void setInputPerMillionTokens(BigDecimal inputPerMillionTokens) {
      this.inputPerMillionTokens = inputPerMillionTokens;
    }

    public BigDecimal getOutputPerMillionTokens() {
      return outputPerMillionTokens;
    }

    public void setOutputPerMillionTokens(BigDecimal outputPerMillionTokens) {
      this.outputPerMillionTokens = outputPerMillionTokens;
    }

    public String getCurrency() {
      return currency;
    }

    public void setCurrency(String currency) {
      this.currency = currency;
    }
  }

  public static class Retry {

    /**
     * Total attempts per provider call, the first one included.
     */
    private int maxAttempts = 2;

    private Duration initialDelay = Duration.ofMillis(500);
    private Double multiplier = 2.0;
    private Duration maxDelay = Duration.ofSeconds(10);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialDelay() {
      return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
    }

    public Double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(Double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }
  }
}
