package com.aina.backend.llm.health;

import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.descriptor.ModelDescriptor;
import com.aina.backend.llm.descriptor.ModelDescriptorTable;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import com.aina.backend.llm.model.InvocationRequest;
import com.aina.backend.llm.provider.LlmProviderAdapter;
import com.aina.backend.llm.provider.ProviderCallExecutor;
import com.aina.backend.llm.provider.ProviderCallOptions;
import com.aina.backend.llm.provider.ProviderClientCache;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends a minimal prompt to every configured provider in parallel and reports which of them
 * answer. Each check is a real, billed call.
 */
@Slf4j
public class LlmHealthService {

  static final String HEALTH_CHECK_PROMPT = "Respon només: OK";
  static final int HEALTH_CHECK_MAX_TOKENS = 10;
  static final double HEALTH_CHECK_TEMPERATURE = 0.1;

  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

  private final ModelDescriptorTable descriptors;
  private final ProviderClientCache providerClients;
  private final ProviderCallExecutor callExecutor;
  private final LlmProvidersProperties providersProperties;
  private final ExecutorService checkExecutor;

  public LlmHealthService(
      ModelDescriptorTable descriptors,
      ProviderClientCache providerClients,
      ProviderCallExecutor callExecutor,
      LlmProvidersProperties providersProperties) {
    this.descriptors = descriptors;
    this.providerClients = providerClients;
    this.callExecutor = callExecutor;
    this.providersProperties = providersProperties;
    this.checkExecutor =
        Executors.newFixedThreadPool(
            Math.max(1, descriptors.all().size()),
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName("llm-health-" + WORKER_SEQUENCE.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  @PreDestroy
  void shutdown() {
    checkExecutor.shutdownNow();
  }

  public LlmHealthReport check() {
    long start = System.nanoTime();
    log.info("LLM health check started for {} providers", descriptors.all().size());
    List<CompletableFuture<ProviderHealth>> checks =
        descriptors.all().stream()
            .map(descriptor -> CompletableFuture.supplyAsync(() -> check(descriptor), checkExecutor))
            .toList();

    Map<String, ProviderHealth> providers = new LinkedHashMap<>();
    for (CompletableFuture<ProviderHealth> future : checks) {
      ProviderHealth health = future.join();
      providers.put(health.providerId(), health);
    }
    ProviderHealthStatus overall =
        ProviderHealthStatus.overall(providers.values().stream().map(ProviderHealth::status).toList());
    long responseTimeMs = elapsedMillis(start);
    log.info("LLM health check finished: {} in {} ms", overall.code(), responseTimeMs);
    return new LlmHealthReport(Instant.now(), overall, providers, responseTimeMs);
  }

  ProviderHealth check(ModelDescriptor descriptor) {
    String providerId = descriptor.providerId();
    long start = System.nanoTime();
    try {
      LlmProviderAdapter adapter = providerClients.get(providerId);
      ProviderCallOptions options =
          ProviderCallOptions.resolve(
              HEALTH_CHECK_MAX_TOKENS, HEALTH_CHECK_TEMPERATURE, null, false, timeoutOf(providerId));
      InvocationRequest request =
          InvocationRequest.builder().prompt(HEALTH_CHECK_PROMPT).provider(providerId).skipAutoStrategies(true).build();
      callExecutor.execute(providerId, () -> adapter.complete(adapter.format(request, options), options));
      return health(descriptor, ProviderHealthStatus.HEALTHY, providerId + " responded", start);
    } catch (ProviderException ex) {
      log.warn("Health check of {} failed: {}", providerId, ex.getMessage());
      return health(descriptor, statusOf(ex), ex.getMessage(), start);
    } catch (RuntimeException ex) {
      log.error("Health check of {} failed unexpectedly", providerId, ex);
      return health(descriptor, ProviderHealthStatus.ERROR, String.valueOf(ex.getMessage()), start);
    }
  }

  /** Endpoints that are not deployed or not running are unavailable rather than failing. */
  static ProviderHealthStatus statusOf(ProviderException ex) {
    if (ex.reason() == ProviderFailureReason.NETWORK) {
      return ProviderHealthStatus.UNAVAILABLE;
    }
    if (ex.status() != null && ex.status() == 404) {
      return ProviderHealthStatus.UNAVAILABLE;
    }
    String message = ex.getMessage() != null ? ex.getMessage().toLowerCase(Locale.ROOT) : "";
    if (message.contains("not found") || message.contains("not active")) {
      return ProviderHealthStatus.UNAVAILABLE;
    }
    if (ex.reason() == ProviderFailureReason.RATE_LIMIT) {
      return ProviderHealthStatus.DEGRADED;
    }
    return ProviderHealthStatus.ERROR;
  }

  private static ProviderHealth health(
      ModelDescriptor descriptor, ProviderHealthStatus status, String message, long start) {
    return new ProviderHealth(
        descriptor.providerId(),
        descriptor.type(),
        descriptor.modelVersion(),
        status,
        message,
        elapsedMillis(start));
  }

  private Duration timeoutOf(String providerId) {
    LlmProvidersProperties.Provider config = providersProperties.getProviders().get(providerId);
    return config != null ? config.getTimeout() : null;
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
