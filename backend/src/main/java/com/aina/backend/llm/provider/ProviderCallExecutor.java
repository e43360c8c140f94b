package com.aina.backend.llm.provider;

import com.aina.backend.llm.config.LlmProvidersProperties;
import com.aina.backend.llm.exception.ProviderException;
import com.aina.backend.llm.exception.ProviderFailureReason;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

/**
 * Runs blocking provider calls on a bounded pool with a per-provider timeout and a bounded,
 * exponentially backed-off retry of transient failures.
 */
@Slf4j
public class ProviderCallExecutor {

  private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();
  private static final long MAX_BACKOFF_MS = 30_000L;
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  private final LlmProvidersProperties properties;
  private final ThreadPoolExecutor callExecutor;
  private final ConcurrentMap<String, RetryTemplate> retryTemplates = new ConcurrentHashMap<>();

  public ProviderCallExecutor(LlmProvidersProperties properties) {
    this.properties = properties;
    this.callExecutor =
        buildExecutor(
            Math.max(1, properties.getCallConcurrency()), Math.max(1, properties.getCallQueueCapacity()));
  }

  @PreDestroy
  void shutdown() {
    callExecutor.shutdownNow();
  }

  public ProviderCompletion execute(String providerId, Supplier<ProviderCompletion> call) {
    LlmProvidersProperties.Provider config = properties.getProviders().get(providerId);
    Duration timeout = config != null && config.getTimeout() != null ? config.getTimeout() : DEFAULT_TIMEOUT;
    RetryTemplate retryTemplate =
        retryTemplates.computeIfAbsent(providerId, key -> buildRetryTemplate(config));
    return retryTemplate.execute(
        context -> {
          logAttempt(context, providerId);
          return callWithTimeout(providerId, call, timeout);
        });
  }

  private ProviderCompletion callWithTimeout(
      String providerId, Supplier<ProviderCompletion> call, Duration timeout) {
    Future<ProviderCompletion> future;
    try {
      future = callExecutor.submit(call::get);
    } catch (RejectedExecutionException ex) {
      throw new ProviderException(
          providerId, ProviderFailureReason.UNKNOWN, null, "provider call queue is full", ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.warn("Provider {} did not answer within {} ms", providerId, timeout.toMillis());
      throw ProviderException.timeout(providerId, timeout.toMillis());
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new ProviderException(
          providerId, ProviderFailureReason.UNKNOWN, null, "interrupted while waiting for provider", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw ProviderErrors.translate(providerId, runtimeException);
      }
      throw new ProviderException(
          providerId, ProviderFailureReason.UNKNOWN, null, String.valueOf(cause), cause);
    }
  }

  private RetryTemplate buildRetryTemplate(LlmProvidersProperties.Provider config) {
    LlmProvidersProperties.Retry retryConfig = config != null ? config.getRetry() : null;

    int attempts = retryConfig != null ? Math.max(1, retryConfig.getMaxAttempts()) : 2;
    long initialInterval =
        retryConfig != null && retryConfig.getInitialDelay() != null
            ? Math.max(1L, retryConfig.getInitialDelay().toMillis())
            : 500L;
    Double configuredMultiplier = retryConfig != null ? retryConfig.getMultiplier() : null;
    double multiplier =
        configuredMultiplier != null && configuredMultiplier > 1.0 ? configuredMultiplier : 2.0;
    long maxInterval =
        retryConfig != null && retryConfig.getMaxDelay() != null
            ? Math.min(MAX_BACKOFF_MS, Math.max(initialInterval, retryConfig.getMaxDelay().toMillis()))
            : MAX_BACKOFF_MS;

    RetryTemplateBuilder builder =
        RetryTemplate.builder()
            .maxAttempts(attempts)
            .exponentialBackoff(initialInterval, multiplier, maxInterval)
            .retryOn(ProviderCallExecutor::isRetryable);
    return builder.build();
  }

  private static boolean isRetryable(Throwable throwable) {
    return throwable instanceof ProviderException providerException && providerException.isRetryable();
  }

  private void logAttempt(RetryContext context, String providerId) {
    int attempt = context != null ? context.getRetryCount() + 1 : 1;
    if (attempt > 1) {
      Throwable last = context.getLastThrowable();
      log.info(
          "Retrying provider {} (attempt {}) after: {}",
          providerId,
          attempt,
          last != null ? last.getMessage() : "unknown error");
    }
  }

  private ThreadPoolExecutor buildExecutor(int concurrency, int queueSize) {
    BlockingQueue<Runnable> queue = new ArrayBlockingQueue<>(queueSize, true);
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("llm-call-" + WORKER_SEQUENCE.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new ThreadPoolExecutor(concurrency, concurrency, 0L, TimeUnit.MILLISECONDS, queue, factory);
  }
}
