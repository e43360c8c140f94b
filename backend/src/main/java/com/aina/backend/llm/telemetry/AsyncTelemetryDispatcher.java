package com.aina.backend.llm.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Hands telemetry entries to the sinks on a single background worker. {@link #dispatch} never
 * blocks and never throws: a full queue drops the entry.
 */
@Slf4j
public class AsyncTelemetryDispatcher {

  static final String DROPPED_METRIC = "llm.telemetry.dropped";

  private final List<TelemetrySink> sinks;
  private final ThreadPoolExecutor worker;
  private final Counter droppedCounter;
  private final AtomicInteger pending = new AtomicInteger();

  public AsyncTelemetryDispatcher(List<TelemetrySink> sinks, int queueCapacity, MeterRegistry meterRegistry) {
    this.sinks = List.copyOf(sinks);
    this.worker =
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
            runnable -> {
              Thread thread = new Thread(runnable, "llm-telemetry");
              thread.setDaemon(true);
              return thread;
            });
    this.droppedCounter =
        Counter.builder(DROPPED_METRIC)
            .description("Telemetry entries dropped because the dispatch queue was full")
            .register(meterRegistry);
    Gauge.builder("llm.telemetry.queue", worker, executor -> executor.getQueue().size())
        .description("Telemetry entries waiting to be delivered")
        .register(meterRegistry);
  }

  public void dispatch(InvocationTelemetryEntry entry) {
    pending.incrementAndGet();
    try {
      worker.execute(() -> deliver(entry));
    } catch (RejectedExecutionException ex) {
      pending.decrementAndGet();
      droppedCounter.increment();
      log.debug("Telemetry queue full, dropped entry {}", entry.requestId());
    }
  }

  private void deliver(InvocationTelemetryEntry entry) {
    try {
      for (TelemetrySink sink : sinks) {
        try {
          sink.log(entry);
        } catch (RuntimeException ex) {
          log.warn(
              "Telemetry sink {} failed for request {}: {}",
              sink.getClass().getSimpleName(),
              entry.requestId(),
              ex.getMessage());
        }
      }
    } finally {
      pending.decrementAndGet();
    }
  }

  /** Waits until queued entries are delivered; used on shutdown and in tests. */
  public boolean flush(long timeout, TimeUnit unit) {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (System.nanoTime() < deadline) {
      if (pending.get() == 0) {
        return true;
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return pending.get() == 0;
  }

  @PreDestroy
  void shutdown() {
    worker.shutdown();
    try {
      if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
        worker.shutdownNow();
      }
    } catch (InterruptedException ex) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
