package com.aina.backend.llm.telemetry;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/** In-memory ring of the latest calls, newest first in every query. */
public class RecentInvocationLog implements TelemetrySink {

  private final int capacity;
  private final Deque<InvocationTelemetryEntry> entries = new ArrayDeque<>();

  public RecentInvocationLog(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void log(InvocationTelemetryEntry entry) {
    entries.addFirst(entry);
    while (entries.size() > capacity) {
      entries.removeLast();
    }
  }

  public List<InvocationTelemetryEntry> recent(int limit) {
    return select(entry -> true, limit);
  }

  public List<InvocationTelemetryEntry> byUser(String userId, int limit) {
    return select(entry -> Objects.equals(entry.userId(), userId), limit);
  }

  public List<InvocationTelemetryEntry> bySession(String sessionId, int limit) {
    return select(entry -> Objects.equals(entry.sessionId(), sessionId), limit);
  }

  public List<InvocationTelemetryEntry> errors(int limit) {
    return select(entry -> !entry.success(), limit);
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized InvocationStats summary() {
    long total = entries.size();
    long successful = 0;
    long latency = 0;
    long tokensIn = 0;
    long tokensOut = 0;
    long fallbacks = 0;
    BigDecimal cost = BigDecimal.ZERO;
    Map<String, ProviderAccumulator> perProvider = new LinkedHashMap<>();
    for (InvocationTelemetryEntry entry : entries) {
      if (entry.success()) {
        successful++;
      }
      if (entry.fallbackUsed()) {
        fallbacks++;
      }
      latency += entry.latencyMs();
      tokensIn += entry.tokensIn();
      tokensOut += entry.tokensOut();
      BigDecimal entryCost = entryCost(entry);
      cost = cost.add(entryCost);
      perProvider.computeIfAbsent(entry.provider(), key -> new ProviderAccumulator()).add(entry, entryCost);
    }
    Map<String, ProviderStats> byProvider = new LinkedHashMap<>();
    perProvider.forEach((provider, accumulator) -> byProvider.put(provider, accumulator.toStats()));
    return new InvocationStats(
        total,
        successful,
        total - successful,
        total == 0 ? 0.0 : (double) successful / total,
        total == 0 ? 0.0 : (double) latency / total,
        tokensIn,
        tokensOut,
        cost,
        fallbacks,
        byProvider);
  }

  private synchronized List<InvocationTelemetryEntry> select(
      Predicate<InvocationTelemetryEntry> filter, int limit) {
    List<InvocationTelemetryEntry> selected = new ArrayList<>();
    Iterator<InvocationTelemetryEntry> iterator = entries.iterator();
    while (iterator.hasNext() && selected.size() < limit) {
      InvocationTelemetryEntry entry = iterator.next();
      if (filter.test(entry)) {
        selected.add(entry);
      }
    }
    return selected;
  }

  private static BigDecimal entryCost(InvocationTelemetryEntry entry) {
    return entry.costEstimate() != null ? entry.costEstimate().totalCost() : BigDecimal.ZERO;
  }

  private static final class ProviderAccumulator {
    private long requests;
    private long errors;
    private long latency;
    private long tokensIn;
    private long tokensOut;
    private BigDecimal cost = BigDecimal.ZERO;

    void add(InvocationTelemetryEntry entry, BigDecimal entryCost) {
      requests++;
      if (!entry.success()) {
        errors++;
      }
      latency += entry.latencyMs();
      tokensIn += entry.tokensIn();
      tokensOut += entry.tokensOut();
      cost = cost.add(entryCost);
    }

    ProviderStats toStats() {
      return new ProviderStats(
          requests, errors, requests == 0 ? 0.0 : (double) latency / requests, tokensIn, tokensOut, cost);
    }
  }
}
