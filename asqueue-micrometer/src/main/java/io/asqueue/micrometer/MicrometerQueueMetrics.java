package io.asqueue.micrometer;

import io.asqueue.spi.QueueMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link QueueMetrics}.
 *
 * <p>Meters are created lazily per destination and tagged {@code destination=<id>}:
 * <ul>
 *   <li>{@code asqueue.events.enqueued}: counter, events queued</li>
 *   <li>{@code asqueue.events.acknowledged}: counter, rows removed after delivery</li>
 *   <li>{@code asqueue.batch.size}: distribution summary, events per read</li>
 *   <li>{@code asqueue.backlog}: gauge, last observed queue depth</li>
 * </ul>
 */
public final class MicrometerQueueMetrics implements QueueMetrics, AutoCloseable {
  private static final String DESTINATION_TAG = "destination";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, Counter> enqueued = new ConcurrentHashMap<>();
  private final Map<String, Counter> acknowledged = new ConcurrentHashMap<>();
  private final Map<String, DistributionSummary> batchSizes = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> backlogs = new ConcurrentHashMap<>();
  private final List<Meter> gauges = new ArrayList<>();
  private volatile boolean closed;

  public MicrometerQueueMetrics(MeterRegistry registry) {
    this(registry, "asqueue");
  }

  /**
   * @param namePrefix prefix for all meter names (e.g. {@code "homeserver.asqueue"})
   */
  public MicrometerQueueMetrics(MeterRegistry registry, String namePrefix) {
    this.registry = Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.namePrefix = namePrefix;
  }

  @Override
  public void incrementEnqueued(String destinationId) {
    if (closed) return;
    enqueued.computeIfAbsent(destinationId, id -> Counter.builder(namePrefix + ".events.enqueued")
        .description("Events queued for an appservice")
        .tag(DESTINATION_TAG, id)
        .register(registry)).increment();
  }

  @Override
  public void incrementAcknowledged(String destinationId, int rows) {
    if (closed) return;
    acknowledged.computeIfAbsent(destinationId, id -> Counter.builder(namePrefix + ".events.acknowledged")
        .description("Queued events removed after delivery")
        .tag(DESTINATION_TAG, id)
        .register(registry)).increment(rows);
  }

  @Override
  public void recordBacklog(String destinationId, int count) {
    if (closed) return;
    backlogs.computeIfAbsent(destinationId, this::registerBacklogGauge).set(count);
  }

  @Override
  public void recordBatchSize(String destinationId, int size) {
    if (closed) return;
    batchSizes.computeIfAbsent(destinationId, id -> DistributionSummary.builder(namePrefix + ".batch.size")
        .description("Events returned per batch read")
        .tag(DESTINATION_TAG, id)
        .register(registry)).record(size);
  }

  private AtomicInteger registerBacklogGauge(String destinationId) {
    AtomicInteger value = new AtomicInteger();
    Gauge gauge = Gauge.builder(namePrefix + ".backlog", value, AtomicInteger::get)
        .description("Events waiting for delivery")
        .tag(DESTINATION_TAG, destinationId)
        .register(registry);
    synchronized (gauges) {
      gauges.add(gauge);
    }
    return value;
  }

  /**
   * Removes every meter registered by this instance from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.addAll(enqueued.values());
    meters.addAll(acknowledged.values());
    meters.addAll(batchSizes.values());
    synchronized (gauges) {
      meters.addAll(gauges);
    }
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
