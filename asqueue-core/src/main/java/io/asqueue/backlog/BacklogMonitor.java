package io.asqueue.backlog;

import io.asqueue.QueueConfig;
import io.asqueue.spi.AppserviceEventStore;
import io.asqueue.spi.ConnectionProvider;
import io.asqueue.spi.QueueMetrics;
import io.asqueue.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that counts the queued rows of a fixed set of destinations and
 * reports them through {@link QueueMetrics#recordBacklog}.
 *
 * <p>Destinations whose backlog reaches {@code warnThreshold} are logged at WARNING on
 * every cycle. A failing cycle is logged and the schedule keeps running.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class BacklogMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BacklogMonitor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AppserviceEventStore store;
  private final QueueMetrics metrics;
  private final List<String> destinations;
  private final int warnThreshold;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private BacklogMonitor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.metrics = builder.metrics == null ? QueueMetrics.NOOP : builder.metrics;
    if (builder.destinations.isEmpty()) {
      throw new IllegalArgumentException("at least one destination is required");
    }
    if (builder.warnThreshold <= 0) {
      throw new IllegalArgumentException("warnThreshold must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.destinations = List.copyOf(builder.destinations);
    this.warnThreshold = builder.warnThreshold;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("BacklogMonitor has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("asqueue-backlog-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, 0L, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Counts every destination once on a single connection and reports the results.
   *
   * @return the counts taken in this cycle, empty if the cycle failed or the monitor is closed
   */
  public Map<String, Integer> runOnce() {
    if (closed) {
      return Map.of();
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      for (String destination : destinations) {
        int count = store.countByDestination(conn, destination);
        counts.put(destination, count);
        metrics.recordBacklog(destination, count);
        if (count >= warnThreshold) {
          logger.log(Level.WARNING, "Backlog for {0} is {1} events (threshold {2})",
              new Object[]{destination, count, warnThreshold});
        }
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Backlog check failed", e);
      return Map.of();
    }
    return counts;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link BacklogMonitor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AppserviceEventStore store;
    private QueueMetrics metrics;
    private final Set<String> destinations = new LinkedHashSet<>();
    private int warnThreshold = QueueConfig.DEFAULT_BACKLOG_WARN_THRESHOLD;
    private long intervalSeconds = QueueConfig.DEFAULT_BACKLOG_INTERVAL_SECONDS;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder store(AppserviceEventStore store) {
      this.store = store;
      return this;
    }

    /** Optional. Defaults to {@link QueueMetrics#NOOP}. */
    public Builder metrics(QueueMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Applies {@link QueueConfig#getBacklogWarnThreshold()} and
     * {@link QueueConfig#getBacklogIntervalSeconds()}. The store's table and query timeout
     * come from the store itself, so configure it with the same {@code config}.
     *
     * @throws IllegalArgumentException if {@code config} does not validate
     */
    public Builder config(QueueConfig config) {
      Objects.requireNonNull(config, "config").validate();
      this.warnThreshold = config.getBacklogWarnThreshold();
      this.intervalSeconds = config.getBacklogIntervalSeconds();
      return this;
    }

    /** Adds a destination to watch. At least one is required. */
    public Builder destination(String destinationId) {
      this.destinations.add(Objects.requireNonNull(destinationId, "destinationId"));
      return this;
    }

    /** Optional. Defaults to {@code 10000}. Must be &gt; 0. */
    public Builder warnThreshold(int warnThreshold) {
      this.warnThreshold = warnThreshold;
      return this;
    }

    /** Optional. Defaults to {@code 60}. Must be &gt; 0. */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public BacklogMonitor build() {
      return new BacklogMonitor(this);
    }
  }
}
