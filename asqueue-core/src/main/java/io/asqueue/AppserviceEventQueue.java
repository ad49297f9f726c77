package io.asqueue;

import io.asqueue.model.EventBatch;
import io.asqueue.spi.AppserviceEventStore;
import io.asqueue.spi.ConnectionProvider;
import io.asqueue.spi.QueueMetrics;
import io.asqueue.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point used by producers and delivery workers.
 *
 * <p>Producers call {@link #enqueue} / {@link #enqueueAll}. When a transaction is active on
 * the configured {@link TxContext} the rows are written on its connection and become visible
 * only when that transaction commits; otherwise the queue writes on its own connection.
 *
 * <p>A delivery worker loops over {@link #nextBatch(String)}, pushes the batch to the
 * appservice, and calls {@link #acknowledge(EventBatch)} only after the whole batch was
 * accepted. On failure it acknowledges nothing, so the next read returns the same rows.
 * Acknowledgement must be serialized per destination (one worker per destination).
 *
 * <pre>{@code
 * var queue = AppserviceEventQueue.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .txContext(txContext)
 *     .store(JdbcAppserviceEventStores.detect(dataSource))
 *     .build();
 *
 * txManager.withTransaction(conn -> queue.enqueue("irc-bridge", event));
 *
 * EventBatch batch = queue.nextBatch("irc-bridge");
 * if (!batch.isEmpty() && push(batch)) {
 *     queue.acknowledge(batch);
 * }
 * }</pre>
 */
public final class AppserviceEventQueue {
  private static final Logger logger = Logger.getLogger(AppserviceEventQueue.class.getName());

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;
  private final AppserviceEventStore store;
  private final QueueMetrics metrics;
  private final QueueConfig config;

  private AppserviceEventQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.txContext = builder.txContext;
    this.metrics = builder.metrics == null ? QueueMetrics.NOOP : builder.metrics;
    this.config = (builder.config == null ? new QueueConfig() : builder.config).validate();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Queues {@code event} for one appservice.
   *
   * @throws SQLException if a connection cannot be obtained outside a transaction
   */
  public void enqueue(String destinationId, SourceEvent event) throws SQLException {
    enqueueAll(List.of(destinationId), event);
  }

  /**
   * Queues {@code event} once for each destination. The fan-out is atomic: either every
   * destination receives a row or none does.
   *
   * @return the number of rows written
   * @throws SQLException if a connection cannot be obtained or committed outside a transaction
   */
  public int enqueueAll(Collection<String> destinationIds, SourceEvent event) throws SQLException {
    Objects.requireNonNull(destinationIds, "destinationIds");
    Objects.requireNonNull(event, "event");
    if (destinationIds.isEmpty()) {
      return 0;
    }
    List<String> targets = List.copyOf(destinationIds);

    if (txContext != null && txContext.isTransactionActive()) {
      int inserted = store.insertBatch(txContext.currentConnection(), targets, event);
      txContext.afterCommit(() -> recordEnqueued(targets));
      return inserted;
    }

    int inserted;
    try (Connection conn = connectionProvider.getConnection()) {
      if (targets.size() == 1) {
        conn.setAutoCommit(true);
        store.insertEvent(conn, targets.get(0), event);
        inserted = 1;
      } else {
        inserted = insertAtomically(conn, targets, event);
      }
    }
    recordEnqueued(targets);
    return inserted;
  }

  /**
   * Reads the oldest {@link QueueConfig#getBatchSize()} events queued for a destination.
   */
  public EventBatch nextBatch(String destinationId) throws SQLException {
    return nextBatch(destinationId, config.getBatchSize());
  }

  /**
   * Reads up to {@code limit} of the oldest events queued for a destination, capped at
   * {@link QueueConfig#getMaxBatchSize()}. Does not remove anything.
   *
   * @throws IllegalArgumentException if {@code limit <= 0}
   */
  public EventBatch nextBatch(String destinationId, int limit) throws SQLException {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    int effective = Math.min(limit, config.getMaxBatchSize());
    EventBatch batch;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      batch = store.selectEventsByDestination(conn, destinationId, effective);
    }
    metrics.recordBatchSize(destinationId, batch.size());
    logger.log(Level.FINE, "Read {0} events for {1}", new Object[]{batch.size(), destinationId});
    return batch;
  }

  /**
   * Removes a delivered batch from its destination's queue.
   *
   * @return the number of rows deleted; {@code 0} for an empty or already acknowledged batch
   */
  public int acknowledge(EventBatch batch) throws SQLException {
    Objects.requireNonNull(batch, "batch");
    if (batch.isEmpty()) {
      return 0;
    }
    int deleted;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      deleted = store.deleteUpToSequence(conn, batch.destinationId(), batch.lastSequenceId());
    }
    if (deleted > 0) {
      metrics.incrementAcknowledged(batch.destinationId(), deleted);
    }
    logger.log(Level.FINE, "Acknowledged {0} events for {1} up to sequence {2}",
        new Object[]{deleted, batch.destinationId(), batch.lastSequenceId()});
    return deleted;
  }

  /**
   * Returns the number of events waiting for a destination.
   */
  public int backlog(String destinationId) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return store.countByDestination(conn, destinationId);
    }
  }

  private int insertAtomically(Connection conn, List<String> targets, SourceEvent event)
      throws SQLException {
    conn.setAutoCommit(false);
    boolean committed = false;
    try {
      int inserted = store.insertBatch(conn, targets, event);
      conn.commit();
      committed = true;
      return inserted;
    } finally {
      if (!committed) {
        rollbackQuietly(conn);
      }
      restoreAutoCommit(conn);
    }
  }

  private void restoreAutoCommit(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to restore auto-commit after fan-out insert", e);
    }
  }

  private void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback of fan-out insert failed", e);
    }
  }

  private void recordEnqueued(List<String> destinationIds) {
    for (String destinationId : destinationIds) {
      try {
        metrics.incrementEnqueued(destinationId);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "QueueMetrics.incrementEnqueued failed", e);
      }
    }
  }

  /** Builder for {@link AppserviceEventQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private AppserviceEventStore store;
    private QueueMetrics metrics;
    private QueueConfig config;

    private Builder() {}

    /**
     * Connections used for reads, truncation and writes outside a transaction.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Transaction context that producer writes join when active. Optional; without it every
     * write uses its own connection.
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
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

    /** Optional. Defaults to {@code new QueueConfig()}. */
    public Builder config(QueueConfig config) {
      this.config = config;
      return this;
    }

    /**
     * @throws NullPointerException if {@code connectionProvider} or {@code store} is null
     * @throws IllegalArgumentException if the config is invalid
     */
    public AppserviceEventQueue build() {
      return new AppserviceEventQueue(this);
    }
  }
}
