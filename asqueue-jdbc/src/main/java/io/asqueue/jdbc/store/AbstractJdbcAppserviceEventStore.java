package io.asqueue.jdbc.store;

import io.asqueue.QueueConfig;
import io.asqueue.SourceEvent;
import io.asqueue.jdbc.JdbcTemplate;
import io.asqueue.jdbc.TableNames;
import io.asqueue.model.EventBatch;
import io.asqueue.model.QueuedEvent;
import io.asqueue.spi.AppserviceEventStore;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC queue store with standard SQL implementations.
 *
 * <p>Subclasses supply the DDL for their database and may override
 * {@link #deleteUpToId} where the correlated-subquery delete is not supported. Register
 * custom implementations via
 * {@code META-INF/services/io.asqueue.jdbc.store.AbstractJdbcAppserviceEventStore}.
 *
 * @see JdbcAppserviceEventStores
 */
public abstract class AbstractJdbcAppserviceEventStore implements AppserviceEventStore {
  protected static final String DEFAULT_TABLE = TableNames.DEFAULT_TABLE;

  protected static final String EVENT_COLUMNS =
      "sequence_id, destination_id, event_id, origin_server_ts, room_id, event_type, sender, " +
      "event_content, txn_id";

  private final String tableName;
  private final int queryTimeoutSeconds;
  private final Clock clock;

  protected AbstractJdbcAppserviceEventStore() {
    this(DEFAULT_TABLE, 0, Clock.systemUTC());
  }

  protected AbstractJdbcAppserviceEventStore(String tableName, int queryTimeoutSeconds, Clock clock) {
    this.tableName = TableNames.validate(tableName);
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store using the table name and query timeout of {@code config}.
   */
  public abstract AbstractJdbcAppserviceEventStore configure(QueueConfig config);

  /**
   * Idempotent DDL creating the queue table and its destination index.
   */
  protected abstract List<String> schemaStatements();

  protected String tableName() {
    return tableName;
  }

  protected int queryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  protected Clock clock() {
    return clock;
  }

  /**
   * Creates the queue table and index if they do not exist.
   */
  public void createSchema(Connection conn) {
    for (String statement : schemaStatements()) {
      JdbcTemplate.update(conn, queryTimeoutSeconds, statement);
    }
  }

  @Override
  public long insertEvent(Connection conn, String destinationId, SourceEvent event, long transactionRef) {
    requireDestination(destinationId);
    Objects.requireNonNull(event, "event");
    String sql = "INSERT INTO " + tableName() +
        " (destination_id, event_id, origin_server_ts, room_id, event_type, sender, event_content, txn_id)" +
        " VALUES (?,?,?,?,?,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, queryTimeoutSeconds, "sequence_id", sql,
        destinationId, event.eventId(), event.originServerTs(), event.roomId(),
        event.type(), event.sender(), event.contentJson(), transactionRef);
  }

  @Override
  public int countByDestination(Connection conn, String destinationId) {
    requireDestination(destinationId);
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE destination_id=?";
    List<Long> counts = JdbcTemplate.query(conn, queryTimeoutSeconds, sql,
        rs -> rs.getLong(1), destinationId);
    return counts.isEmpty() ? 0 : Math.toIntExact(counts.get(0));
  }

  @Override
  public EventBatch selectEventsByDestination(Connection conn, String destinationId, int limit) {
    requireDestination(destinationId);
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    String sql = "SELECT " + EVENT_COLUMNS + " FROM " + tableName() +
        " WHERE destination_id=? ORDER BY sequence_id ASC LIMIT ?";
    long now = clock.millis();
    List<QueuedEvent> events = JdbcTemplate.query(conn, queryTimeoutSeconds, sql, rs -> {
      long originServerTs = rs.getLong("origin_server_ts");
      return new QueuedEvent(
          rs.getLong("sequence_id"),
          rs.getString("destination_id"),
          rs.getString("event_id"),
          originServerTs,
          now - originServerTs,
          rs.getString("room_id"),
          rs.getString("event_type"),
          rs.getString("sender"),
          rs.getString("event_content"),
          rs.getLong("txn_id"));
    }, destinationId, limit);
    return new EventBatch(destinationId, events);
  }

  /**
   * Default implementation uses a correlated subquery, which works for H2 and PostgreSQL.
   * MySQL overrides with a self-join {@code DELETE}.
   */
  @Override
  public int deleteUpToId(Connection conn, String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    String sql = "DELETE FROM " + tableName() + " WHERE EXISTS (" +
        "SELECT 1 FROM " + tableName() + " bound" +
        " WHERE bound.event_id=?" +
        " AND bound.destination_id=" + tableName() + ".destination_id" +
        " AND " + tableName() + ".sequence_id<=bound.sequence_id)";
    return JdbcTemplate.update(conn, queryTimeoutSeconds, sql, eventId);
  }

  @Override
  public int deleteUpToSequence(Connection conn, String destinationId, long sequenceId) {
    requireDestination(destinationId);
    String sql = "DELETE FROM " + tableName() + " WHERE destination_id=? AND sequence_id<=?";
    return JdbcTemplate.update(conn, queryTimeoutSeconds, sql, destinationId, sequenceId);
  }

  private static void requireDestination(String destinationId) {
    Objects.requireNonNull(destinationId, "destinationId");
    if (destinationId.isEmpty()) {
      throw new IllegalArgumentException("destinationId cannot be empty");
    }
  }
}
