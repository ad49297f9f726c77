package io.asqueue.jdbc.store;

import io.asqueue.QueueConfig;
import io.asqueue.jdbc.JdbcTemplate;
import io.asqueue.jdbc.TableNames;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * MySQL queue store. Also handles TiDB and MariaDB URLs.
 *
 * <p>MySQL rejects a subquery on the table being deleted from, so {@link #deleteUpToId}
 * uses a multi-table {@code DELETE} joined to the bound row.
 */
public final class MySqlAppserviceEventStore extends AbstractJdbcAppserviceEventStore {

  public MySqlAppserviceEventStore() {
    super();
  }

  public MySqlAppserviceEventStore(String tableName) {
    this(tableName, 0, Clock.systemUTC());
  }

  public MySqlAppserviceEventStore(String tableName, int queryTimeoutSeconds, Clock clock) {
    super(tableName, queryTimeoutSeconds, clock);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public MySqlAppserviceEventStore configure(QueueConfig config) {
    return new MySqlAppserviceEventStore(config.getTableName(), config.getQueryTimeoutSeconds(), clock());
  }

  @Override
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "sequence_id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY," +
            "destination_id VARCHAR(255) NOT NULL," +
            "event_id VARCHAR(255) NOT NULL," +
            "origin_server_ts BIGINT NOT NULL," +
            "room_id VARCHAR(255) NOT NULL," +
            "event_type VARCHAR(255) NOT NULL," +
            "sender VARCHAR(255) NOT NULL," +
            "event_content MEDIUMTEXT," +
            "txn_id BIGINT NOT NULL DEFAULT 0," +
            "INDEX " + TableNames.destinationIndex(tableName()) + " (destination_id)" +
            ") ENGINE=InnoDB DEFAULT CHARSET=utf8mb4");
  }

  @Override
  public int deleteUpToId(Connection conn, String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    String sql = "DELETE queued FROM " + tableName() + " queued" +
        " JOIN " + tableName() + " bound" +
        " ON bound.destination_id=queued.destination_id AND queued.sequence_id<=bound.sequence_id" +
        " WHERE bound.event_id=?";
    return JdbcTemplate.update(conn, queryTimeoutSeconds(), sql, eventId);
  }
}
