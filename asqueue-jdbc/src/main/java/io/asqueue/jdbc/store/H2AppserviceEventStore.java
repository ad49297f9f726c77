package io.asqueue.jdbc.store;

import io.asqueue.QueueConfig;
import io.asqueue.jdbc.TableNames;

import java.time.Clock;
import java.util.List;

/**
 * H2 queue store. Primarily for testing.
 */
public final class H2AppserviceEventStore extends AbstractJdbcAppserviceEventStore {

  public H2AppserviceEventStore() {
    super();
  }

  public H2AppserviceEventStore(String tableName) {
    this(tableName, 0, Clock.systemUTC());
  }

  public H2AppserviceEventStore(String tableName, int queryTimeoutSeconds, Clock clock) {
    super(tableName, queryTimeoutSeconds, clock);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2AppserviceEventStore configure(QueueConfig config) {
    return new H2AppserviceEventStore(config.getTableName(), config.getQueryTimeoutSeconds(), clock());
  }

  @Override
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "sequence_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY," +
            "destination_id VARCHAR(255) NOT NULL," +
            "event_id VARCHAR(255) NOT NULL," +
            "origin_server_ts BIGINT NOT NULL," +
            "room_id VARCHAR(255) NOT NULL," +
            "event_type VARCHAR(255) NOT NULL," +
            "sender VARCHAR(255) NOT NULL," +
            "event_content CLOB," +
            "txn_id BIGINT NOT NULL DEFAULT 0)",
        "CREATE INDEX IF NOT EXISTS " + TableNames.destinationIndex(tableName()) +
            " ON " + tableName() + " (destination_id)");
  }
}
