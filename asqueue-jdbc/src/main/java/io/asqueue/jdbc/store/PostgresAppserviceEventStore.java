package io.asqueue.jdbc.store;

import io.asqueue.QueueConfig;
import io.asqueue.jdbc.TableNames;

import java.time.Clock;
import java.util.List;

/**
 * PostgreSQL queue store. Sequence ids come from a {@code BIGSERIAL} column.
 */
public final class PostgresAppserviceEventStore extends AbstractJdbcAppserviceEventStore {

  public PostgresAppserviceEventStore() {
    super();
  }

  public PostgresAppserviceEventStore(String tableName) {
    this(tableName, 0, Clock.systemUTC());
  }

  public PostgresAppserviceEventStore(String tableName, int queryTimeoutSeconds, Clock clock) {
    super(tableName, queryTimeoutSeconds, clock);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresAppserviceEventStore configure(QueueConfig config) {
    return new PostgresAppserviceEventStore(config.getTableName(), config.getQueryTimeoutSeconds(), clock());
  }

  @Override
  protected List<String> schemaStatements() {
    return List.of(
        "CREATE TABLE IF NOT EXISTS " + tableName() + " (" +
            "sequence_id BIGSERIAL NOT NULL PRIMARY KEY," +
            "destination_id TEXT NOT NULL," +
            "event_id TEXT NOT NULL," +
            "origin_server_ts BIGINT NOT NULL," +
            "room_id TEXT NOT NULL," +
            "event_type TEXT NOT NULL," +
            "sender TEXT NOT NULL," +
            "event_content TEXT," +
            "txn_id BIGINT NOT NULL DEFAULT 0)",
        "CREATE INDEX IF NOT EXISTS " + TableNames.destinationIndex(tableName()) +
            " ON " + tableName() + " (destination_id)");
  }
}
