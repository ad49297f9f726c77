package io.asqueue;

import java.util.Objects;
import java.util.Properties;

/**
 * Tunables shared by the queue facade, the JDBC stores and the backlog monitor.
 *
 * <p>Setters are fluent. {@link #fromProperties(Properties)} reads the {@code asqueue.*} keys;
 * keys that are absent keep their defaults.
 */
public final class QueueConfig {
  public static final String DEFAULT_TABLE_NAME = "appservice_events";
  public static final int DEFAULT_BACKLOG_WARN_THRESHOLD = 10_000;
  public static final long DEFAULT_BACKLOG_INTERVAL_SECONDS = 60L;

  static final String TABLE_NAME_KEY = "asqueue.table-name";
  static final String BATCH_SIZE_KEY = "asqueue.batch-size";
  static final String MAX_BATCH_SIZE_KEY = "asqueue.max-batch-size";
  static final String QUERY_TIMEOUT_KEY = "asqueue.query-timeout-seconds";
  static final String BACKLOG_WARN_KEY = "asqueue.backlog.warn-threshold";
  static final String BACKLOG_INTERVAL_KEY = "asqueue.backlog.interval-seconds";

  private String tableName = DEFAULT_TABLE_NAME;
  private int batchSize = 50;
  private int maxBatchSize = 1000;
  private int queryTimeoutSeconds = 0;
  private int backlogWarnThreshold = DEFAULT_BACKLOG_WARN_THRESHOLD;
  private long backlogIntervalSeconds = DEFAULT_BACKLOG_INTERVAL_SECONDS;

  public static QueueConfig fromProperties(Properties properties) {
    Objects.requireNonNull(properties, "properties");
    QueueConfig config = new QueueConfig();
    String table = properties.getProperty(TABLE_NAME_KEY);
    if (table != null) {
      config.setTableName(table.trim());
    }
    config.setBatchSize(intProperty(properties, BATCH_SIZE_KEY, config.batchSize));
    config.setMaxBatchSize(intProperty(properties, MAX_BATCH_SIZE_KEY, config.maxBatchSize));
    config.setQueryTimeoutSeconds(intProperty(properties, QUERY_TIMEOUT_KEY, config.queryTimeoutSeconds));
    config.setBacklogWarnThreshold(intProperty(properties, BACKLOG_WARN_KEY, config.backlogWarnThreshold));
    config.setBacklogIntervalSeconds(
        intProperty(properties, BACKLOG_INTERVAL_KEY, (int) config.backlogIntervalSeconds));
    config.validate();
    return config;
  }

  public String getTableName() {
    return tableName;
  }

  public QueueConfig setTableName(String tableName) {
    this.tableName = Objects.requireNonNull(tableName, "tableName");
    return this;
  }

  /** Default number of events handed to a delivery worker per read. */
  public int getBatchSize() {
    return batchSize;
  }

  public QueueConfig setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  /** Upper bound applied to caller-supplied limits. */
  public int getMaxBatchSize() {
    return maxBatchSize;
  }

  public QueueConfig setMaxBatchSize(int maxBatchSize) {
    this.maxBatchSize = maxBatchSize;
    return this;
  }

  /** Statement timeout in seconds; {@code 0} means no timeout. */
  public int getQueryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  public QueueConfig setQueryTimeoutSeconds(int queryTimeoutSeconds) {
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    return this;
  }

  /** Backlog at or above which {@code BacklogMonitor} logs a warning. */
  public int getBacklogWarnThreshold() {
    return backlogWarnThreshold;
  }

  public QueueConfig setBacklogWarnThreshold(int backlogWarnThreshold) {
    this.backlogWarnThreshold = backlogWarnThreshold;
    return this;
  }

  /** Delay between {@code BacklogMonitor} cycles. */
  public long getBacklogIntervalSeconds() {
    return backlogIntervalSeconds;
  }

  public QueueConfig setBacklogIntervalSeconds(long backlogIntervalSeconds) {
    this.backlogIntervalSeconds = backlogIntervalSeconds;
    return this;
  }

  /**
   * Checks cross-field constraints.
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public QueueConfig validate() {
    if (tableName.isEmpty()) {
      throw new IllegalArgumentException("tableName cannot be empty");
    }
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (maxBatchSize < batchSize) {
      throw new IllegalArgumentException("maxBatchSize must be >= batchSize");
    }
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    }
    if (backlogWarnThreshold <= 0) {
      throw new IllegalArgumentException("backlogWarnThreshold must be > 0");
    }
    if (backlogIntervalSeconds <= 0L) {
      throw new IllegalArgumentException("backlogIntervalSeconds must be > 0");
    }
    return this;
  }

  private static int intProperty(Properties properties, String key, int defaultValue) {
    String raw = properties.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }
}
