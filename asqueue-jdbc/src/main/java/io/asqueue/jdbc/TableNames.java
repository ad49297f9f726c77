package io.asqueue.jdbc;

import io.asqueue.QueueConfig;

import java.util.Objects;

/**
 * Table name validation. Names are concatenated into SQL, so only plain identifiers pass.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = QueueConfig.DEFAULT_TABLE_NAME;
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";
  private static final int MAX_LENGTH = 48;

  private TableNames() {}

  /**
   * @throws IllegalArgumentException if the name is not a plain identifier or is too long
   *     to derive index names from
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    if (tableName.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("Table name longer than " + MAX_LENGTH + ": " + tableName);
    }
    return tableName;
  }

  /** Name of the destination index for {@code tableName}. */
  public static String destinationIndex(String tableName) {
    return tableName + "_destination_idx";
  }
}
