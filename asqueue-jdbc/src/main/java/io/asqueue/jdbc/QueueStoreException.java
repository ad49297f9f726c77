package io.asqueue.jdbc;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;

/**
 * Unchecked exception wrapping JDBC errors thrown by the queue stores.
 *
 * <p>The {@link Reason} is derived from the exception type and SQLState so callers can decide
 * whether to retry without inspecting vendor codes.
 */
public final class QueueStoreException extends RuntimeException {

  /** Classification of the underlying backend failure. */
  public enum Reason {
    /** Connection lost or refused (SQLState class {@code 08}). Retryable. */
    BACKEND_UNAVAILABLE(true),
    /** Statement cancelled by its query timeout. Retryable. */
    TIMEOUT(true),
    /** Duplicate key or other integrity violation (SQLState class {@code 23}). */
    CONSTRAINT_VIOLATION(false),
    /** Any other backend error. */
    BACKEND_FAILURE(false);

    private final boolean retryable;

    Reason(boolean retryable) {
      this.retryable = retryable;
    }

    public boolean isRetryable() {
      return retryable;
    }
  }

  private final Reason reason;

  public QueueStoreException(String message, Reason reason, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /**
   * Wraps {@code e}, classifying it by type and SQLState.
   */
  public static QueueStoreException translate(String message, SQLException e) {
    return new QueueStoreException(message + ": " + e.getMessage(), classify(e), e);
  }

  static Reason classify(SQLException e) {
    if (e instanceof SQLTimeoutException) {
      return Reason.TIMEOUT;
    }
    if (e instanceof SQLIntegrityConstraintViolationException) {
      return Reason.CONSTRAINT_VIOLATION;
    }
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) {
      return Reason.BACKEND_UNAVAILABLE;
    }
    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "08":
          return Reason.BACKEND_UNAVAILABLE;
        case "23":
          return Reason.CONSTRAINT_VIOLATION;
        case "57":
          // 57014: query_canceled (PostgreSQL statement timeout)
          return "57014".equals(state) ? Reason.TIMEOUT : Reason.BACKEND_FAILURE;
        default:
          break;
      }
    }
    return Reason.BACKEND_FAILURE;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isRetryable() {
    return reason.isRetryable();
  }
}
