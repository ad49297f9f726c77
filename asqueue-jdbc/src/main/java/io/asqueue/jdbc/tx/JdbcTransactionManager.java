package io.asqueue.jdbc.tx;

import io.asqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction scope for manual JDBC usage. Obtains a connection, disables auto-commit,
 * and binds it to a {@link ThreadLocalTxContext}.
 *
 * <p>Preferred form, committing when the work returns and rolling back when it throws
 * anything, including an {@link Error}:
 * <pre>{@code
 * txManager.withTransaction(conn -> {
 *     store.insertEvent(conn, "irc-bridge", event);
 *     markQueued(conn, event.eventId());
 * });
 * }</pre>
 *
 * <p>Manual form, for callers that decide the outcome themselves:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     store.insertEvent(tx.connection(), "irc-bridge", event);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   * @throws IllegalStateException if a transaction is already active on this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(connection, e);
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code callback} in a new transaction and returns its result.
   *
   * <p>The transaction commits only if the callback returns normally. If the callback
   * throws, the transaction is rolled back and the same throwable propagates; a failed
   * rollback is logged and never replaces it. A failed commit is thrown as
   * {@link SQLException}.
   *
   * @throws E whatever the callback throws
   * @throws SQLException if the transaction cannot be started or committed
   */
  public <T, E extends Exception> T inTransaction(TransactionCallback<T, E> callback)
      throws E, SQLException {
    Objects.requireNonNull(callback, "callback");
    Transaction tx = begin();
    boolean succeeded = false;
    try {
      T result = callback.doInTransaction(tx.connection());
      succeeded = true;
      return result;
    } finally {
      endTransaction(tx, succeeded);
    }
  }

  /**
   * Result-less variant of {@link #inTransaction}.
   */
  public <E extends Exception> void withTransaction(TransactionWork<E> work) throws E, SQLException {
    Objects.requireNonNull(work, "work");
    inTransaction(connection -> {
      work.execute(connection);
      return null;
    });
  }

  /**
   * Ends {@code tx}: commits if {@code succeeded}, otherwise rolls back.
   *
   * <p>Rollback is best-effort: failures are logged at WARNING and not thrown. Calling this
   * on an already completed transaction does nothing.
   *
   * @throws SQLException if the commit fails
   */
  public static void endTransaction(Transaction tx, boolean succeeded) throws SQLException {
    Objects.requireNonNull(tx, "tx");
    if (succeeded) {
      tx.commit();
      return;
    }
    try {
      tx.rollback();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Transaction rollback failed", e);
    }
  }

  private static void closeQuietly(Connection connection, Exception cause) {
    try {
      connection.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()};
   * only the first of them has an effect. If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    /** The connection statements must use to run inside this transaction. */
    public Connection connection() {
      return connection;
    }

    public boolean isCompleted() {
      return completed;
    }

    /**
     * Commits. If the commit fails the transaction is rolled back and the commit failure is
     * rethrown with any cleanup failures attached as suppressed.
     *
     * <p>After-commit callbacks that throw are logged; the commit has already happened.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        rollbackAfterFailedCommit(e);
        try {
          finish(false);
        } catch (SQLException | RuntimeException cleanupFailure) {
          e.addSuppressed(cleanupFailure);
        }
        throw e;
      }
      finish(true);
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(boolean committed) throws SQLException {
      completed = true;
      RuntimeException callbackException = null;
      try {
        txContext.complete(committed);
      } catch (RuntimeException e) {
        if (committed) {
          logger.log(Level.WARNING, "After-commit callback failed", e);
        } else {
          callbackException = e;
        }
      }
      SQLException releaseFailure = release();
      if (callbackException != null) {
        if (releaseFailure != null) callbackException.addSuppressed(releaseFailure);
        throw callbackException;
      }
      if (releaseFailure != null) {
        if (committed) {
          logger.log(Level.WARNING, "Failed to release connection after commit", releaseFailure);
        } else {
          throw releaseFailure;
        }
      }
    }

    /** Restores auto-commit and closes the connection, returning the first failure. */
    private SQLException release() {
      SQLException failure = null;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = e;
      }
      try {
        connection.close();
      } catch (SQLException e) {
        if (failure == null) failure = e;
        else failure.addSuppressed(e);
      }
      return failure;
    }

    private void rollbackAfterFailedCommit(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
