package io.asqueue.jdbc.tx;

import io.asqueue.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>State is bound and cleared by {@link JdbcTransactionManager}; one transaction per thread.
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return requireState().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    requireState().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    requireState().afterRollback.add(callback);
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the current transaction and runs the callbacks registered for its outcome.
   * Every callback runs even if an earlier one throws; the first failure is rethrown with
   * the others suppressed.
   */
  void complete(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    RuntimeException first = null;
    for (Runnable callback : committed ? current.afterCommit : current.afterRollback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) first = e;
        else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private TxState requireState() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
