package io.asqueue.jdbc.tx;

import java.sql.Connection;

/**
 * Unit of work run by {@link JdbcTransactionManager#inTransaction}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw; rethrown unchanged after rollback
 */
@FunctionalInterface
public interface TransactionCallback<T, E extends Exception> {

  /**
   * @param connection the transaction's connection; statements executed on it join the scope
   */
  T doInTransaction(Connection connection) throws E;
}
