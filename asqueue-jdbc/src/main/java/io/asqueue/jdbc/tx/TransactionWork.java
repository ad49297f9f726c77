package io.asqueue.jdbc.tx;

import java.sql.Connection;

/**
 * Result-less unit of work run by {@link JdbcTransactionManager#withTransaction}.
 *
 * @param <E> checked exception the work may throw; rethrown unchanged after rollback
 */
@FunctionalInterface
public interface TransactionWork<E extends Exception> {

  void execute(Connection connection) throws E;
}
