/**
 * Transaction scope for queue mutations.
 *
 * <p>{@link io.asqueue.jdbc.tx.JdbcTransactionManager} commits a unit of work that returns
 * normally and rolls back one that throws, on every exit path.
 * {@link io.asqueue.jdbc.tx.ThreadLocalTxContext} exposes the active connection to
 * {@link io.asqueue.AppserviceEventQueue}.
 */
package io.asqueue.jdbc.tx;
