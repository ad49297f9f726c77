/**
 * JDBC {@link io.asqueue.spi.AppserviceEventStore} implementations.
 *
 * <p>{@link io.asqueue.jdbc.store.AbstractJdbcAppserviceEventStore} holds the shared SQL and
 * row mapping; subclasses supply DDL for H2, PostgreSQL and MySQL, and MySQL its own
 * truncation statement.
 *
 * @see io.asqueue.jdbc.store.JdbcAppserviceEventStores
 */
package io.asqueue.jdbc.store;
