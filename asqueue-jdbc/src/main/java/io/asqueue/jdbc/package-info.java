/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.asqueue.jdbc.JdbcTemplate} wraps statement execution and error translation
 * into {@link io.asqueue.jdbc.QueueStoreException}.
 * {@link io.asqueue.jdbc.DataSourceConnectionProvider} adapts a {@link javax.sql.DataSource}
 * to the {@link io.asqueue.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.asqueue.jdbc.store}: {@link io.asqueue.spi.AppserviceEventStore} implementations</li>
 *   <li>{@code io.asqueue.jdbc.tx}: transaction scope</li>
 * </ul>
 */
package io.asqueue.jdbc;
