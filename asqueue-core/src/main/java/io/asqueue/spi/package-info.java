/**
 * Service provider interfaces for pluggable queue components.
 *
 * <ul>
 *   <li>{@link io.asqueue.spi.AppserviceEventStore}: queue persistence</li>
 *   <li>{@link io.asqueue.spi.ConnectionProvider}: JDBC connections outside a transaction</li>
 *   <li>{@link io.asqueue.spi.TxContext}: transaction lifecycle abstraction</li>
 *   <li>{@link io.asqueue.spi.QueueMetrics}: metrics export</li>
 * </ul>
 */
package io.asqueue.spi;
