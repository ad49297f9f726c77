/**
 * Durable per-appservice event queue.
 *
 * <p>Events bound for application services are appended to one shared table, one row per
 * destination, and read back oldest first in bounded batches. A delivery worker truncates a
 * destination's queue only after the batch it read was accepted, so a failed push simply
 * re-reads the same rows. Ordering is guaranteed within a destination only.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>asqueue-core</b>: model, SPIs, {@link io.asqueue.AppserviceEventQueue},
 *       {@link io.asqueue.backlog.BacklogMonitor}</li>
 *   <li><b>asqueue-jdbc</b>: JDBC stores (H2, MySQL, PostgreSQL) and the transaction scope</li>
 *   <li><b>asqueue-micrometer</b>: Micrometer {@link io.asqueue.spi.QueueMetrics}</li>
 * </ul>
 *
 * @see io.asqueue.AppserviceEventQueue
 * @see io.asqueue.SourceEvent
 * @see io.asqueue.spi.AppserviceEventStore
 */
package io.asqueue;
