package io.asqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything.
 */
public interface QueueMetrics {

    QueueMetrics NOOP = new Noop();

    /**
     * Counts an event queued for a destination. Called after the inserting transaction commits.
     */
    void incrementEnqueued(String destinationId);

    /**
     * Counts rows removed after confirmed delivery.
     *
     * @param rows number of rows deleted by the truncation
     */
    void incrementAcknowledged(String destinationId, int rows);

    /**
     * Records the current number of queued rows for a destination.
     */
    void recordBacklog(String destinationId, int count);

    /**
     * Records the size of a batch handed to a delivery worker.
     */
    default void recordBatchSize(String destinationId, int size) {
    }

    /**
     * Default no-op implementation.
     */
    final class Noop implements QueueMetrics {
        @Override
        public void incrementEnqueued(String destinationId) {
        }

        @Override
        public void incrementAcknowledged(String destinationId, int rows) {
        }

        @Override
        public void recordBacklog(String destinationId, int count) {
        }
    }
}
