package io.asqueue.spi;

import io.asqueue.SourceEvent;
import io.asqueue.model.EventBatch;

import java.sql.Connection;
import java.util.Collection;

/**
 * Persistence contract for the per-appservice event queue.
 *
 * <p>One physical table holds every destination's queue. Rows are ordered by a
 * backend-assigned sequence id that is unique and increasing across the whole table; reads
 * and truncation rely on it and never on wall-clock time. Rows are never updated: they
 * exist from the commit of {@link #insertEvent} until the commit of a covering delete.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Passing the connection of an open transaction runs the statement inside it;
 * passing an auto-commit connection runs it on its own.
 *
 * @see io.asqueue.jdbc.store.AbstractJdbcAppserviceEventStore
 */
public interface AppserviceEventStore {

    /** Transaction reference stored when the producer does not supply one. */
    long NO_TRANSACTION = 0L;

    /**
     * Appends one row for {@code destinationId}.
     *
     * @param conn          the JDBC connection (typically within a transaction)
     * @param destinationId the receiving appservice; must be non-empty
     * @param event         the event to queue
     * @return the sequence id assigned to the new row
     * @throws IllegalArgumentException if {@code destinationId} is empty
     */
    default long insertEvent(Connection conn, String destinationId, SourceEvent event) {
        return insertEvent(conn, destinationId, event, NO_TRANSACTION);
    }

    /**
     * Appends one row for {@code destinationId}, tagged with a delivery transaction reference.
     *
     * @param conn           the JDBC connection
     * @param destinationId  the receiving appservice; must be non-empty
     * @param event          the event to queue
     * @param transactionRef delivery batch the row belongs to
     * @return the sequence id assigned to the new row
     */
    long insertEvent(Connection conn, String destinationId, SourceEvent event, long transactionRef);

    /**
     * Queues one event for several destinations, one row each, in iteration order.
     *
     * <p>Default loops {@link #insertEvent(Connection, String, SourceEvent)}. Run it inside a
     * transaction so the fan-out is all-or-nothing.
     *
     * @return the number of rows inserted
     */
    default int insertBatch(Connection conn, Collection<String> destinationIds, SourceEvent event) {
        int inserted = 0;
        for (String destinationId : destinationIds) {
            insertEvent(conn, destinationId, event);
            inserted++;
        }
        return inserted;
    }

    /**
     * Counts the rows currently queued for a destination.
     *
     * @return the row count; {@code 0} when the destination has no rows or was never used
     */
    int countByDestination(Connection conn, String destinationId);

    /**
     * Reads up to {@code limit} of the oldest rows queued for a destination, ordered by
     * sequence id ascending. The read is non-destructive.
     *
     * @param limit maximum number of rows; must be &gt; 0
     * @return the batch, empty when nothing is queued
     * @throws IllegalArgumentException if {@code limit <= 0}
     */
    EventBatch selectEventsByDestination(Connection conn, String destinationId, int limit);

    /**
     * Deletes, for every destination holding a row for {@code eventId}, that row and every
     * older row of the same destination.
     *
     * <p>The bound is resolved to the row's sequence id, so the result does not depend on
     * how event ids compare as strings. Callers must only pass the id of the newest event
     * of a fully delivered batch. Deleting a bound that is already gone affects zero rows.
     *
     * @return the number of rows deleted
     */
    int deleteUpToId(Connection conn, String eventId);

    /**
     * Deletes the rows of one destination whose sequence id is {@code <= sequenceId}.
     * Idempotent.
     *
     * @return the number of rows deleted
     */
    int deleteUpToSequence(Connection conn, String destinationId, long sequenceId);
}
