package io.asqueue.model;

/**
 * Read-only record of a queued row, as returned by
 * {@link io.asqueue.spi.AppserviceEventStore#selectEventsByDestination}.
 *
 * <p>{@code ageMillis} is derived when the row is read ({@code now - originServerTs}) and is
 * never persisted, so reading the same row later yields a larger age.
 */
public record QueuedEvent(
    long sequenceId,
    String destinationId,
    String eventId,
    long originServerTs,
    long ageMillis,
    String roomId,
    String type,
    String sender,
    String contentJson,
    long transactionRef
) {

  /** Returns {@code true} if the event was queued with content. */
  public boolean hasContent() {
    return contentJson != null;
  }
}
