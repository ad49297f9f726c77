package io.asqueue.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered slice of one destination's queue, oldest first.
 *
 * <p>{@link #lastSequenceId()} is the cursor to pass to
 * {@link io.asqueue.spi.AppserviceEventStore#deleteUpToSequence} once every event in the
 * batch has been delivered.
 */
public final class EventBatch {
  private final String destinationId;
  private final List<String> eventIds;
  private final List<QueuedEvent> events;

  public EventBatch(String destinationId, List<QueuedEvent> events) {
    this.destinationId = Objects.requireNonNull(destinationId, "destinationId");
    this.events = List.copyOf(Objects.requireNonNull(events, "events"));
    List<String> ids = new ArrayList<>(this.events.size());
    for (QueuedEvent event : this.events) {
      ids.add(event.eventId());
    }
    this.eventIds = List.copyOf(ids);
  }

  public static EventBatch empty(String destinationId) {
    return new EventBatch(destinationId, List.of());
  }

  public String destinationId() {
    return destinationId;
  }

  /** Event ids in queue order, parallel to {@link #events()}. */
  public List<String> eventIds() {
    return eventIds;
  }

  public List<QueuedEvent> events() {
    return events;
  }

  public int size() {
    return events.size();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  /**
   * Returns the sequence id of the newest event in the batch.
   *
   * @throws IllegalStateException if the batch is empty
   */
  public long lastSequenceId() {
    return last().sequenceId();
  }

  /**
   * Returns the event id of the newest event in the batch.
   *
   * @throws IllegalStateException if the batch is empty
   */
  public String lastEventId() {
    return last().eventId();
  }

  private QueuedEvent last() {
    if (events.isEmpty()) {
      throw new IllegalStateException("Batch for " + destinationId + " is empty");
    }
    return events.get(events.size() - 1);
  }

  @Override
  public String toString() {
    return "EventBatch{destinationId=" + destinationId + ", size=" + events.size() + "}";
  }
}
