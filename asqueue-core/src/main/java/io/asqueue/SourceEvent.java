package io.asqueue;

import java.util.Objects;

/**
 * Immutable view of a room event as handed over by the producer side, limited to the
 * fields the queue persists.
 *
 * <p>Every field except {@code contentJson} is required and must be non-empty. Absent content
 * is stored as SQL {@code NULL} and read back as {@code null}, meaning "empty content".
 *
 * @see AppserviceEventQueue#enqueue(String, SourceEvent)
 */
public final class SourceEvent {
  private final String eventId;
  private final long originServerTs;
  private final String roomId;
  private final String type;
  private final String sender;
  private final String contentJson;

  private SourceEvent(Builder builder) {
    this.eventId = requireText(builder.eventId, "eventId");
    this.roomId = requireText(builder.roomId, "roomId");
    this.type = requireText(builder.type, "type");
    this.sender = requireText(builder.sender, "sender");
    if (builder.originServerTs < 0) {
      throw new IllegalArgumentException("originServerTs must be >= 0");
    }
    this.originServerTs = builder.originServerTs;
    this.contentJson = builder.contentJson;
  }

  public static Builder builder(String eventId) {
    return new Builder(eventId);
  }

  public String eventId() {
    return eventId;
  }

  /** Milliseconds since the epoch at which the originating server created the event. */
  public long originServerTs() {
    return originServerTs;
  }

  public String roomId() {
    return roomId;
  }

  public String type() {
    return type;
  }

  public String sender() {
    return sender;
  }

  /** Serialized event content, or {@code null} when the event has none. */
  public String contentJson() {
    return contentJson;
  }

  private static String requireText(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty()) {
      throw new IllegalArgumentException(name + " cannot be empty");
    }
    return value;
  }

  @Override
  public String toString() {
    return "SourceEvent{eventId=" + eventId + ", roomId=" + roomId + ", type=" + type + "}";
  }

  /** Builder for {@link SourceEvent}. */
  public static final class Builder {
    private final String eventId;
    private long originServerTs = -1L;
    private String roomId;
    private String type;
    private String sender;
    private String contentJson;

    private Builder(String eventId) {
      this.eventId = eventId;
    }

    public Builder originServerTs(long originServerTs) {
      this.originServerTs = originServerTs;
      return this;
    }

    public Builder roomId(String roomId) {
      this.roomId = roomId;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder sender(String sender) {
      this.sender = sender;
      return this;
    }

    public Builder contentJson(String contentJson) {
      this.contentJson = contentJson;
      return this;
    }

    /**
     * @throws NullPointerException if a required field is missing
     * @throws IllegalArgumentException if a required field is empty or the timestamp was not set
     */
    public SourceEvent build() {
      return new SourceEvent(this);
    }
  }
}
