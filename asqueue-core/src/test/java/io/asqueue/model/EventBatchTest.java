package io.asqueue.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBatchTest {

  @Test
  void eventIdsFollowEventOrder() {
    EventBatch batch = new EventBatch("irc-bridge", List.of(row(7, "$a"), row(9, "$b")));

    assertEquals(List.of("$a", "$b"), batch.eventIds());
    assertEquals(9L, batch.lastSequenceId());
    assertEquals("$b", batch.lastEventId());
    assertEquals(2, batch.size());
  }

  @Test
  void emptyBatchHasNoCursor() {
    EventBatch batch = EventBatch.empty("irc-bridge");

    assertTrue(batch.isEmpty());
    assertTrue(batch.eventIds().isEmpty());
    assertThrows(IllegalStateException.class, batch::lastSequenceId);
  }

  @Test
  void isUnaffectedByLaterChangesToTheSourceList() {
    List<QueuedEvent> source = new ArrayList<>(List.of(row(1, "$a")));
    EventBatch batch = new EventBatch("irc-bridge", source);

    source.add(row(2, "$b"));

    assertEquals(1, batch.size());
    assertThrows(UnsupportedOperationException.class, () -> batch.events().add(row(3, "$c")));
  }

  private static QueuedEvent row(long sequenceId, String eventId) {
    return new QueuedEvent(sequenceId, "irc-bridge", eventId, 1000L, 5L,
        "!r", "m.room.message", "@s", null, 0L);
  }
}
