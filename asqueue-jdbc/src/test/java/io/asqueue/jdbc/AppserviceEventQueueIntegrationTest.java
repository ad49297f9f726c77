package io.asqueue.jdbc;

import io.asqueue.AppserviceEventQueue;
import io.asqueue.QueueConfig;
import io.asqueue.SourceEvent;
import io.asqueue.jdbc.store.H2AppserviceEventStore;
import io.asqueue.jdbc.tx.JdbcTransactionManager;
import io.asqueue.jdbc.tx.ThreadLocalTxContext;
import io.asqueue.model.EventBatch;
import io.asqueue.spi.QueueMetrics;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Producer and delivery-worker flows against H2 with a real transaction manager.
 */
class AppserviceEventQueueIntegrationTest {
    private JdbcDataSource dataSource;
    private ThreadLocalTxContext txContext;
    private JdbcTransactionManager txManager;
    private CountingMetrics metrics;
    private AppserviceEventQueue queue;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:queue_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
        txContext = new ThreadLocalTxContext();
        txManager = new JdbcTransactionManager(connectionProvider, txContext);
        metrics = new CountingMetrics();
        H2AppserviceEventStore store = new H2AppserviceEventStore();

        try (Connection conn = dataSource.getConnection()) {
            store.createSchema(conn);
            conn.createStatement().execute(
                    "CREATE TABLE room_events (event_id VARCHAR(255) PRIMARY KEY, body VARCHAR(255))");
        }

        queue = AppserviceEventQueue.builder()
                .connectionProvider(connectionProvider)
                .txContext(txContext)
                .store(store)
                .metrics(metrics)
                .config(new QueueConfig().setBatchSize(2))
                .build();
    }

    @Test
    void enqueueJoinsCommittedTransaction() throws Exception {
        txManager.withTransaction(conn -> {
            persistRoomEvent(conn, "$a");
            queue.enqueue("irc-bridge", event("$a", 1000L));
            assertEquals(0, metrics.enqueued.get());
        });

        assertEquals("$a", roomEventBody("$a"));
        assertEquals(1, queue.backlog("irc-bridge"));
        assertEquals(1, metrics.enqueued.get());
    }

    @Test
    void enqueueRolledBackWithEnclosingTransaction() throws Exception {
        assertThrows(IllegalStateException.class, () ->
                txManager.withTransaction(conn -> {
                    persistRoomEvent(conn, "$a");
                    queue.enqueueAll(List.of("irc-bridge", "slack-bridge"), event("$a", 1000L));
                    throw new IllegalStateException("room state update failed");
                }));

        assertNull(roomEventBody("$a"));
        assertEquals(0, queue.backlog("irc-bridge"));
        assertEquals(0, queue.backlog("slack-bridge"));
        assertEquals(0, metrics.enqueued.get());
    }

    @Test
    void enqueueWithoutTransactionAutoCommits() throws Exception {
        queue.enqueue("irc-bridge", event("$a", 1000L));
        assertEquals(2, queue.enqueueAll(List.of("irc-bridge", "slack-bridge"), event("$b", 2000L)));

        assertEquals(2, queue.backlog("irc-bridge"));
        assertEquals(1, queue.backlog("slack-bridge"));
        assertFalse(txContext.isTransactionActive());
    }

    @Test
    void deliveryLoopDrainsInOrder() throws Exception {
        for (int i = 0; i < 5; i++) {
            queue.enqueue("irc-bridge", event("$e" + i, 1000L + i));
        }

        StringBuilder delivered = new StringBuilder();
        EventBatch batch = queue.nextBatch("irc-bridge");
        while (!batch.isEmpty()) {
            assertTrue(batch.size() <= 2);
            batch.eventIds().forEach(id -> delivered.append(id).append(' '));
            queue.acknowledge(batch);
            batch = queue.nextBatch("irc-bridge");
        }

        assertEquals("$e0 $e1 $e2 $e3 $e4 ", delivered.toString());
        assertEquals(0, queue.backlog("irc-bridge"));
        assertEquals(5, metrics.acknowledged.get());
    }

    @Test
    void failedDeliveryRedeliversSameBatch() throws Exception {
        queue.enqueue("irc-bridge", event("$a", 1000L));
        queue.enqueue("irc-bridge", event("$b", 2000L));

        EventBatch first = queue.nextBatch("irc-bridge");
        EventBatch retry = queue.nextBatch("irc-bridge");

        assertEquals(first.eventIds(), retry.eventIds());
        assertEquals(2, queue.acknowledge(retry));
        assertEquals(0, queue.acknowledge(first));
    }

    @Test
    void acknowledgeLeavesEventsQueuedAfterTheRead() throws Exception {
        queue.enqueue("irc-bridge", event("$a", 1000L));
        EventBatch batch = queue.nextBatch("irc-bridge");
        queue.enqueue("irc-bridge", event("$b", 2000L));

        queue.acknowledge(batch);

        assertEquals(List.of("$b"), queue.nextBatch("irc-bridge").eventIds());
    }

    @Test
    void nextBatchIsCappedByMaxBatchSize() throws Exception {
        AppserviceEventQueue capped = AppserviceEventQueue.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .store(new H2AppserviceEventStore())
                .config(new QueueConfig().setBatchSize(1).setMaxBatchSize(3))
                .build();
        for (int i = 0; i < 5; i++) {
            capped.enqueue("irc-bridge", event("$e" + i, 1000L));
        }

        assertEquals(3, capped.nextBatch("irc-bridge", 100).size());
        assertThrows(IllegalArgumentException.class, () -> capped.nextBatch("irc-bridge", 0));
    }

    private static void persistRoomEvent(Connection conn, String eventId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO room_events (event_id, body) VALUES (?, ?)")) {
            ps.setString(1, eventId);
            ps.setString(2, eventId);
            ps.executeUpdate();
        }
    }

    private String roomEventBody(String eventId) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT body FROM room_events WHERE event_id = ?")) {
            ps.setString(1, eventId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private static SourceEvent event(String eventId, long originServerTs) {
        return SourceEvent.builder(eventId)
                .originServerTs(originServerTs)
                .roomId("!room:example.org")
                .type("m.room.message")
                .sender("@alice:example.org")
                .contentJson("{\"body\":\"hi\"}")
                .build();
    }

    private static final class CountingMetrics implements QueueMetrics {
        final AtomicInteger enqueued = new AtomicInteger();
        final AtomicInteger acknowledged = new AtomicInteger();
        final Map<String, Integer> backlog = new ConcurrentHashMap<>();

        @Override
        public void incrementEnqueued(String destinationId) {
            enqueued.incrementAndGet();
        }

        @Override
        public void incrementAcknowledged(String destinationId, int rows) {
            acknowledged.addAndGet(rows);
        }

        @Override
        public void recordBacklog(String destinationId, int count) {
            backlog.put(destinationId, count);
        }
    }
}
