package io.asqueue;

import io.asqueue.model.EventBatch;
import io.asqueue.spi.ConnectionProvider;
import io.asqueue.spi.QueueMetrics;
import io.asqueue.spi.TxContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppserviceEventQueueTest {

  private InMemoryAppserviceEventStore store;
  private RecordingMetrics metrics;
  private List<String> connectionCalls;

  @BeforeEach
  void setUp() {
    store = new InMemoryAppserviceEventStore();
    metrics = new RecordingMetrics();
    connectionCalls = new ArrayList<>();
  }

  @Test
  void builderRequiresConnectionProviderAndStore() {
    assertThrows(NullPointerException.class, () -> AppserviceEventQueue.builder().store(store).build());
    assertThrows(NullPointerException.class,
        () -> AppserviceEventQueue.builder().connectionProvider(stubCp()).build());
  }

  @Test
  void enqueueWithoutTransactionUsesOwnConnection() throws Exception {
    AppserviceEventQueue queue = newQueue(null);

    queue.enqueue("irc-bridge", TestEvents.event("$a", 1000L));

    assertEquals(1, store.rows.size());
    assertTrue(connectionCalls.contains("close"));
    assertEquals(1, metrics.enqueued.get("irc-bridge"));
  }

  @Test
  void enqueueJoinsActiveTransactionAndDefersMetrics() throws Exception {
    StubTxContext txContext = new StubTxContext(true);
    AppserviceEventQueue queue = newQueue(txContext);

    queue.enqueue("irc-bridge", TestEvents.event("$a", 1000L));

    assertEquals(1, store.rows.size());
    assertTrue(connectionCalls.isEmpty(), "must not open its own connection");
    assertTrue(metrics.enqueued.isEmpty());

    txContext.runAfterCommit();

    assertEquals(1, metrics.enqueued.get("irc-bridge"));
  }

  @Test
  void fanOutWithoutTransactionCommitsOnce() throws Exception {
    AppserviceEventQueue queue = newQueue(null);

    int inserted = queue.enqueueAll(List.of("irc-bridge", "slack-bridge"), TestEvents.event("$a", 1000L));

    assertEquals(2, inserted);
    assertEquals(2, store.rows.size());
    assertEquals(List.of("setAutoCommit", "commit", "setAutoCommit", "close"), connectionCalls);
  }

  @Test
  void failedFanOutRollsBackAndRethrows() {
    AppserviceEventQueue queue = newQueue(null);
    IllegalStateException failure = new IllegalStateException("disk full");
    store.failInsertAfter(1, failure);

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> queue.enqueueAll(List.of("irc-bridge", "slack-bridge"), TestEvents.event("$a", 1000L)));

    assertSame(failure, thrown);
    assertTrue(connectionCalls.contains("rollback"));
    assertTrue(metrics.enqueued.isEmpty());
  }

  @Test
  void autoCommitRestoreFailureDoesNotMaskInsertFailure() {
    AppserviceEventQueue queue = AppserviceEventQueue.builder()
        .connectionProvider(() -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
            Connection.class.getClassLoader(),
            new Class<?>[]{Connection.class},
            (proxy, method, args) -> {
              connectionCalls.add(method.getName());
              if ("setAutoCommit".equals(method.getName()) && Boolean.TRUE.equals(args[0])) {
                throw new SQLException("connection reset", "08006");
              }
              return null;
            }))
        .store(store)
        .metrics(metrics)
        .build();
    IllegalStateException failure = new IllegalStateException("disk full");
    store.failInsertAfter(1, failure);

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> queue.enqueueAll(List.of("irc-bridge", "slack-bridge"), TestEvents.event("$a", 1000L)));

    assertSame(failure, thrown);
    assertEquals(List.of("setAutoCommit", "rollback", "setAutoCommit", "close"), connectionCalls);
  }

  @Test
  void enqueueAllWithNoDestinationsIsNoOp() throws Exception {
    AppserviceEventQueue queue = newQueue(null);

    assertEquals(0, queue.enqueueAll(List.of(), TestEvents.event("$a", 1000L)));
    assertTrue(connectionCalls.isEmpty());
  }

  @Test
  void nextBatchUsesConfiguredSizeAndCap() throws Exception {
    AppserviceEventQueue queue = AppserviceEventQueue.builder()
        .connectionProvider(stubCp())
        .store(store)
        .metrics(metrics)
        .config(new QueueConfig().setBatchSize(2).setMaxBatchSize(3))
        .build();
    for (int i = 0; i < 5; i++) {
      queue.enqueue("irc-bridge", TestEvents.event("$e" + i, 1000L + i));
    }

    assertEquals(List.of("$e0", "$e1"), queue.nextBatch("irc-bridge").eventIds());
    assertEquals(3, queue.nextBatch("irc-bridge", 100).size());
    assertEquals(List.of(2, 3), metrics.batchSizes);
  }

  @Test
  void nextBatchRejectsNonPositiveLimit() {
    AppserviceEventQueue queue = newQueue(null);

    assertThrows(IllegalArgumentException.class, () -> queue.nextBatch("irc-bridge", 0));
    assertThrows(IllegalArgumentException.class, () -> queue.nextBatch("irc-bridge", -1));
  }

  @Test
  void acknowledgeTruncatesOnlyTheBatchDestination() throws Exception {
    AppserviceEventQueue queue = newQueue(null);
    queue.enqueue("irc-bridge", TestEvents.event("$a", 1000L));
    queue.enqueue("slack-bridge", TestEvents.event("$a", 1000L));
    queue.enqueue("irc-bridge", TestEvents.event("$b", 2000L));

    EventBatch batch = queue.nextBatch("irc-bridge", 1);
    assertEquals(1, queue.acknowledge(batch));

    assertEquals(1, queue.backlog("irc-bridge"));
    assertEquals(1, queue.backlog("slack-bridge"));
    assertEquals(1, metrics.acknowledged.get("irc-bridge"));
  }

  @Test
  void acknowledgeEmptyBatchIsNoOp() throws Exception {
    AppserviceEventQueue queue = newQueue(null);

    assertEquals(0, queue.acknowledge(EventBatch.empty("irc-bridge")));
    assertTrue(connectionCalls.isEmpty());
  }

  private AppserviceEventQueue newQueue(TxContext txContext) {
    return AppserviceEventQueue.builder()
        .connectionProvider(stubCp())
        .txContext(txContext)
        .store(store)
        .metrics(metrics)
        .build();
  }

  private ConnectionProvider stubCp() {
    return () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          connectionCalls.add(method.getName());
          return null;
        });
  }

  private static final class StubTxContext implements TxContext {
    private final boolean active;
    private final List<Runnable> afterCommit = new ArrayList<>();

    StubTxContext(boolean active) {
      this.active = active;
    }

    @Override
    public boolean isTransactionActive() {
      return active;
    }

    @Override
    public Connection currentConnection() {
      return null;
    }

    @Override
    public void afterCommit(Runnable callback) {
      afterCommit.add(callback);
    }

    @Override
    public void afterRollback(Runnable callback) {
    }

    void runAfterCommit() {
      afterCommit.forEach(Runnable::run);
    }
  }

  private static final class RecordingMetrics implements QueueMetrics {
    final Map<String, Integer> enqueued = new ConcurrentHashMap<>();
    final Map<String, Integer> acknowledged = new ConcurrentHashMap<>();
    final List<Integer> batchSizes = new ArrayList<>();

    @Override
    public void incrementEnqueued(String destinationId) {
      enqueued.merge(destinationId, 1, Integer::sum);
    }

    @Override
    public void incrementAcknowledged(String destinationId, int rows) {
      acknowledged.merge(destinationId, rows, Integer::sum);
    }

    @Override
    public void recordBacklog(String destinationId, int count) {
    }

    @Override
    public void recordBatchSize(String destinationId, int size) {
      batchSizes.add(size);
    }
  }
}
