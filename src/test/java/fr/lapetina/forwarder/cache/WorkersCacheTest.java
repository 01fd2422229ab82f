package fr.lapetina.forwarder.cache;

import fr.lapetina.forwarder.domain.model.SendResult;
import fr.lapetina.forwarder.domain.model.TransactionBatch;
import fr.lapetina.forwarder.domain.model.WorkersCacheError;
import fr.lapetina.forwarder.worker.CancellationToken;
import fr.lapetina.forwarder.worker.WorkerChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class WorkersCacheTest {

    private static final InetSocketAddress A = new InetSocketAddress("127.0.0.1", 8001);
    private static final InetSocketAddress B = new InetSocketAddress("127.0.0.1", 8002);
    private static final InetSocketAddress C = new InetSocketAddress("127.0.0.1", 8003);

    private final List<InetSocketAddress> stopped = new CopyOnWriteArrayList<>();

    private CancellationToken cacheCancel;
    private DetachedShutdowns detachedShutdowns;

    @BeforeEach
    void setUp() {
        cacheCancel = new CancellationToken();
        detachedShutdowns = new DetachedShutdowns();
    }

    @AfterEach
    void tearDown() {
        detachedShutdowns.close();
    }

    @Test
    @DisplayName("should reject non-positive capacity")
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new WorkersCache(0, cacheCancel, detachedShutdowns))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should evict least recently used worker when capacity is exceeded")
    void shouldEvictLeastRecentlyUsed() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);

        assertThat(cache.push(A, worker(A, 4).info)).isEmpty();
        assertThat(cache.push(B, worker(B, 4).info)).isEmpty();
        Optional<ShutdownWorker> evicted = cache.push(C, worker(C, 4).info);

        assertThat(evicted).isPresent();
        assertThat(evicted.get().leader()).isEqualTo(A);
        assertThat(cache.contains(A)).isFalse();
        assertThat(cache.contains(B)).isTrue();
        assertThat(cache.contains(C)).isTrue();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("should refresh recency on send")
    void shouldRefreshRecencyOnSend() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 4).info);
        cache.push(B, worker(B, 4).info);

        assertThat(cache.trySendTransactionsToAddress(A, batch()).isSuccess()).isTrue();
        Optional<ShutdownWorker> evicted = cache.push(C, worker(C, 4).info);

        assertThat(evicted).map(ShutdownWorker::leader).contains(B);
        assertThat(cache.contains(A)).isTrue();
    }

    @Test
    @DisplayName("should not refresh recency on contains")
    void shouldNotRefreshRecencyOnContains() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 4).info);
        cache.push(B, worker(B, 4).info);

        assertThat(cache.contains(A)).isTrue();
        Optional<ShutdownWorker> evicted = cache.push(C, worker(C, 4).info);

        assertThat(evicted).map(ShutdownWorker::leader).contains(A);
    }

    @Test
    @DisplayName("should return previous worker when pushing an existing leader")
    void shouldReturnPreviousWorkerOnRepush() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker first = worker(A, 4);
        TestWorker second = worker(A, 4);
        cache.push(A, first.info);

        Optional<ShutdownWorker> replaced = cache.push(A, second.info);

        assertThat(replaced).map(ShutdownWorker::leader).contains(A);
        assertThat(cache.size()).isEqualTo(1);

        replaced.get().shutdown();
        assertThat(first.cancel.isCancelled()).isTrue();
        assertThat(second.cancel.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("should pop the requested worker")
    void shouldPopRequestedWorker() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 4).info);

        assertThat(cache.pop(A)).map(ShutdownWorker::leader).contains(A);
        assertThat(cache.pop(A)).isEmpty();
        assertThat(cache.contains(A)).isFalse();
    }

    @Test
    @DisplayName("should report full channel and keep the worker")
    void shouldReportFullChannel() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 1).info);

        assertThat(cache.trySendTransactionsToAddress(A, batch()).isSuccess()).isTrue();
        SendResult result = cache.trySendTransactionsToAddress(A, batch());

        assertThat(result.is(WorkersCacheError.FULL_CHANNEL)).isTrue();
        assertThat(cache.contains(A)).isTrue();
    }

    @Test
    @DisplayName("should not block when trying to send to a full channel")
    void shouldNotBlockOnFullChannel() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 1).info);
        cache.trySendTransactionsToAddress(A, batch());

        SendResult result = assertTimeoutPreemptively(Duration.ofSeconds(1),
                () -> cache.trySendTransactionsToAddress(A, batch()));

        assertThat(result.is(WorkersCacheError.FULL_CHANNEL)).isTrue();
    }

    @Test
    @DisplayName("should prune worker whose receiver was dropped and stop it once")
    void shouldPruneDroppedReceiver() throws Exception {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker dead = worker(A, 4);
        dead.channel.closeReceiver();
        cache.push(A, dead.info);

        SendResult result = cache.trySendTransactionsToAddress(A, batch());

        assertThat(result.is(WorkersCacheError.RECEIVER_DROPPED)).isTrue();
        assertThat(cache.contains(A)).isFalse();
        assertThat(detachedShutdowns.awaitPending(Duration.ofSeconds(5))).isTrue();
        assertThat(dead.shutdowns.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should prune worker on blocking send when receiver was dropped")
    void shouldPruneDroppedReceiverOnBlockingSend() throws Exception {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker dead = worker(A, 4);
        dead.channel.closeReceiver();
        cache.push(A, dead.info);

        SendResult result = cache.sendTransactionsToAddress(A, batch());

        assertThat(result.is(WorkersCacheError.RECEIVER_DROPPED)).isTrue();
        assertThat(cache.contains(A)).isFalse();
        assertThat(detachedShutdowns.awaitPending(Duration.ofSeconds(5))).isTrue();
        assertThat(dead.shutdowns.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("should wait for pruned workers on shutdown when it owns its detached shutdowns")
    void shouldAwaitPrunedWorkersOnShutdown() {
        WorkersCache cache = new WorkersCache(2, cacheCancel);
        TestWorker slow = new TestWorker(4);
        CompletableFuture<Void> handle = slow.cancel.whenCancelled().thenRunAsync(
                () -> stopped.add(A),
                CompletableFuture.delayedExecutor(300, TimeUnit.MILLISECONDS));
        slow.channel.closeReceiver();
        cache.push(A, new WorkerInfo(slow.channel, handle, slow.cancel));

        assertThat(cache.trySendTransactionsToAddress(A, batch()).is(WorkersCacheError.RECEIVER_DROPPED)).isTrue();
        cache.shutdown();

        assertThat(handle).isDone();
        assertThat(stopped).containsExactly(A);
    }

    @Test
    @DisplayName("should fail fast when no worker is cached for the peer")
    void shouldFailFastOnMissingWorker() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);

        assertThatThrownBy(() -> cache.trySendTransactionsToAddress(A, batch()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("contains");
        assertThatThrownBy(() -> cache.sendTransactionsToAddress(A, batch()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should stop all workers in least recently used order on shutdown")
    void shouldShutdownInLruOrder() {
        WorkersCache cache = new WorkersCache(3, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 4).info);
        cache.push(B, worker(B, 4).info);
        cache.push(C, worker(C, 4).info);
        cache.trySendTransactionsToAddress(A, batch());

        cache.shutdown();

        assertThat(stopped).containsExactly(B, C, A);
        assertThat(cache.size()).isZero();
        assertThat(cache.isShutdown()).isTrue();
        assertThat(cacheCancel.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should keep draining when a worker fails to stop")
    void shouldKeepDrainingWhenJoinFails() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker failing = failingWorker(A);
        TestWorker healthy = worker(B, 4);
        cache.push(A, failing.info);
        cache.push(B, healthy.info);

        cache.shutdown();

        assertThat(failing.cancel.isCancelled()).isTrue();
        assertThat(healthy.cancel.isCancelled()).isTrue();
        assertThat(stopped).containsExactly(B);
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should report shutdown for any peer after shutdown")
    void shouldReportShutdownAfterShutdown() throws Exception {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 4).info);

        cache.shutdown();

        assertThat(cache.trySendTransactionsToAddress(A, batch()).is(WorkersCacheError.SHUTDOWN)).isTrue();
        assertThat(cache.trySendTransactionsToAddress(C, batch()).is(WorkersCacheError.SHUTDOWN)).isTrue();
        assertThat(cache.sendTransactionsToAddress(C, batch()).is(WorkersCacheError.SHUTDOWN)).isTrue();
    }

    @Test
    @DisplayName("should interrupt a blocked send when the cache token fires")
    void shouldInterruptBlockedSendOnCancel() throws Exception {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        cache.push(A, worker(A, 1).info);
        cache.trySendTransactionsToAddress(A, batch());

        CompletableFuture<SendResult> pending = CompletableFuture.supplyAsync(() -> blockingSend(cache, A));
        TimeUnit.MILLISECONDS.sleep(100);
        assertThat(pending).isNotDone();

        cacheCancel.cancel();

        assertThat(pending.get(5, TimeUnit.SECONDS).is(WorkersCacheError.SHUTDOWN)).isTrue();
    }

    @Test
    @DisplayName("should complete a blocked send once the worker drains its channel")
    void shouldCompleteBlockedSendWhenDrained() throws Exception {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker target = worker(A, 1);
        cache.push(A, target.info);
        cache.trySendTransactionsToAddress(A, batch());

        CompletableFuture<SendResult> pending = CompletableFuture.supplyAsync(() -> blockingSend(cache, A));
        assertThat(target.channel.receive(new CancellationToken())).isNotNull();

        assertThat(pending.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(target.channel.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should refuse to shut down the same worker twice")
    void shouldRefuseDoubleShutdown() {
        WorkersCache cache = new WorkersCache(2, cacheCancel, detachedShutdowns);
        TestWorker target = worker(A, 4);
        cache.push(A, target.info);
        ShutdownWorker popped = cache.pop(A).orElseThrow();

        popped.shutdown();

        assertThatThrownBy(popped::shutdown)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already been shut down");
        assertThat(target.shutdowns.get()).isEqualTo(1);
    }

    private static SendResult blockingSend(WorkersCache cache, InetSocketAddress peer) {
        try {
            return cache.sendTransactionsToAddress(peer, batch());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static TransactionBatch batch() {
        return TransactionBatch.of(List.of(new byte[]{1, 2, 3}));
    }

    /**
     * Worker without a thread: its task completes as soon as its token fires.
     */
    private TestWorker worker(InetSocketAddress peer, int channelSize) {
        TestWorker worker = new TestWorker(channelSize);
        CompletableFuture<Void> handle = worker.cancel.whenCancelled().thenRun(() -> {
            worker.shutdowns.incrementAndGet();
            stopped.add(peer);
        });
        worker.info = new WorkerInfo(worker.channel, handle, worker.cancel);
        return worker;
    }

    private TestWorker failingWorker(InetSocketAddress peer) {
        TestWorker worker = new TestWorker(4);
        CompletableFuture<Void> handle = worker.cancel.whenCancelled().thenRun(() -> {
            throw new IllegalStateException("worker crashed: " + peer);
        });
        worker.info = new WorkerInfo(worker.channel, handle, worker.cancel);
        return worker;
    }

    private static final class TestWorker {
        final WorkerChannel<TransactionBatch> channel;
        final CancellationToken cancel = new CancellationToken();
        final AtomicInteger shutdowns = new AtomicInteger();
        WorkerInfo info;

        TestWorker(int channelSize) {
            this.channel = new WorkerChannel<>(channelSize);
        }
    }
}
