package fr.lapetina.forwarder.worker;

import fr.lapetina.forwarder.domain.model.SendResult;
import fr.lapetina.forwarder.domain.model.WorkersCacheError;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded multi-producer, single-consumer channel between the cache and one worker.
 *
 * Either side can be closed independently:
 * - closing the sender lets the receiver drain what is buffered, then observe end of stream
 * - closing the receiver discards the buffer; every later send reports
 *   {@link WorkersCacheError#RECEIVER_DROPPED}, including sends already blocked waiting for space
 *
 * Sending after the sender has been closed is a programming error.
 *
 * @param <T> element type
 */
public final class WorkerChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> buffer;
    private final int capacity;

    private boolean senderClosed;
    private boolean receiverClosed;

    public WorkerChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Enqueues without waiting.
     *
     * @return OK, FULL_CHANNEL if the buffer is saturated, RECEIVER_DROPPED if the receiver is gone
     */
    public SendResult trySend(T item) {
        Objects.requireNonNull(item, "Item is required");
        lock.lock();
        try {
            ensureSenderOpen();
            if (receiverClosed) {
                return SendResult.failure(WorkersCacheError.RECEIVER_DROPPED);
            }
            if (buffer.size() >= capacity) {
                return SendResult.failure(WorkersCacheError.FULL_CHANNEL);
            }
            enqueue(item);
            return SendResult.ok();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueues, waiting for space as long as necessary.
     *
     * The cancellation token is checked before every enqueue attempt, so a token
     * that has fired wins over free space.
     *
     * @return OK, RECEIVER_DROPPED if the receiver is gone, SHUTDOWN if {@code cancel} fired first
     */
    public SendResult send(T item, CancellationToken cancel) throws InterruptedException {
        Objects.requireNonNull(item, "Item is required");
        try (CancellationToken.Registration ignored = cancel.onCancel(this::wakeAll)) {
            lock.lockInterruptibly();
            try {
                while (true) {
                    if (cancel.isCancelled()) {
                        return SendResult.failure(WorkersCacheError.SHUTDOWN);
                    }
                    ensureSenderOpen();
                    if (receiverClosed) {
                        return SendResult.failure(WorkersCacheError.RECEIVER_DROPPED);
                    }
                    if (buffer.size() < capacity) {
                        enqueue(item);
                        return SendResult.ok();
                    }
                    notFull.await();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Takes the next item, waiting until one is available.
     *
     * @return the next item, or {@code null} once the channel is closed and drained,
     *         or {@code cancel} has fired
     */
    public T receive(CancellationToken cancel) throws InterruptedException {
        try (CancellationToken.Registration ignored = cancel.onCancel(this::wakeAll)) {
            lock.lockInterruptibly();
            try {
                while (true) {
                    if (cancel.isCancelled() || receiverClosed) {
                        return null;
                    }
                    T item = buffer.poll();
                    if (item != null) {
                        notFull.signalAll();
                        return item;
                    }
                    if (senderClosed) {
                        return null;
                    }
                    notEmpty.await();
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Closes the send side. Idempotent.
     */
    public void closeSender() {
        lock.lock();
        try {
            senderClosed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the receive side, discarding buffered items. Idempotent.
     */
    public void closeReceiver() {
        lock.lock();
        try {
            receiverClosed = true;
            buffer.clear();
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSenderClosed() {
        lock.lock();
        try {
            return senderClosed;
        } finally {
            lock.unlock();
        }
    }

    public boolean isReceiverClosed() {
        lock.lock();
        try {
            return receiverClosed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(T item) {
        buffer.add(item);
        notEmpty.signal();
    }

    private void ensureSenderOpen() {
        if (senderClosed) {
            throw new IllegalStateException("Sender has already been closed");
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            notFull.signalAll();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
