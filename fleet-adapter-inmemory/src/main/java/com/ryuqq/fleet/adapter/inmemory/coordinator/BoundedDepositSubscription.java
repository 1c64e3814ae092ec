package com.ryuqq.fleet.adapter.inmemory.coordinator;

import com.ryuqq.fleet.application.coordinator.DepositNotification;
import com.ryuqq.fleet.application.coordinator.DepositSubscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Fixed-size, drop-on-full deposit subscription.
 *
 * <p>The coordinator delivers with {@link #offer(DepositNotification)}, which never blocks. A closed
 * subscription accepts nothing; notifications already buffered can still be drained.</p>
 *
 * <p>{@link #poll(long, TimeUnit)} waits in slices of at most {@value #POLL_SLICE_MS}ms so that a
 * caller blocked on an empty buffer notices a close within one slice.</p>
 */
final class BoundedDepositSubscription implements DepositSubscription {

    static final long POLL_SLICE_MS = 50;

    /**
     * Result of a non-blocking delivery.
     */
    enum Delivery {
        DELIVERED,
        DROPPED,
        CLOSED
    }

    private final String resourceSymbol;
    private final ArrayBlockingQueue<DepositNotification> buffer;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Consumer<BoundedDepositSubscription> unsubscribe;

    BoundedDepositSubscription(String resourceSymbol, int capacity, Consumer<BoundedDepositSubscription> unsubscribe) {
        this.resourceSymbol = resourceSymbol;
        this.buffer = new ArrayBlockingQueue<>(capacity);
        this.unsubscribe = unsubscribe;
    }

    /**
     * Non-blocking delivery. Only a full buffer counts as a drop.
     */
    Delivery offer(DepositNotification notification) {
        if (closed.get()) {
            return Delivery.CLOSED;
        }
        if (!buffer.offer(notification)) {
            dropped.incrementAndGet();
            return Delivery.DROPPED;
        }
        return Delivery.DELIVERED;
    }

    /**
     * Closes without calling back into the coordinator (resource removed).
     */
    void closeByCoordinator() {
        closed.set(true);
    }

    @Override
    public String resourceSymbol() {
        return resourceSymbol;
    }

    @Override
    public Optional<DepositNotification> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (true) {
            DepositNotification next = buffer.poll();
            if (next != null) {
                return Optional.of(next);
            }
            long remaining = deadline - System.nanoTime();
            if (closed.get() || remaining <= 0) {
                return Optional.empty();
            }
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(POLL_SLICE_MS));
            next = buffer.poll(slice, TimeUnit.NANOSECONDS);
            if (next != null) {
                return Optional.of(next);
            }
        }
    }

    @Override
    public List<DepositNotification> drain() {
        List<DepositNotification> drained = new ArrayList<>();
        buffer.drainTo(drained);
        return drained;
    }

    @Override
    public long droppedCount() {
        return dropped.get();
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            unsubscribe.accept(this);
        }
    }

    @Override
    public String toString() {
        return "DepositSubscription{" + resourceSymbol + ", buffered=" + buffer.size()
            + ", dropped=" + dropped.get() + ", closed=" + closed.get() + '}';
    }
}
