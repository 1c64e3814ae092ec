package com.ryuqq.fleet.adapter.inmemory.coordinator;

import com.ryuqq.fleet.application.coordinator.CargoReservation;
import com.ryuqq.fleet.application.coordinator.DepositNotification;
import com.ryuqq.fleet.application.coordinator.DepositSubscription;
import com.ryuqq.fleet.application.coordinator.ResourceCoordinator;
import com.ryuqq.fleet.application.coordinator.SpaceReservation;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.ledger.ResourceLedger;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.CoordinationObserver;
import com.ryuqq.fleet.core.spi.noop.NoOpCoordinationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link ResourceCoordinator}.
 *
 * <p>All ledgers of all operations live in one registry guarded by a coarse
 * {@link ReentrantReadWriteLock}. Cargo and space accounting is delegated to each
 * {@link ResourceLedger}, which has its own monitor, so work on one ledger never waits on another.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Ledger registry:</strong> symbol → ledger, and operation → symbols in registration order</li>
 *   <li><strong>Waiter queues:</strong> (operation, good) → FIFO of blocked {@code waitForCargo} callers</li>
 *   <li><strong>Deposit subscribers:</strong> symbol → bounded, drop-on-full subscriptions</li>
 * </ul>
 *
 * <p><strong>Locking rules:</strong></p>
 * <ul>
 *   <li>Lock order is always registry lock → ledger monitor, never the reverse</li>
 *   <li>Anything that may satisfy a waiter (deposits, registration, cancelled withdrawals) runs under the write lock</li>
 *   <li>{@code waitForCargo} makes its immediate attempt and enqueues under one write-lock hold,
 *       so a deposit cannot slip in between a failed attempt and the enqueue</li>
 *   <li>Cancellation and delivery both complete the waiter's future under the write lock; the first one wins</li>
 * </ul>
 *
 * <p><strong>Fairness:</strong> every caller first attempts an immediate reservation across the
 * operation's resources, even when others are already queued for the same (operation, good); only a
 * caller that cannot be served joins the back of the queue. Queue processing stops at the first
 * waiter that cannot be satisfied.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResourceCoordinator implements ResourceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResourceCoordinator.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registered ledgers by resource symbol.
     */
    private final Map<String, ResourceLedger> ledgers = new HashMap<>();

    /**
     * Resource symbols per operation, in registration order.
     *
     * <p>Reservations scan resources in this order.</p>
     */
    private final Map<OperationId, List<String>> symbolsByOperation = new HashMap<>();

    /**
     * FIFO waiter queues. Empty queues are removed.
     */
    private final Map<WaiterKey, Deque<Waiter>> waiters = new HashMap<>();

    /**
     * Deposit subscriptions by resource symbol. A symbol may have subscribers before it is registered.
     */
    private final Map<String, List<BoundedDepositSubscription>> subscribers = new HashMap<>();

    private final CoordinatorConfig config;
    private final CoordinationObserver observer;

    /**
     * Creates a coordinator with default config and no observer.
     */
    public InMemoryResourceCoordinator() {
        this(new CoordinatorConfig(), NoOpCoordinationObserver.INSTANCE);
    }

    public InMemoryResourceCoordinator(CoordinatorConfig config) {
        this(config, NoOpCoordinationObserver.INSTANCE);
    }

    /**
     * Creates a coordinator.
     *
     * @param config coordinator settings
     * @param observer receives every state change
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryResourceCoordinator(CoordinatorConfig config, CoordinationObserver observer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        this.config = config;
        this.observer = observer;
    }

    // ============================================================
    // Registration
    // ============================================================

    @Override
    public void registerResource(ResourceLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }

        lock.writeLock().lock();
        try {
            String symbol = ledger.resourceSymbol();
            if (ledgers.containsKey(symbol)) {
                throw CoordinationException.alreadyRegistered(symbol);
            }

            OperationId operationId = ledger.operationId();
            ledgers.put(symbol, ledger);
            symbolsByOperation.computeIfAbsent(operationId, k -> new ArrayList<>()).add(symbol);
            observer.onResourceRegistered(operationId, symbol, ledger.capacity());
            log.info("Registered resource {} for operation {} (capacity {})",
                symbol, operationId.getValue(), ledger.capacity());

            // waiters may have queued before this resource came back after a restart
            for (String good : ledger.goods()) {
                processWaiterQueue(new WaiterKey(operationId, good));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void unregisterResource(String resourceSymbol) {
        lock.writeLock().lock();
        try {
            ResourceLedger ledger = ledgers.remove(resourceSymbol);
            if (ledger == null) {
                log.debug("Ignoring unregister of unknown resource {}", resourceSymbol);
                return;
            }

            OperationId operationId = ledger.operationId();
            List<String> symbols = symbolsByOperation.get(operationId);
            if (symbols != null) {
                symbols.remove(resourceSymbol);
                if (symbols.isEmpty()) {
                    symbolsByOperation.remove(operationId);
                }
            }

            int failed = 0;
            Iterator<Map.Entry<WaiterKey, Deque<Waiter>>> it = waiters.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<WaiterKey, Deque<Waiter>> entry = it.next();
                if (!entry.getKey().operationId().equals(operationId)) {
                    continue;
                }
                for (Waiter waiter : entry.getValue()) {
                    if (waiter.result.completeExceptionally(CoordinationException.resourceGone(resourceSymbol))) {
                        failed++;
                    }
                }
                it.remove();
            }

            List<BoundedDepositSubscription> subs = subscribers.remove(resourceSymbol);
            if (subs != null) {
                for (BoundedDepositSubscription sub : subs) {
                    sub.closeByCoordinator();
                }
            }

            observer.onResourceUnregistered(operationId, resourceSymbol, failed);
            log.info("Unregistered resource {} of operation {} ({} waiters released)",
                resourceSymbol, operationId.getValue(), failed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================================================
    // Waiting for cargo
    // ============================================================

    @Override
    public CargoReservation waitForCargo(CancellationSignal signal, OperationId operationId,
                                         String goodSymbol, int minUnits) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (goodSymbol == null || goodSymbol.isBlank()) {
            throw new IllegalArgumentException("goodSymbol cannot be null or blank");
        }
        if (minUnits <= 0) {
            throw new IllegalArgumentException("minUnits must be positive (current: " + minUnits + ")");
        }

        if (signal.isCancelled()) {
            throw CoordinationException.waitCancelled(operationId.getValue(), goodSymbol);
        }

        WaiterKey key = new WaiterKey(operationId, goodSymbol);
        Waiter waiter;

        lock.writeLock().lock();
        try {
            List<String> symbols = symbolsByOperation.get(operationId);
            if (symbols == null || symbols.isEmpty()) {
                throw CoordinationException.operationNotFound(operationId.getValue());
            }
            CargoReservation immediate = tryReserve(key, minUnits);
            if (immediate != null) {
                return immediate;
            }

            waiter = new Waiter(minUnits);
            Deque<Waiter> queue = waiters.computeIfAbsent(key, k -> new ArrayDeque<>());
            queue.addLast(waiter);
            observer.onWaiterQueued(operationId, goodSymbol, minUnits, queue.size());
            log.debug("Queued waiter for {} x{} on operation {} (depth {})",
                goodSymbol, minUnits, operationId.getValue(), queue.size());
        } finally {
            lock.writeLock().unlock();
        }

        CancellationSignal.Registration registration = signal.onCancel(() -> cancelWaiter(key, waiter));
        try {
            return waiter.result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelWaiter(key, waiter);
            return outcomeOf(waiter);
        } catch (ExecutionException e) {
            throw unwrap(e);
        } finally {
            registration.close();
        }
    }

    /**
     * Removes a waiter that has not been served yet.
     *
     * <p>If it was at the head of its queue, the rest of the queue is processed again.</p>
     */
    private void cancelWaiter(WaiterKey key, Waiter waiter) {
        lock.writeLock().lock();
        try {
            if (waiter.result.isDone()) {
                return;
            }

            boolean wasHead = false;
            Deque<Waiter> queue = waiters.get(key);
            if (queue != null) {
                wasHead = queue.peekFirst() == waiter;
                queue.remove(waiter);
                if (queue.isEmpty()) {
                    waiters.remove(key);
                }
            }

            waiter.result.completeExceptionally(
                CoordinationException.waitCancelled(key.operationId().getValue(), key.goodSymbol()));
            observer.onWaiterCancelled(key.operationId(), key.goodSymbol());
            log.debug("Cancelled waiter for {} on operation {}", key.goodSymbol(), key.operationId().getValue());

            if (wasHead) {
                processWaiterQueue(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Serves queued waiters in arrival order, stopping at the first one that cannot be satisfied.
     *
     * <p>Caller must hold the write lock.</p>
     */
    private void processWaiterQueue(WaiterKey key) {
        Deque<Waiter> queue = waiters.get(key);
        if (queue == null) {
            return;
        }

        while (!queue.isEmpty()) {
            Waiter head = queue.peekFirst();
            if (head.result.isDone()) {
                queue.pollFirst();
                continue;
            }

            CargoReservation reservation = tryReserve(key, head.minUnits);
            if (reservation == null) {
                break;
            }
            queue.pollFirst();
            head.result.complete(reservation);
        }

        if (queue.isEmpty()) {
            waiters.remove(key);
        }
    }

    /**
     * First resource (registration order) that can reserve at least minUnits.
     *
     * <p>Caller must hold the write lock.</p>
     */
    private CargoReservation tryReserve(WaiterKey key, int minUnits) {
        List<String> symbols = symbolsByOperation.get(key.operationId());
        if (symbols == null) {
            return null;
        }
        for (String symbol : symbols) {
            ResourceLedger ledger = ledgers.get(symbol);
            if (ledger == null) {
                continue;
            }
            int units = ledger.tryReserveCargo(key.goodSymbol(), minUnits);
            if (units > 0) {
                observer.onCargoReserved(key.operationId(), symbol, key.goodSymbol(), units);
                log.debug("Reserved {} x{} on {} for operation {}",
                    key.goodSymbol(), units, symbol, key.operationId().getValue());
                return new CargoReservation(key.operationId(), symbol, key.goodSymbol(), units);
            }
        }
        return null;
    }

    private static CargoReservation outcomeOf(Waiter waiter) {
        try {
            return waiter.result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CoordinationException) {
                throw (CoordinationException) e.getCause();
            }
            throw e;
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("waiter completed with unexpected error", cause);
    }

    // ============================================================
    // Deposits
    // ============================================================

    @Override
    public void notifyDeposit(String resourceSymbol, String goodSymbol, int units) {
        lock.writeLock().lock();
        try {
            ResourceLedger ledger = ledgers.get(resourceSymbol);
            if (ledger == null) {
                log.debug("Ignoring deposit of {} x{} to unknown resource {}", goodSymbol, units, resourceSymbol);
                return;
            }

            try {
                ledger.depositCargo(goodSymbol, units);
            } catch (CoordinationException e) {
                // cargo has already moved; the ledger just could not account for it
                log.warn("Dropping deposit of {} x{} to {}: {}", goodSymbol, units, resourceSymbol, e.getMessage());
                return;
            }

            afterDeposit(ledger, goodSymbol, units);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void confirmDeposit(String resourceSymbol, String goodSymbol, int units) {
        lock.writeLock().lock();
        try {
            ResourceLedger ledger = ledgers.get(resourceSymbol);
            if (ledger == null) {
                log.debug("Ignoring confirmed deposit of {} x{} to unknown resource {}", goodSymbol, units, resourceSymbol);
                return;
            }

            ledger.confirmDeposit(goodSymbol, units);
            afterDeposit(ledger, goodSymbol, units);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Fan-out to subscribers, then wake waiters. Caller must hold the write lock.
     */
    private void afterDeposit(ResourceLedger ledger, String goodSymbol, int units) {
        String symbol = ledger.resourceSymbol();
        observer.onCargoDeposited(ledger.operationId(), symbol, goodSymbol, units);

        List<BoundedDepositSubscription> subs = subscribers.get(symbol);
        if (subs != null) {
            DepositNotification notification = new DepositNotification(symbol, goodSymbol, units);
            for (BoundedDepositSubscription sub : subs) {
                if (sub.offer(notification) == BoundedDepositSubscription.Delivery.DROPPED) {
                    observer.onDepositNotificationDropped(symbol, goodSymbol, units);
                    log.debug("Subscriber of {} is full, dropped {} x{}", symbol, goodSymbol, units);
                }
            }
        }

        processWaiterQueue(new WaiterKey(ledger.operationId(), goodSymbol));
    }

    @Override
    public void notifyJettison(String resourceSymbol, String goodSymbol, int units) {
        lock.readLock().lock();
        try {
            ResourceLedger ledger = ledgers.get(resourceSymbol);
            if (ledger == null) {
                log.debug("Ignoring jettison of {} x{} from unknown resource {}", goodSymbol, units, resourceSymbol);
                return;
            }

            try {
                ledger.jettisonCargo(goodSymbol, units);
            } catch (CoordinationException e) {
                log.warn("Dropping jettison of {} x{} from {}: {}", goodSymbol, units, resourceSymbol, e.getMessage());
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void releaseReservedSpace(String resourceSymbol, int units) {
        lock.readLock().lock();
        try {
            ResourceLedger ledger = ledgers.get(resourceSymbol);
            if (ledger == null) {
                log.debug("Ignoring space release on unknown resource {}", resourceSymbol);
                return;
            }
            ledger.releaseReservedSpace(units);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<SpaceReservation> reserveSpaceForDeposit(OperationId operationId, int units) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (units <= 0) {
            throw new IllegalArgumentException("units must be positive (current: " + units + ")");
        }

        lock.writeLock().lock();
        try {
            for (String symbol : symbolsByOperation.getOrDefault(operationId, List.of())) {
                ResourceLedger ledger = ledgers.get(symbol);
                if (ledger == null) {
                    continue;
                }
                int available = ledger.availableSpace();
                if (available <= 0) {
                    continue;
                }
                int granted = Math.min(units, available);
                ledger.reserveSpace(granted);
                observer.onSpaceReserved(operationId, symbol, granted);
                return Optional.of(new SpaceReservation(operationId, symbol, granted));
            }
            return Optional.empty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================================================
    // Withdrawals
    // ============================================================

    @Override
    public void confirmWithdrawal(String resourceSymbol, String goodSymbol, int units) {
        lock.readLock().lock();
        try {
            requireLedger(resourceSymbol).confirmWithdrawal(goodSymbol, units);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void cancelWithdrawal(String resourceSymbol, String goodSymbol, int units) {
        lock.writeLock().lock();
        try {
            ResourceLedger ledger = requireLedger(resourceSymbol);
            ledger.cancelReservation(goodSymbol, units);
            processWaiterQueue(new WaiterKey(ledger.operationId(), goodSymbol));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ResourceLedger requireLedger(String resourceSymbol) {
        ResourceLedger ledger = ledgers.get(resourceSymbol);
        if (ledger == null) {
            throw CoordinationException.resourceGone(resourceSymbol);
        }
        return ledger;
    }

    // ============================================================
    // Queries
    // ============================================================

    @Override
    public int totalAvailableCargo(OperationId operationId, String goodSymbol) {
        lock.readLock().lock();
        try {
            int total = 0;
            for (String symbol : symbolsByOperation.getOrDefault(operationId, List.of())) {
                ResourceLedger ledger = ledgers.get(symbol);
                if (ledger != null) {
                    total += ledger.availableCargo(goodSymbol);
                }
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<ResourceLedger> findResourceWithSpace(OperationId operationId, int minSpace) {
        lock.readLock().lock();
        try {
            for (String symbol : symbolsByOperation.getOrDefault(operationId, List.of())) {
                ResourceLedger ledger = ledgers.get(symbol);
                if (ledger != null && ledger.availableSpace() >= minSpace) {
                    return Optional.of(ledger);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<ResourceLedger> findResource(String resourceSymbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(ledgers.get(resourceSymbol));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ResourceLedger> resourcesForOperation(OperationId operationId) {
        lock.readLock().lock();
        try {
            List<ResourceLedger> result = new ArrayList<>();
            for (String symbol : symbolsByOperation.getOrDefault(operationId, List.of())) {
                ResourceLedger ledger = ledgers.get(symbol);
                if (ledger != null) {
                    result.add(ledger);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int waitingCount(OperationId operationId, String goodSymbol) {
        lock.readLock().lock();
        try {
            Deque<Waiter> queue = waiters.get(new WaiterKey(operationId, goodSymbol));
            return queue == null ? 0 : queue.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ============================================================
    // Subscriptions
    // ============================================================

    @Override
    public DepositSubscription subscribeToDeposits(String resourceSymbol) {
        if (resourceSymbol == null || resourceSymbol.isBlank()) {
            throw new IllegalArgumentException("resourceSymbol cannot be null or blank");
        }

        lock.writeLock().lock();
        try {
            BoundedDepositSubscription subscription = new BoundedDepositSubscription(
                resourceSymbol, config.subscriptionBufferSize(), this::unsubscribe);
            subscribers.computeIfAbsent(resourceSymbol, k -> new ArrayList<>()).add(subscription);
            return subscription;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void unsubscribe(BoundedDepositSubscription subscription) {
        lock.writeLock().lock();
        try {
            List<BoundedDepositSubscription> subs = subscribers.get(subscription.resourceSymbol());
            if (subs == null) {
                return;
            }
            subs.remove(subscription);
            if (subs.isEmpty()) {
                subscribers.remove(subscription.resourceSymbol());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ============================================================
    // Internal types
    // ============================================================

    private record WaiterKey(OperationId operationId, String goodSymbol) {
    }

    /**
     * A blocked {@code waitForCargo} caller. Identity matters: two waiters with the same minimum are distinct.
     */
    private static final class Waiter {

        private final int minUnits;
        private final CompletableFuture<CargoReservation> result = new CompletableFuture<>();

        private Waiter(int minUnits) {
            this.minUnits = minUnits;
        }
    }
}
