package com.ryuqq.fleet.core.spi;

import com.ryuqq.fleet.core.model.OperationId;

/**
 * Observation hook for coordination events.
 *
 * <p>Coordinators report every state change here instead of touching global state, so that a
 * metrics exporter or an audit log can be plugged in without changing the engine. Callbacks run
 * on the thread that caused the event, sometimes while the coordinator holds its registry lock:
 * implementations must be fast, must not block and must not call back into the coordinator.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.fleet.core.spi.noop.NoOpCoordinationObserver
 */
public interface CoordinationObserver {

    void onResourceRegistered(OperationId operationId, String resourceSymbol, int capacity);

    /**
     * A resource was removed.
     *
     * @param operationId owning operation
     * @param resourceSymbol removed resource
     * @param failedWaiters number of waiters that received a terminal error
     */
    void onResourceUnregistered(OperationId operationId, String resourceSymbol, int failedWaiters);

    void onCargoReserved(OperationId operationId, String resourceSymbol, String goodSymbol, int units);

    void onSpaceReserved(OperationId operationId, String resourceSymbol, int units);

    /**
     * A caller could not be served immediately and joined the FIFO queue.
     *
     * @param operationId operation
     * @param goodSymbol good waited for
     * @param minUnits minimum units requested
     * @param queueDepth queue length after enqueueing
     */
    void onWaiterQueued(OperationId operationId, String goodSymbol, int minUnits, int queueDepth);

    void onWaiterCancelled(OperationId operationId, String goodSymbol);

    void onCargoDeposited(OperationId operationId, String resourceSymbol, String goodSymbol, int units);

    /**
     * A deposit notification was not delivered because the subscriber's buffer was full.
     */
    void onDepositNotificationDropped(String resourceSymbol, String goodSymbol, int units);

    void onPairing(OperationId operationId, String consumerId, String producerId);

    void onTransferCompleted(OperationId operationId, String consumerId, String producerId, long transferCount);

    /**
     * The candidate search chose an operating location.
     *
     * @param siteSymbol chosen site
     * @param destinationSymbol chosen destination
     * @param feasible false when chosen through the infeasible override
     * @param evaluatedPairs number of pairs fully evaluated
     */
    void onCandidateSelected(String siteSymbol, String destinationSymbol, boolean feasible, int evaluatedPairs);
}
