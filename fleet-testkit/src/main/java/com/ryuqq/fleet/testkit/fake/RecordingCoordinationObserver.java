package com.ryuqq.fleet.testkit.fake;

import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.CoordinationObserver;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CoordinationObserver that records every callback as a text line.
 *
 * <p>Lines have the form {@code TYPE key=value ...}, for example
 * {@code CARGO_RESERVED op=mining-1 resource=HAULER-1 good=IRON_ORE units=12}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingCoordinationObserver implements CoordinationObserver {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onResourceRegistered(OperationId operationId, String resourceSymbol, int capacity) {
        record("RESOURCE_REGISTERED op=" + operationId.getValue() + " resource=" + resourceSymbol
            + " capacity=" + capacity);
    }

    @Override
    public void onResourceUnregistered(OperationId operationId, String resourceSymbol, int failedWaiters) {
        record("RESOURCE_UNREGISTERED op=" + operationId.getValue() + " resource=" + resourceSymbol
            + " failedWaiters=" + failedWaiters);
    }

    @Override
    public void onCargoReserved(OperationId operationId, String resourceSymbol, String goodSymbol, int units) {
        record("CARGO_RESERVED op=" + operationId.getValue() + " resource=" + resourceSymbol
            + " good=" + goodSymbol + " units=" + units);
    }

    @Override
    public void onSpaceReserved(OperationId operationId, String resourceSymbol, int units) {
        record("SPACE_RESERVED op=" + operationId.getValue() + " resource=" + resourceSymbol + " units=" + units);
    }

    @Override
    public void onWaiterQueued(OperationId operationId, String goodSymbol, int minUnits, int queueDepth) {
        record("WAITER_QUEUED op=" + operationId.getValue() + " good=" + goodSymbol
            + " minUnits=" + minUnits + " depth=" + queueDepth);
    }

    @Override
    public void onWaiterCancelled(OperationId operationId, String goodSymbol) {
        record("WAITER_CANCELLED op=" + operationId.getValue() + " good=" + goodSymbol);
    }

    @Override
    public void onCargoDeposited(OperationId operationId, String resourceSymbol, String goodSymbol, int units) {
        record("CARGO_DEPOSITED op=" + operationId.getValue() + " resource=" + resourceSymbol
            + " good=" + goodSymbol + " units=" + units);
    }

    @Override
    public void onDepositNotificationDropped(String resourceSymbol, String goodSymbol, int units) {
        record("NOTIFICATION_DROPPED resource=" + resourceSymbol + " good=" + goodSymbol + " units=" + units);
    }

    @Override
    public void onPairing(OperationId operationId, String consumerId, String producerId) {
        record("PAIRING op=" + operationId.getValue() + " consumer=" + consumerId + " producer=" + producerId);
    }

    @Override
    public void onTransferCompleted(OperationId operationId, String consumerId, String producerId, long transferCount) {
        record("TRANSFER_COMPLETED op=" + operationId.getValue() + " consumer=" + consumerId
            + " producer=" + producerId + " count=" + transferCount);
    }

    @Override
    public void onCandidateSelected(String siteSymbol, String destinationSymbol, boolean feasible, int evaluatedPairs) {
        record("CANDIDATE_SELECTED site=" + siteSymbol + " destination=" + destinationSymbol
            + " feasible=" + feasible + " evaluated=" + evaluatedPairs);
    }

    public List<String> events() {
        return List.copyOf(events);
    }

    /**
     * Events of one type, in order.
     *
     * @param type event type, e.g. {@code WAITER_QUEUED}
     * @return matching lines
     */
    public List<String> events(String type) {
        List<String> matching = new ArrayList<>();
        String prefix = type + " ";
        for (String event : events) {
            if (event.startsWith(prefix)) {
                matching.add(event);
            }
        }
        return matching;
    }

    public int count(String type) {
        return events(type).size();
    }

    public void clear() {
        events.clear();
    }

    private void record(String event) {
        events.add(event);
    }
}
