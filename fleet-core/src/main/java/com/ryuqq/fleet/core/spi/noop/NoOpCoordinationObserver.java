package com.ryuqq.fleet.core.spi.noop;

import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.CoordinationObserver;

/**
 * CoordinationObserver NoOp 구현.
 *
 * <p>모든 이벤트를 무시합니다. 관측 계층 없이 실행할 때의 기본값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpCoordinationObserver implements CoordinationObserver {

    public static final NoOpCoordinationObserver INSTANCE = new NoOpCoordinationObserver();

    @Override
    public void onResourceRegistered(OperationId operationId, String resourceSymbol, int capacity) {
        // NoOp
    }

    @Override
    public void onResourceUnregistered(OperationId operationId, String resourceSymbol, int failedWaiters) {
        // NoOp
    }

    @Override
    public void onCargoReserved(OperationId operationId, String resourceSymbol, String goodSymbol, int units) {
        // NoOp
    }

    @Override
    public void onSpaceReserved(OperationId operationId, String resourceSymbol, int units) {
        // NoOp
    }

    @Override
    public void onWaiterQueued(OperationId operationId, String goodSymbol, int minUnits, int queueDepth) {
        // NoOp
    }

    @Override
    public void onWaiterCancelled(OperationId operationId, String goodSymbol) {
        // NoOp
    }

    @Override
    public void onCargoDeposited(OperationId operationId, String resourceSymbol, String goodSymbol, int units) {
        // NoOp
    }

    @Override
    public void onDepositNotificationDropped(String resourceSymbol, String goodSymbol, int units) {
        // NoOp
    }

    @Override
    public void onPairing(OperationId operationId, String consumerId, String producerId) {
        // NoOp
    }

    @Override
    public void onTransferCompleted(OperationId operationId, String consumerId, String producerId, long transferCount) {
        // NoOp
    }

    @Override
    public void onCandidateSelected(String siteSymbol, String destinationSymbol, boolean feasible, int evaluatedPairs) {
        // NoOp
    }
}
