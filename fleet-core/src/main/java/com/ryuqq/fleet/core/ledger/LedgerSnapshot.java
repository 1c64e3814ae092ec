package com.ryuqq.fleet.core.ledger;

import com.ryuqq.fleet.core.model.OperationId;

import java.util.Map;

/**
 * 레저의 특정 시점 상태 (불변).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param resourceSymbol 리소스 심볼
 * @param operationId 소유 Operation
 * @param capacity 총 용량
 * @param inventory 보유 재고 (good → units)
 * @param reservedForWithdrawal 출고 예약 (good → units)
 * @param reservedSpace 입고 대기 중인 공간 예약
 */
public record LedgerSnapshot(
    String resourceSymbol,
    OperationId operationId,
    int capacity,
    Map<String, Integer> inventory,
    Map<String, Integer> reservedForWithdrawal,
    int reservedSpace
) {

    public LedgerSnapshot {
        inventory = inventory == null ? Map.of() : Map.copyOf(inventory);
        reservedForWithdrawal = reservedForWithdrawal == null ? Map.of() : Map.copyOf(reservedForWithdrawal);
    }

    public int totalCargoUnits() {
        int total = 0;
        for (int units : inventory.values()) {
            total += units;
        }
        return total;
    }

    public int availableSpace() {
        return capacity - totalCargoUnits() - reservedSpace;
    }

    public int availableCargo(String goodSymbol) {
        int held = inventory.getOrDefault(goodSymbol, 0);
        int reserved = reservedForWithdrawal.getOrDefault(goodSymbol, 0);
        return Math.max(0, held - reserved);
    }
}
