package com.ryuqq.fleet.application.coordinator;

import com.ryuqq.fleet.core.model.OperationId;

/**
 * 대기자에게 전달된 화물 예약.
 *
 * <p>예약된 화물은 호출자가 {@code confirmWithdrawal} 또는 {@code cancelWithdrawal}로 정리해야 합니다.
 * 어느 쪽도 호출하지 않으면 해당 수량은 계속 예약 상태로 남습니다.</p>
 *
 * @param operationId Operation
 * @param resourceSymbol 예약된 리소스
 * @param goodSymbol 상품
 * @param units 예약 수량 (양수, 요청한 최소 수량 이상)
 */
public record CargoReservation(OperationId operationId, String resourceSymbol, String goodSymbol, int units) {

    public CargoReservation {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (resourceSymbol == null || resourceSymbol.isBlank()) {
            throw new IllegalArgumentException("resourceSymbol cannot be null or blank");
        }
        if (goodSymbol == null || goodSymbol.isBlank()) {
            throw new IllegalArgumentException("goodSymbol cannot be null or blank");
        }
        if (units <= 0) {
            throw new IllegalArgumentException("units must be positive (current: " + units + ")");
        }
    }
}
