package com.ryuqq.fleet.application.coordinator;

import com.ryuqq.fleet.core.model.OperationId;

/**
 * 입고용 공간 예약 (요청보다 적을 수 있음).
 *
 * @param operationId Operation
 * @param resourceSymbol 공간을 예약한 리소스
 * @param units 예약된 공간
 */
public record SpaceReservation(OperationId operationId, String resourceSymbol, int units) {

    public SpaceReservation {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (resourceSymbol == null || resourceSymbol.isBlank()) {
            throw new IllegalArgumentException("resourceSymbol cannot be null or blank");
        }
        if (units <= 0) {
            throw new IllegalArgumentException("units must be positive (current: " + units + ")");
        }
    }
}
