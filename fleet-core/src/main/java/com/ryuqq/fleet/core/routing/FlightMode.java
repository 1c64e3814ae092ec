package com.ryuqq.fleet.core.routing;

/**
 * 이동 모드. 빠를수록 연료 소모가 큽니다.
 */
public enum FlightMode {
    BURN,
    CRUISE,
    DRIFT
}
