package com.ryuqq.fleet.application.candidate;

/**
 * 후보 비용 계산에 쓰는 기준 함선 사양.
 *
 * @param fuelCapacity 연료 탱크 용량
 * @param engineSpeed 엔진 속도
 */
public record ShipProfile(int fuelCapacity, int engineSpeed) {

    public ShipProfile {
        if (fuelCapacity <= 0) {
            throw new IllegalArgumentException("fuelCapacity must be positive (current: " + fuelCapacity + ")");
        }
        if (engineSpeed <= 0) {
            throw new IllegalArgumentException("engineSpeed must be positive (current: " + engineSpeed + ")");
        }
    }
}
