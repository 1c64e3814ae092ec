package com.ryuqq.fleet.core.routing;

import com.ryuqq.fleet.core.model.Location;

import java.util.List;

/**
 * 경로 계획 요청.
 *
 * @param origin 출발 지점 심볼
 * @param destination 도착 지점 심볼
 * @param currentFuel 출발 시 연료
 * @param fuelCapacity 연료 탱크 용량
 * @param engineSpeed 엔진 속도
 * @param locations 경로 탐색에 쓸 지역 내 지점 전체
 */
public record RouteRequest(
    String origin,
    String destination,
    int currentFuel,
    int fuelCapacity,
    int engineSpeed,
    List<Location> locations
) {

    public RouteRequest {
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("origin cannot be null or blank");
        }
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (fuelCapacity < 0) {
            throw new IllegalArgumentException("fuelCapacity cannot be negative (current: " + fuelCapacity + ")");
        }
        if (currentFuel < 0 || currentFuel > fuelCapacity) {
            throw new IllegalArgumentException(
                "currentFuel must be between 0 and " + fuelCapacity + " (current: " + currentFuel + ")");
        }
        if (engineSpeed <= 0) {
            throw new IllegalArgumentException("engineSpeed must be positive (current: " + engineSpeed + ")");
        }
        locations = locations == null ? List.of() : List.copyOf(locations);
    }
}
