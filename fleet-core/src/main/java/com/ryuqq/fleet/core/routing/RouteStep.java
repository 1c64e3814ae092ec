package com.ryuqq.fleet.core.routing;

/**
 * 경로의 한 단계.
 *
 * @param action 동작 (이동 또는 급유)
 * @param waypoint 도착 지점 (급유의 경우 급유 지점)
 * @param fuelCost 소모 연료 (급유 단계는 0)
 * @param timeSeconds 소요 시간 (초)
 * @param mode 이동 모드 (급유 단계는 null)
 */
public record RouteStep(
    RouteAction action,
    String waypoint,
    int fuelCost,
    int timeSeconds,
    FlightMode mode
) {

    public RouteStep {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (waypoint == null || waypoint.isBlank()) {
            throw new IllegalArgumentException("waypoint cannot be null or blank");
        }
        if (fuelCost < 0) {
            throw new IllegalArgumentException("fuelCost cannot be negative (current: " + fuelCost + ")");
        }
        if (timeSeconds < 0) {
            throw new IllegalArgumentException("timeSeconds cannot be negative (current: " + timeSeconds + ")");
        }
        if (action == RouteAction.TRAVEL && mode == null) {
            throw new IllegalArgumentException("travel step requires a flight mode");
        }
    }

    public static RouteStep travel(String waypoint, int fuelCost, int timeSeconds, FlightMode mode) {
        return new RouteStep(RouteAction.TRAVEL, waypoint, fuelCost, timeSeconds, mode);
    }

    public static RouteStep refuel(String waypoint) {
        return new RouteStep(RouteAction.REFUEL, waypoint, 0, 0, null);
    }
}
