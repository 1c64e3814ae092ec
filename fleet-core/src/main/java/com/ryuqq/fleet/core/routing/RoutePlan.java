package com.ryuqq.fleet.core.routing;

import java.util.List;

/**
 * 라우팅 오라클이 반환한 경로.
 *
 * <p>합계가 주어지지 않으면 {@link #of(List)}가 단계별 값을 합산합니다.</p>
 *
 * @param steps 순서대로 실행할 단계
 * @param totalFuelCost 총 연료 소모
 * @param totalTimeSeconds 총 소요 시간 (초)
 */
public record RoutePlan(List<RouteStep> steps, int totalFuelCost, int totalTimeSeconds) {

    public RoutePlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (totalFuelCost < 0) {
            throw new IllegalArgumentException("totalFuelCost cannot be negative (current: " + totalFuelCost + ")");
        }
        if (totalTimeSeconds < 0) {
            throw new IllegalArgumentException("totalTimeSeconds cannot be negative (current: " + totalTimeSeconds + ")");
        }
    }

    public static RoutePlan of(List<RouteStep> steps) {
        int fuel = 0;
        int time = 0;
        if (steps != null) {
            for (RouteStep step : steps) {
                fuel += step.fuelCost();
                time += step.timeSeconds();
            }
        }
        return new RoutePlan(steps, fuel, time);
    }

    public int refuelStops() {
        int count = 0;
        for (RouteStep step : steps) {
            if (step.action() == RouteAction.REFUEL) {
                count++;
            }
        }
        return count;
    }
}
