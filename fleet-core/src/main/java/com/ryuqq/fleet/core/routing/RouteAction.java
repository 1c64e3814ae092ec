package com.ryuqq.fleet.core.routing;

/**
 * 경로 단계의 동작 종류.
 */
public enum RouteAction {
    TRAVEL,
    REFUEL
}
