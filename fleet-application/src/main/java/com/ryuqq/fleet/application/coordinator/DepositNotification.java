package com.ryuqq.fleet.application.coordinator;

/**
 * 리소스 입고 알림.
 *
 * @param resourceSymbol 입고된 리소스
 * @param goodSymbol 상품
 * @param units 수량
 */
public record DepositNotification(String resourceSymbol, String goodSymbol, int units) {
}
