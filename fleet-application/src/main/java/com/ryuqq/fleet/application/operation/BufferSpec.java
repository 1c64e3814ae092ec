package com.ryuqq.fleet.application.operation;

import java.util.Map;

/**
 * Operation이 사용할 버퍼 리소스 하나.
 *
 * @param resourceSymbol 리소스 심볼
 * @param capacity 용량
 * @param initialCargo 현재 적재 화물 (재시작 복구 시)
 */
public record BufferSpec(String resourceSymbol, int capacity, Map<String, Integer> initialCargo) {

    public BufferSpec {
        if (resourceSymbol == null || resourceSymbol.isBlank()) {
            throw new IllegalArgumentException("resourceSymbol cannot be null or blank");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative (current: " + capacity + ")");
        }
        initialCargo = initialCargo == null ? Map.of() : Map.copyOf(initialCargo);
    }

    public static BufferSpec empty(String resourceSymbol, int capacity) {
        return new BufferSpec(resourceSymbol, capacity, Map.of());
    }
}
