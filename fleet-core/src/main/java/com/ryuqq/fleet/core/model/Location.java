package com.ryuqq.fleet.core.model;

import java.util.Set;

/**
 * 지역 내 알려진 위치 (좌표, 특성, 연료 보급 여부).
 *
 * <p>후보 탐색 시 채굴지/목적지 후보를 고르고, 라우팅 오라클에 지도 정보로 전달됩니다.</p>
 *
 * @param symbol 위치 심볼 (예: X1-AB12-C3)
 * @param x X 좌표
 * @param y Y 좌표
 * @param traits 위치 특성 (예: ICE_CRYSTALS, MARKETPLACE)
 * @param hasFuel 연료 보급 가능 여부
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Location(String symbol, double x, double y, Set<String> traits, boolean hasFuel) {

    public Location {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        traits = traits == null ? Set.of() : Set.copyOf(traits);
    }

    /**
     * 특성 보유 여부.
     *
     * @param trait 특성 이름
     * @return 보유 시 true
     */
    public boolean hasTrait(String trait) {
        return traits.contains(trait);
    }

    /**
     * 다른 위치까지의 유클리드 거리.
     *
     * @param other 대상 위치
     * @return 거리
     */
    public double distanceTo(Location other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return Math.sqrt(dx * dx + dy * dy);
    }
}
