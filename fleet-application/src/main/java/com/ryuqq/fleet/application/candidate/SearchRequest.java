package com.ryuqq.fleet.application.candidate;

import com.ryuqq.fleet.core.model.ExtractionTarget;
import com.ryuqq.fleet.core.model.Location;

import java.util.List;

/**
 * 후보 탐색 요청.
 *
 * @param targetTrait 작업지 특성 (예: ICE_CRYSTALS)
 * @param ship 기준 함선
 * @param locations 지역 내 알려진 지점 전체 (작업지, 목적지, 급유 지점 포함)
 * @param allowInfeasible 실행 가능한 후보가 없을 때 비용이 가장 작은 후보를 허용할지 여부
 */
public record SearchRequest(String targetTrait, ShipProfile ship, List<Location> locations, boolean allowInfeasible) {

    public SearchRequest {
        if (targetTrait == null || targetTrait.isBlank()) {
            throw new IllegalArgumentException("targetTrait cannot be null or blank");
        }
        if (ship == null) {
            throw new IllegalArgumentException("ship cannot be null");
        }
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public static SearchRequest of(ExtractionTarget target, ShipProfile ship, List<Location> locations) {
        return new SearchRequest(target.trait(), ship, locations, false);
    }

    public SearchRequest withAllowInfeasible(boolean allowInfeasible) {
        return new SearchRequest(targetTrait, ship, locations, allowInfeasible);
    }
}
