package com.ryuqq.fleet.core.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 채굴 대상 종류와 위치 특성(trait)의 매핑.
 *
 * <p>CandidateSelector는 이 trait을 가진 위치만 채굴지 후보로 봅니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ExtractionTarget {

    COMMON_METALS("COMMON_METAL_DEPOSITS"),
    PRECIOUS_METALS("PRECIOUS_METAL_DEPOSITS"),
    RARE_METALS("RARE_METAL_DEPOSITS"),
    MINERALS("MINERAL_DEPOSITS"),
    ICE("ICE_CRYSTALS"),
    GAS("EXPLOSIVE_GASES");

    private final String trait;

    ExtractionTarget(String trait) {
        this.trait = trait;
    }

    public String trait() {
        return trait;
    }

    /**
     * 이름으로 조회 (대소문자 무시, 예: "ice", "common_metals").
     *
     * @param name 채굴 대상 이름
     * @return ExtractionTarget
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static ExtractionTarget fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("extraction target name cannot be null or blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (ExtractionTarget target : values()) {
            if (target.name().equals(normalized)) {
                return target;
            }
        }
        String valid = Arrays.stream(values())
            .map(t -> t.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("unknown extraction target: " + name + " (valid: " + valid + ")");
    }
}
