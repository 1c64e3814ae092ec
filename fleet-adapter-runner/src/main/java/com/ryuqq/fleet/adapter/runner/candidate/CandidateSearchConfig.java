package com.ryuqq.fleet.adapter.runner.candidate;

/**
 * CandidateSearchPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>destinationTrait: 목적지 후보가 가져야 할 특성 (기본 MARKETPLACE)</li>
 *   <li>destinationsPerSite: 작업지마다 평가할 가장 가까운 목적지 수 (기본 5)</li>
 *   <li>evaluatorCount: 평가 스레드 수 (기본 15)</li>
 *   <li>prefilterFuelPerDistance: 사전 필터의 거리당 연료 추정치 (기본 1.0, 순항 모드 기준)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong> 라우팅 오라클 호출이 느리면 evaluatorCount를 늘리고,
 * 지역이 넓어 후보 쌍이 많으면 destinationsPerSite를 줄입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param destinationTrait 목적지 특성 (공백 불가)
 * @param destinationsPerSite 작업지당 목적지 수 (1 이상)
 * @param evaluatorCount 평가 스레드 수 (1 이상)
 * @param prefilterFuelPerDistance 거리당 연료 추정치 (양수)
 */
public record CandidateSearchConfig(
    String destinationTrait,
    int destinationsPerSite,
    int evaluatorCount,
    double prefilterFuelPerDistance
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: destinationTrait=MARKETPLACE, destinationsPerSite=5, evaluatorCount=15,
     * prefilterFuelPerDistance=1.0</p>
     */
    public CandidateSearchConfig() {
        this("MARKETPLACE", 5, 15, 1.0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CandidateSearchConfig {
        if (destinationTrait == null || destinationTrait.isBlank()) {
            throw new IllegalArgumentException("destinationTrait cannot be null or blank");
        }
        if (destinationsPerSite <= 0) {
            throw new IllegalArgumentException(
                "destinationsPerSite must be positive (current: " + destinationsPerSite + ")"
            );
        }
        if (evaluatorCount <= 0) {
            throw new IllegalArgumentException(
                "evaluatorCount must be positive (current: " + evaluatorCount + ")"
            );
        }
        if (!(prefilterFuelPerDistance > 0)) {
            throw new IllegalArgumentException(
                "prefilterFuelPerDistance must be positive (current: " + prefilterFuelPerDistance + ")"
            );
        }
    }

    public CandidateSearchConfig withDestinationTrait(String destinationTrait) {
        return new CandidateSearchConfig(destinationTrait, destinationsPerSite, evaluatorCount, prefilterFuelPerDistance);
    }

    public CandidateSearchConfig withDestinationsPerSite(int destinationsPerSite) {
        return new CandidateSearchConfig(destinationTrait, destinationsPerSite, evaluatorCount, prefilterFuelPerDistance);
    }

    public CandidateSearchConfig withEvaluatorCount(int evaluatorCount) {
        return new CandidateSearchConfig(destinationTrait, destinationsPerSite, evaluatorCount, prefilterFuelPerDistance);
    }

    public CandidateSearchConfig withPrefilterFuelPerDistance(double prefilterFuelPerDistance) {
        return new CandidateSearchConfig(destinationTrait, destinationsPerSite, evaluatorCount, prefilterFuelPerDistance);
    }
}
