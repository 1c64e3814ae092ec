package com.ryuqq.fleet.application.candidate;

/**
 * 평가된 (작업지, 목적지) 쌍.
 *
 * <p>사전 필터에서 걸러졌거나 경로가 없는 쌍은 {@code roundTripFuel}에 추정치를 담고
 * {@code roundTripTimeSeconds}는 0입니다. 어느 쪽인지는 {@code evaluation}으로 구분합니다.</p>
 *
 * @param siteSymbol 작업지
 * @param destinationSymbol 목적지
 * @param distance 두 지점 간 직선 거리
 * @param feasible 왕복 연료가 탱크 용량 이내인지
 * @param roundTripTimeSeconds 왕복 시간 (초)
 * @param roundTripFuel 왕복 연료
 * @param evaluation 연료 값의 출처
 */
public record Candidate(
    String siteSymbol,
    String destinationSymbol,
    double distance,
    boolean feasible,
    int roundTripTimeSeconds,
    int roundTripFuel,
    CandidateEvaluation evaluation
) {

    public Candidate {
        if (siteSymbol == null || siteSymbol.isBlank()) {
            throw new IllegalArgumentException("siteSymbol cannot be null or blank");
        }
        if (destinationSymbol == null || destinationSymbol.isBlank()) {
            throw new IllegalArgumentException("destinationSymbol cannot be null or blank");
        }
        if (evaluation == null) {
            throw new IllegalArgumentException("evaluation cannot be null");
        }
        if (feasible && evaluation != CandidateEvaluation.ROUTED) {
            throw new IllegalArgumentException("only a routed candidate can be feasible (current: " + evaluation + ")");
        }
    }
}
