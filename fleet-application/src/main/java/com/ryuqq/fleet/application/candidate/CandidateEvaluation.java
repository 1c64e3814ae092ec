package com.ryuqq.fleet.application.candidate;

/**
 * 후보 쌍의 왕복 연료가 어떻게 정해졌는지.
 *
 * <p>실행 불가 후보를 허용할 때 이 순서대로 우선합니다 (정확한 경로 → 추정치 → 선택 불가).</p>
 */
public enum CandidateEvaluation {

    /**
     * 라우팅 오라클이 왕복 경로를 계산함. 연료는 정확한 값.
     */
    ROUTED,

    /**
     * 거리 기반 사전 필터에서 걸러짐. 연료는 추정치.
     */
    PREFILTERED,

    /**
     * 경로가 없거나 라우팅이 실패함. 어떤 경우에도 선택하지 않습니다.
     */
    UNROUTABLE;

    public boolean isSelectable() {
        return this != UNROUTABLE;
    }
}
