package com.ryuqq.fleet.application.candidate;

/**
 * 후보 탐색 결과.
 *
 * @param candidate 선택된 후보
 * @param feasible false면 실행 불가 후보를 override로 선택한 것
 * @param evaluatedPairs 라우팅까지 평가를 마친 쌍의 수
 */
public record CandidateSelection(Candidate candidate, boolean feasible, int evaluatedPairs) {

    public CandidateSelection {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
    }

    public String siteSymbol() {
        return candidate.siteSymbol();
    }

    public String destinationSymbol() {
        return candidate.destinationSymbol();
    }
}
