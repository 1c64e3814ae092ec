package com.ryuqq.fleet.application.candidate;

import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;

/**
 * 연료 효율이 가장 좋은 (작업지, 목적지) 쌍을 고르는 동기 호출.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CandidateSelector {

    /**
     * 최적 후보 선택.
     *
     * @param signal 호출자의 취소 신호
     * @param request 탐색 요청
     * @return 선택 결과
     * @throws CoordinationException NO_FEASIBLE_CANDIDATE - 후보 없음, WAIT_CANCELLED - 호출자 취소
     */
    CandidateSelection selectBestCandidate(CancellationSignal signal, SearchRequest request);
}
