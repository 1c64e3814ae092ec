/**
 * 병렬 후보 탐색.
 *
 * <p>{@link com.ryuqq.fleet.adapter.runner.candidate.CandidateSearchPool}은 작업지와 목적지 쌍을
 * 거리순으로 정렬한 뒤 평가 스레드들이 공유 큐에서 나눠 가져가며 라우팅 오라클로 왕복 비용을 계산합니다.
 * 실행 가능한 쌍이 하나라도 발견되면 그보다 먼 쌍은 평가하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.runner.candidate;
