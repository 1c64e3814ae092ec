package com.ryuqq.fleet.core.statemachine;

/**
 * 조정 Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► RUNNING (후보 선택, 레저 등록, 워커 시작 완료)
 *    │      │
 *    │      ├─► COMPLETED (정상 종료)
 *    │      ├─► STOPPED   (외부 중단)
 *    │      └─► FAILED    (실행 중 실패)
 *    │
 *    ├─► STOPPED (시작 전 중단)
 *    └─► FAILED  (시작 실패)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OperationState {

    /**
     * 시작 준비 중.
     */
    PENDING,

    /**
     * 실행 중 (워커와 배정 루프 동작 중).
     */
    RUNNING,

    /**
     * 정상 완료.
     */
    COMPLETED,

    /**
     * 외부 요청으로 중단.
     */
    STOPPED,

    /**
     * 실패 (영구).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, STOPPED, FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
