package com.ryuqq.fleet.core.error;

/**
 * 조정 엔진 오류 코드.
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>복구 가능 (recoverable): 지금은 불가능하지만 호출자가 대기/재시도/수량 축소로 대응 가능</li>
 *   <li>종료 (terminal): 대기자의 결과 슬롯을 닫으며 재시도 여지가 없음</li>
 *   <li>그 외: 호출 시점의 요청 오류 (등록 중복, Operation 없음 등)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CoordinationError {

    /** 남은 용량 부족. */
    INSUFFICIENT_SPACE("COORD-001", Kind.RECOVERABLE),

    /** 예약 가능한 화물 부족. */
    INSUFFICIENT_CARGO("COORD-002", Kind.RECOVERABLE),

    /** 이미 등록된 리소스 심볼. */
    ALREADY_REGISTERED("COORD-003", Kind.REJECTED),

    /** 대기 중 리소스가 등록 해제됨. */
    RESOURCE_GONE("COORD-004", Kind.TERMINAL),

    /** 호출자가 대기를 취소함. */
    WAIT_CANCELLED("COORD-005", Kind.TERMINAL),

    /** Operation에 등록된 리소스가 없음. */
    OPERATION_NOT_FOUND("COORD-006", Kind.REJECTED),

    /** 실행 가능한 후보가 없음. */
    NO_FEASIBLE_CANDIDATE("COORD-007", Kind.REJECTED),

    /** Operation 종료로 배정 루프가 멈춤 (실패가 아닌 종료로 취급). */
    OPERATION_SHUTDOWN("COORD-008", Kind.TERMINAL);

    private enum Kind { RECOVERABLE, TERMINAL, REJECTED }

    private final String code;
    private final Kind kind;

    CoordinationError(String code, Kind kind) {
        this.code = code;
        this.kind = kind;
    }

    /**
     * 외부 노출용 오류 코드 (예: COORD-004).
     *
     * @return 오류 코드
     */
    public String code() {
        return code;
    }

    public boolean isRecoverable() {
        return kind == Kind.RECOVERABLE;
    }

    /**
     * 종료 오류인지 확인.
     *
     * <p>종료 오류는 대기자의 결과 슬롯을 닫으며 같은 대기자로는 재시도할 수 없습니다.</p>
     *
     * @return RESOURCE_GONE, WAIT_CANCELLED, OPERATION_SHUTDOWN인 경우 true
     */
    public boolean isTerminal() {
        return kind == Kind.TERMINAL;
    }
}
