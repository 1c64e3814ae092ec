package com.ryuqq.fleet.core.error;

/**
 * 조정 엔진의 도메인 예외.
 *
 * <p>{@link CoordinationError} 코드를 담아 호출자가 복구 가능 여부를 판단할 수 있게 합니다.
 * 음수 수량, 빈 심볼 등 프로그래밍 오류는 이 예외가 아니라
 * {@link IllegalArgumentException}으로 즉시 드러냅니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try {
 *     CargoReservation reservation = coordinator.waitForCargo(signal, opId, "ICE_WATER", 10);
 * } catch (CoordinationException e) {
 *     if (e.error().isTerminal()) {
 *         // Operation 종료 처리
 *     }
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CoordinationException extends RuntimeException {

    private final CoordinationError error;

    /**
     * 생성자.
     *
     * @param error 오류 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException error가 null인 경우
     */
    public CoordinationException(CoordinationError error, String message) {
        this(error, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param error 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException error가 null인 경우
     */
    public CoordinationException(CoordinationError error, String message, Throwable cause) {
        super(message, cause);
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        this.error = error;
    }

    public CoordinationError error() {
        return error;
    }

    public static CoordinationException insufficientSpace(int requested, int available) {
        return new CoordinationException(CoordinationError.INSUFFICIENT_SPACE,
            "insufficient space: need " + requested + ", have " + available);
    }

    public static CoordinationException insufficientCargo(String message) {
        return new CoordinationException(CoordinationError.INSUFFICIENT_CARGO, message);
    }

    public static CoordinationException alreadyRegistered(String resourceSymbol) {
        return new CoordinationException(CoordinationError.ALREADY_REGISTERED,
            "resource " + resourceSymbol + " is already registered");
    }

    public static CoordinationException resourceGone(String resourceSymbol) {
        return new CoordinationException(CoordinationError.RESOURCE_GONE,
            "resource " + resourceSymbol + " is no longer registered");
    }

    public static CoordinationException waitCancelled(String operationId, String goodSymbol) {
        return new CoordinationException(CoordinationError.WAIT_CANCELLED,
            "wait for " + goodSymbol + " cancelled (operation: " + operationId + ")");
    }

    public static CoordinationException searchCancelled(String targetTrait) {
        return new CoordinationException(CoordinationError.WAIT_CANCELLED,
            "candidate search for " + targetTrait + " cancelled");
    }

    public static CoordinationException operationNotFound(String operationId) {
        return new CoordinationException(CoordinationError.OPERATION_NOT_FOUND,
            "no resources registered for operation " + operationId);
    }

    public static CoordinationException noFeasibleCandidate(String message) {
        return new CoordinationException(CoordinationError.NO_FEASIBLE_CANDIDATE, message);
    }

    public static CoordinationException operationShutdown(String operationId) {
        return new CoordinationException(CoordinationError.OPERATION_SHUTDOWN,
            "operation " + operationId + " is shutting down");
    }

    @Override
    public String toString() {
        return "CoordinationException{" + error + " (" + error.code() + "): " + getMessage() + '}';
    }
}
