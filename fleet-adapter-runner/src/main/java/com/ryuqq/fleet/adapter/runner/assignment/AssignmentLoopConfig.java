package com.ryuqq.fleet.adapter.runner.assignment;

/**
 * WorkAssignmentLoop 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threadNamePrefix: 루프 스레드 이름 접두사 (기본 "assignment-loop", 뒤에 Operation ID가 붙음)</li>
 *   <li>shutdownTimeoutMs: shutdown() 호출 시 루프 스레드 종료 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param threadNamePrefix 루프 스레드 이름 접두사 (공백 불가)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 0 이상)
 */
public record AssignmentLoopConfig(String threadNamePrefix, long shutdownTimeoutMs) {

    /**
     * 기본 설정 생성자 (threadNamePrefix="assignment-loop", shutdownTimeoutMs=5000).
     */
    public AssignmentLoopConfig() {
        this("assignment-loop", 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public AssignmentLoopConfig {
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs cannot be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public AssignmentLoopConfig withThreadNamePrefix(String threadNamePrefix) {
        return new AssignmentLoopConfig(threadNamePrefix, shutdownTimeoutMs);
    }

    public AssignmentLoopConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new AssignmentLoopConfig(threadNamePrefix, shutdownTimeoutMs);
    }
}
