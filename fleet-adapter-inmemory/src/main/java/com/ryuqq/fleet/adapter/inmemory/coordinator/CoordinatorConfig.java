package com.ryuqq.fleet.adapter.inmemory.coordinator;

/**
 * InMemoryResourceCoordinator 설정 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param subscriptionBufferSize 입고 구독 하나의 버퍼 크기 (1 이상, 가득 차면 새 알림을 버림)
 */
public record CoordinatorConfig(int subscriptionBufferSize) {

    /**
     * 기본 설정 생성자 (subscriptionBufferSize=10).
     */
    public CoordinatorConfig() {
        this(10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (subscriptionBufferSize <= 0) {
            throw new IllegalArgumentException(
                "subscriptionBufferSize must be positive (current: " + subscriptionBufferSize + ")"
            );
        }
    }

    /**
     * subscriptionBufferSize만 변경한 새 인스턴스 생성.
     */
    public CoordinatorConfig withSubscriptionBufferSize(int subscriptionBufferSize) {
        return new CoordinatorConfig(subscriptionBufferSize);
    }
}
