package com.ryuqq.fleet.application.coordinator;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 한 리소스의 입고 알림 구독.
 *
 * <p>버퍼는 고정 크기이며 가득 차면 새 알림을 버립니다. 느린 구독자가 입고 처리 경로를
 * 멈추게 하지 않기 위한 동작이므로, 알림 누락은 오류가 아닙니다. 누락 수는
 * {@link #droppedCount()}로 확인할 수 있습니다.</p>
 *
 * <pre>{@code
 * try (DepositSubscription subscription = coordinator.subscribeToDeposits("STORAGE-1")) {
 *     while (running) {
 *         subscription.poll(1, TimeUnit.SECONDS)
 *             .filter(n -> n.goodSymbol().equals("HYDROCARBON"))
 *             .ifPresent(this::jettison);
 *     }
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DepositSubscription extends AutoCloseable {

    String resourceSymbol();

    /**
     * 다음 알림을 기다립니다.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 알림, 시간 초과 또는 구독 종료 시 empty
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Optional<DepositNotification> poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 버퍼에 쌓인 알림을 모두 꺼냅니다 (대기 없음).
     *
     * @return 도착 순서대로 정렬된 알림
     */
    List<DepositNotification> drain();

    /**
     * 버퍼가 가득 차서 버려진 알림 수.
     *
     * @return 누락 수
     */
    long droppedCount();

    boolean isClosed();

    /**
     * 구독 해제 (멱등). 이후 알림은 전달되지 않습니다.
     */
    @Override
    void close();
}
