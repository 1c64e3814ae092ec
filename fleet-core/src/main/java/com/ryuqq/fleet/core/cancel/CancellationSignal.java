package com.ryuqq.fleet.core.cancel;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 협력적 취소 신호.
 *
 * <p>Operation 종료, 워커 중단, 후보 탐색 조기 종료를 호출자 외부에서 알리기 위해 사용합니다.
 * 블로킹 호출(waitForCargo, requestProducer 등)은 이 신호에 리스너를 등록하고,
 * 신호가 발생하면 대기를 정리한 뒤 반환합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>cancel()은 멱등: 두 번째 호출부터는 아무 동작 안 함</li>
 *   <li>리스너는 정확히 한 번 실행 (이미 취소된 신호에 등록하면 즉시 실행)</li>
 *   <li>자식 신호는 부모가 취소되면 함께 취소되지만, 자식 취소는 부모에 영향 없음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final Object lock = new Object();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();

    /**
     * 취소되지 않는 신호를 생성합니다 (cancel()을 호출하기 전까지).
     *
     * @return 새 신호
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * 부모 신호에 연결된 자식 신호 생성.
     *
     * @return 자식 신호
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal();
        Registration registration = onCancel(child::cancel);
        child.onCancel(registration::close);
        return child;
    }

    /**
     * 신호 발생 (멱등).
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (isCancelled()) {
                return;
            }
            cancelled.countDown();
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            listener.run();
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 경우 호출 스레드에서 즉시 실행합니다.
     * 리스너는 락 밖에서 실행되므로 다른 락을 잡아도 안전합니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        synchronized (lock) {
            if (!isCancelled()) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }

    /**
     * 취소될 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 시간 내 취소되면 true
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }

    /**
     * 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
