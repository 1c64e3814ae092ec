package com.ryuqq.fleet.adapter.runner.assignment;

import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationError;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.testkit.fake.RecordingCoordinationObserver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.fail;

/**
 * WorkAssignmentLoop 테스트.
 *
 * <p>짝짓기 규칙, 버려진 호출 건너뛰기, 종료 시 대기 호출 정리를 검증합니다.
 * 이벤트 순서가 중요한 테스트는 루프를 시작하기 전에 이벤트를 쌓아 두고 시작합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkAssignmentLoopTest {

    private static final OperationId OP = OperationId.of("mining-1");
    private static final long TIMEOUT_SECONDS = 5;

    private CancellationSignal operationSignal;
    private RecordingCoordinationObserver observer;
    private WorkAssignmentLoop loop;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        operationSignal = CancellationSignal.create();
        observer = new RecordingCoordinationObserver();
        loop = new WorkAssignmentLoop(OP, operationSignal,
            List.of("M1", "M2"), List.of("T1", "T2", "T3"),
            new AssignmentLoopConfig().withThreadNamePrefix("test-loop"), observer);
        callers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        loop.shutdown();
        callers.shutdownNow();
    }

    // ========== 짝짓기 ==========

    @Test
    void 생산자가_없으면_소비자가_대기하고_생산자가_알리면_즉시_짝지어진다() throws Exception {
        // given
        loop.start();
        Future<String> m1 = request("M1", CancellationSignal.create());
        assertStillWaiting(m1);

        // when
        Future<?> t1 = announce("T1", 0, CancellationSignal.create());

        // then
        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T1");
        assertStillWaiting(t1);

        loop.notifyTransferComplete("M1", "T1");
        t1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(loop.transferCount()).isEqualTo(1);
        assertThat(observer.events("PAIRING")).containsExactly("PAIRING op=mining-1 consumer=M1 producer=T1");
        assertThat(observer.count("TRANSFER_COMPLETED")).isEqualTo(1);
    }

    @Test
    void 대기_중인_생산자_중_공급_수준이_가장_높은_생산자를_선택한다() throws Exception {
        // given: 루프 시작 전에 T1(5), T2(20) 대기 알림, 그 다음 M1 요청
        announce("T1", 5, CancellationSignal.create());
        awaitQueued(1);
        announce("T2", 20, CancellationSignal.create());
        awaitQueued(2);
        Future<String> m1 = request("M1", CancellationSignal.create());
        awaitQueued(3);

        // when
        loop.start();

        // then
        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T2");
    }

    @Test
    void 공급_수준이_같으면_먼저_알린_생산자를_선택한다() throws Exception {
        announce("T3", 7, CancellationSignal.create());
        awaitQueued(1);
        announce("T1", 7, CancellationSignal.create());
        awaitQueued(2);
        Future<String> m1 = request("M1", CancellationSignal.create());
        awaitQueued(3);

        loop.start();

        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T3");
    }

    @Test
    void 소비자는_도착_순서대로_생산자를_받는다() throws Exception {
        Future<String> m1 = request("M1", CancellationSignal.create());
        awaitQueued(1);
        Future<String> m2 = request("M2", CancellationSignal.create());
        awaitQueued(2);
        loop.start();

        announce("T1", 0, CancellationSignal.create());
        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T1");
        assertStillWaiting(m2);

        announce("T2", 0, CancellationSignal.create());
        assertThat(m2.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T2");
    }

    // ========== 버려진 호출 ==========

    @Test
    void 취소된_소비자는_건너뛰고_다음_소비자와_짝짓는다() throws Exception {
        // given
        CancellationSignal m1Signal = CancellationSignal.create();
        Future<String> m1 = request("M1", m1Signal);
        awaitQueued(1);
        Future<String> m2 = request("M2", CancellationSignal.create());
        awaitQueued(2);
        loop.start();
        assertStillWaiting(m2);

        // when
        m1Signal.cancel();
        announce("T1", 0, CancellationSignal.create());

        // then
        assertError(failureOf(m1), CoordinationError.WAIT_CANCELLED);
        assertThat(m2.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T1");
    }

    @Test
    void 취소된_생산자는_배정되지_않는다() throws Exception {
        CancellationSignal t1Signal = CancellationSignal.create();
        Future<?> t1 = announce("T1", 50, t1Signal);
        awaitQueued(1);
        Future<?> t2 = announce("T2", 1, CancellationSignal.create());
        awaitQueued(2);
        loop.start();
        assertStillWaiting(t2);

        t1Signal.cancel();
        assertError(failureOf(t1), CoordinationError.WAIT_CANCELLED);

        Future<String> m1 = request("M1", CancellationSignal.create());
        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T2");
    }

    @Test
    void 대기_중_인터럽트되면_WAIT_CANCELLED와_인터럽트_플래그를_남긴다() throws Exception {
        loop.start();
        AtomicBoolean interruptedAfter = new AtomicBoolean();
        Thread consumer = new Thread(() -> {
            Throwable thrown = catchThrowable(() -> loop.requestProducer(CancellationSignal.create(), "M1"));
            interruptedAfter.set(Thread.currentThread().isInterrupted()
                && thrown instanceof CoordinationException
                && ((CoordinationException) thrown).error() == CoordinationError.WAIT_CANCELLED);
        });
        consumer.start();
        Thread.sleep(100);

        consumer.interrupt();
        consumer.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));

        assertThat(interruptedAfter).isTrue();
    }

    // ========== 전송 완료 ==========

    @Test
    void 인수를_기다리지_않는_생산자의_전송_완료도_횟수에_반영된다() throws Exception {
        loop.start();

        loop.notifyTransferComplete("M1", "T1");

        awaitCondition(() -> loop.transferCount() == 1);
        assertThat(observer.events("TRANSFER_COMPLETED"))
            .containsExactly("TRANSFER_COMPLETED op=mining-1 consumer=M1 producer=T1 count=1");
    }

    // ========== 종료 ==========

    @Test
    void shutdown_시_대기_중인_모든_호출은_OPERATION_SHUTDOWN() throws Exception {
        // given
        loop.start();
        Future<String> m1 = request("M1", CancellationSignal.create());
        Future<String> m2 = request("M2", CancellationSignal.create());
        assertStillWaiting(m1);

        // when
        loop.shutdown();

        // then
        assertError(failureOf(m1), CoordinationError.OPERATION_SHUTDOWN);
        assertError(failureOf(m2), CoordinationError.OPERATION_SHUTDOWN);
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void 인수를_기다리던_생산자도_shutdown_시_OPERATION_SHUTDOWN() throws Exception {
        loop.start();
        Future<?> t1 = announce("T1", 3, CancellationSignal.create());
        Future<String> m1 = request("M1", CancellationSignal.create());
        assertThat(m1.get(TIMEOUT_SECONDS, TimeUnit.SECONDS)).isEqualTo("T1");

        loop.shutdown();

        assertError(failureOf(t1), CoordinationError.OPERATION_SHUTDOWN);
    }

    @Test
    void Operation_신호가_취소되면_루프가_멈춘다() throws Exception {
        loop.start();
        Future<?> t1 = announce("T1", 3, CancellationSignal.create());
        assertStillWaiting(t1);

        operationSignal.cancel();

        assertError(failureOf(t1), CoordinationError.OPERATION_SHUTDOWN);
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void 종료_후_호출은_즉시_OPERATION_SHUTDOWN() {
        loop.start();
        loop.shutdown();
        loop.shutdown();

        assertError(catchThrowable(() -> loop.requestProducer(CancellationSignal.create(), "M1")),
            CoordinationError.OPERATION_SHUTDOWN);
        assertError(catchThrowable(() -> loop.notifyTransferComplete("M1", "T1")),
            CoordinationError.OPERATION_SHUTDOWN);
    }

    @Test
    void 시작하지_않은_루프를_종료해도_대기_호출이_정리된다() throws Exception {
        Future<String> m1 = request("M1", CancellationSignal.create());
        awaitQueued(1);

        loop.shutdown();

        assertError(failureOf(m1), CoordinationError.OPERATION_SHUTDOWN);
        loop.start();
        assertThat(loop.isRunning()).isFalse();
    }

    // ========== 입력 검증 ==========

    @Test
    void 등록되지_않은_ID나_음수_공급_수준은_IllegalArgumentException() {
        loop.start();
        CancellationSignal signal = CancellationSignal.create();

        assertThatThrownBy(() -> loop.requestProducer(signal, "UNKNOWN"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not registered");
        assertThatThrownBy(() -> loop.signalAvailability(signal, "M1", 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loop.signalAvailability(signal, "T1", -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loop.notifyTransferComplete("T1", "M1"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 팩토리는_실행_중인_루프를_연다() {
        WorkAssignment opened = new WorkAssignmentLoopFactory()
            .open(OperationId.of("mining-2"), CancellationSignal.create(), List.of("M1"), List.of("T1"));
        try {
            assertThat(opened.isRunning()).isTrue();
        } finally {
            opened.shutdown();
        }
        assertThat(opened.isRunning()).isFalse();
    }

    // ========== 헬퍼 ==========

    private Future<String> request(String consumerId, CancellationSignal signal) {
        return callers.submit(() -> loop.requestProducer(signal, consumerId));
    }

    private Future<?> announce(String producerId, int supplyLevel, CancellationSignal signal) {
        return callers.submit(() -> loop.signalAvailability(signal, producerId, supplyLevel));
    }

    private void awaitQueued(int count) {
        awaitCondition(() -> loop.queuedEvents() == count);
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within " + TIMEOUT_SECONDS + "s");
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }

    private static void assertStillWaiting(Future<?> future) throws Exception {
        try {
            future.get(100, TimeUnit.MILLISECONDS);
            fail("expected the call to still be waiting");
        } catch (TimeoutException expected) {
            // 아직 대기 중
        }
    }

    private static Throwable failureOf(Future<?> future) throws Exception {
        try {
            future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
        return fail("expected the call to fail");
    }

    private static void assertError(Throwable thrown, CoordinationError expected) {
        assertThat(thrown).isInstanceOf(CoordinationException.class);
        assertThat(((CoordinationException) thrown).error()).isEqualTo(expected);
    }
}
