package com.ryuqq.fleet.adapter.runner.assignment;

import com.ryuqq.fleet.adapter.runner.assignment.AssignmentEvent.Availability;
import com.ryuqq.fleet.adapter.runner.assignment.AssignmentEvent.Completion;
import com.ryuqq.fleet.adapter.runner.assignment.AssignmentEvent.Request;
import com.ryuqq.fleet.adapter.runner.assignment.AssignmentEvent.Shutdown;
import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.CoordinationObserver;
import com.ryuqq.fleet.core.spi.noop.NoOpCoordinationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 단일 스레드 이벤트 루프 기반 {@link WorkAssignment} 구현체.
 *
 * <p>호출자는 이벤트를 큐에 넣고 응답 슬롯을 기다리기만 합니다. 대기 중인 소비자 FIFO,
 * 대기 중인 생산자 풀, 화물 인수를 기다리는 생산자 목록은 루프 스레드만 읽고 씁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * requestProducer(M1) ──┐
 * signalAvailability(T1)├─→ events (LinkedBlockingQueue) ─→ loop thread
 * notifyTransferComplete┘                                     ├─ Request: 공급 수준 최고 생산자와 짝짓기, 없으면 FIFO 대기
 *                                                             ├─ Availability: FIFO 맨 앞 소비자와 즉시 짝짓기, 없으면 풀에 추가
 *                                                             ├─ Completion: 생산자에게 화물 인수 알림, 전송 횟수 증가
 *                                                             └─ Shutdown: 루프 종료, 남은 호출 OPERATION_SHUTDOWN
 * </pre>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>호출자 신호 취소 또는 인터럽트: 응답 슬롯을 WAIT_CANCELLED로 닫음, 루프는 닫힌 슬롯을 건너뜀</li>
 *   <li>Operation 신호 취소 또는 shutdown(): 대기 중인 모든 호출이 OPERATION_SHUTDOWN으로 끝남</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkAssignmentLoop implements WorkAssignment {

    private static final Logger log = LoggerFactory.getLogger(WorkAssignmentLoop.class);

    private final OperationId operationId;
    private final CancellationSignal operationSignal;
    private final Set<String> consumerIds;
    private final Set<String> producerIds;
    private final AssignmentLoopConfig config;
    private final CoordinationObserver observer;

    private final BlockingQueue<AssignmentEvent> events = new LinkedBlockingQueue<>();
    private final AtomicLong transferCount = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closing = new AtomicBoolean();

    private volatile Thread loopThread;
    private volatile CancellationSignal.Registration operationRegistration;

    // 루프 스레드 전용 상태
    private final Deque<Request> waitingConsumers = new ArrayDeque<>();
    private final Map<String, Availability> availableProducers = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Void>> awaitingReceipt = new HashMap<>();

    /**
     * 생성자.
     *
     * @param operationId Operation
     * @param operationSignal 발생 시 루프를 종료할 Operation 신호
     * @param consumerIds 소비자 ID (운송 유닛)
     * @param producerIds 생산자 ID (추출 유닛)
     * @param config 설정
     * @param observer 짝짓기/전송 관측자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public WorkAssignmentLoop(OperationId operationId,
                              CancellationSignal operationSignal,
                              Collection<String> consumerIds,
                              Collection<String> producerIds,
                              AssignmentLoopConfig config,
                              CoordinationObserver observer) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        if (operationSignal == null) {
            throw new IllegalArgumentException("operationSignal cannot be null");
        }
        if (consumerIds == null) {
            throw new IllegalArgumentException("consumerIds cannot be null");
        }
        if (producerIds == null) {
            throw new IllegalArgumentException("producerIds cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }

        this.operationId = operationId;
        this.operationSignal = operationSignal;
        this.consumerIds = Set.copyOf(consumerIds);
        this.producerIds = Set.copyOf(producerIds);
        this.config = config;
        this.observer = observer;
    }

    public WorkAssignmentLoop(OperationId operationId, CancellationSignal operationSignal,
                              Collection<String> consumerIds, Collection<String> producerIds) {
        this(operationId, operationSignal, consumerIds, producerIds,
            new AssignmentLoopConfig(), NoOpCoordinationObserver.INSTANCE);
    }

    // ============================================================
    // 호출자 측 API
    // ============================================================

    @Override
    public String requestProducer(CancellationSignal signal, String consumerId) {
        requireSignal(signal);
        requireRegistered(consumerIds, consumerId, "consumer");

        Request request = new Request(consumerId, new CompletableFuture<>());
        submit(request);
        return await(signal, request.reply(), "producer for " + consumerId);
    }

    @Override
    public void signalAvailability(CancellationSignal signal, String producerId, int supplyLevel) {
        requireSignal(signal);
        requireRegistered(producerIds, producerId, "producer");
        if (supplyLevel < 0) {
            throw new IllegalArgumentException("supplyLevel cannot be negative (current: " + supplyLevel + ")");
        }

        Availability availability = new Availability(producerId, supplyLevel, new CompletableFuture<>());
        submit(availability);
        await(signal, availability.received(), "cargo pickup from " + producerId);
    }

    @Override
    public void notifyTransferComplete(String consumerId, String producerId) {
        requireRegistered(consumerIds, consumerId, "consumer");
        requireRegistered(producerIds, producerId, "producer");
        submit(new Completion(consumerId, producerId));
    }

    @Override
    public long transferCount() {
        return transferCount.get();
    }

    @Override
    public boolean isRunning() {
        return started.get() && !closing.get();
    }

    @Override
    public synchronized void start() {
        if (closing.get() || !started.compareAndSet(false, true)) {
            return;
        }

        Thread thread = new Thread(this::runLoop, config.threadNamePrefix() + "-" + operationId.getValue());
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        log.info("Assignment loop started for operation {} ({} consumers, {} producers)",
            operationId.getValue(), consumerIds.size(), producerIds.size());

        operationRegistration = operationSignal.onCancel(this::shutdown);
    }

    @Override
    public synchronized void shutdown() {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down assignment loop for operation {}", operationId.getValue());

        CancellationSignal.Registration registration = operationRegistration;
        if (registration != null) {
            registration.close();
        }

        Thread thread = loopThread;
        if (thread == null) {
            failPending();
            return;
        }

        events.add(Shutdown.INSTANCE);
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(config.shutdownTimeoutMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Assignment loop for operation {} did not stop within {}ms",
                operationId.getValue(), config.shutdownTimeoutMs());
        }
    }

    private void submit(AssignmentEvent event) {
        if (closing.get()) {
            throw CoordinationException.operationShutdown(operationId.getValue());
        }
        events.add(event);
        // shutdown이 큐를 비운 뒤에 들어간 이벤트는 스스로 실패 처리
        if (closing.get()) {
            event.fail(CoordinationException.operationShutdown(operationId.getValue()));
        }
    }

    private <T> T await(CancellationSignal signal, CompletableFuture<T> slot, String waitingFor) {
        CancellationSignal.Registration registration =
            signal.onCancel(() -> slot.completeExceptionally(cancelled(waitingFor)));
        try {
            return slot.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slot.completeExceptionally(cancelled(waitingFor));
            return join(slot);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } finally {
            registration.close();
        }
    }

    private CoordinationException cancelled(String waitingFor) {
        return CoordinationException.waitCancelled(operationId.getValue(), waitingFor);
    }

    private static <T> T join(CompletableFuture<T> slot) {
        try {
            return slot.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("assignment completed with unexpected error", cause);
    }

    private static void requireSignal(CancellationSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
    }

    private static void requireRegistered(Set<String> registered, String id, String role) {
        if (id == null || !registered.contains(id)) {
            throw new IllegalArgumentException(role + " " + id + " not registered with coordinator");
        }
    }

    // ============================================================
    // 루프 스레드
    // ============================================================

    private void runLoop() {
        try {
            while (true) {
                AssignmentEvent event = events.take();
                if (event == Shutdown.INSTANCE) {
                    break;
                }
                try {
                    dispatch(event);
                } catch (RuntimeException e) {
                    log.error("Failed to handle {} in assignment loop for operation {}",
                        event, operationId.getValue(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            closing.set(true);
            failPending();
            log.info("Assignment loop for operation {} stopped after {} transfers",
                operationId.getValue(), transferCount.get());
        }
    }

    private void dispatch(AssignmentEvent event) {
        if (event instanceof Request) {
            onRequest((Request) event);
        } else if (event instanceof Availability) {
            onAvailability((Availability) event);
        } else if (event instanceof Completion) {
            onCompletion((Completion) event);
        }
    }

    private void onRequest(Request request) {
        if (request.isAbandoned()) {
            log.debug("Skipping abandoned request from {}", request.consumerId());
            return;
        }

        Availability producer = bestAvailableProducer();
        if (producer == null) {
            waitingConsumers.addLast(request);
            log.debug("No producer available, {} queued (depth {})", request.consumerId(), waitingConsumers.size());
            return;
        }

        if (request.reply().complete(producer.producerId())) {
            availableProducers.remove(producer.producerId());
            paired(request.consumerId(), producer);
        }
    }

    private void onAvailability(Availability availability) {
        if (availability.isAbandoned()) {
            log.debug("Skipping abandoned availability from {}", availability.producerId());
            return;
        }

        Availability previous = availableProducers.remove(availability.producerId());
        if (previous != null) {
            previous.fail(cancelled("cargo pickup from " + previous.producerId()));
        }

        Request consumer = waitingConsumers.pollFirst();
        while (consumer != null) {
            if (consumer.reply().complete(availability.producerId())) {
                paired(consumer.consumerId(), availability);
                return;
            }
            log.debug("Skipping abandoned request from {}", consumer.consumerId());
            consumer = waitingConsumers.pollFirst();
        }

        availableProducers.put(availability.producerId(), availability);
        log.debug("Producer {} available (supply {}, pool {})",
            availability.producerId(), availability.supplyLevel(), availableProducers.size());
    }

    private void onCompletion(Completion completion) {
        long count = transferCount.incrementAndGet();

        CompletableFuture<Void> received = awaitingReceipt.remove(completion.producerId());
        if (received == null) {
            log.warn("Transfer {} -> {} completed but producer was not waiting for pickup",
                completion.producerId(), completion.consumerId());
        } else {
            received.complete(null);
        }

        observer.onTransferCompleted(operationId, completion.consumerId(), completion.producerId(), count);
    }

    /**
     * 공급 수준이 가장 높은 생산자. 동률이면 먼저 알린 생산자 (LinkedHashMap 삽입 순서).
     */
    private Availability bestAvailableProducer() {
        Availability best = null;
        List<String> abandoned = new ArrayList<>();
        for (Availability candidate : availableProducers.values()) {
            if (candidate.isAbandoned()) {
                abandoned.add(candidate.producerId());
                continue;
            }
            if (best == null || candidate.supplyLevel() > best.supplyLevel()) {
                best = candidate;
            }
        }
        for (String producerId : abandoned) {
            availableProducers.remove(producerId);
        }
        return best;
    }

    private void paired(String consumerId, Availability producer) {
        awaitingReceipt.put(producer.producerId(), producer.received());
        observer.onPairing(operationId, consumerId, producer.producerId());
        log.debug("Paired {} with {} (supply {})", consumerId, producer.producerId(), producer.supplyLevel());
    }

    private void failPending() {
        CoordinationException error = CoordinationException.operationShutdown(operationId.getValue());

        for (Request request : waitingConsumers) {
            request.fail(error);
        }
        waitingConsumers.clear();
        for (Availability availability : availableProducers.values()) {
            availability.fail(error);
        }
        availableProducers.clear();
        for (CompletableFuture<Void> received : awaitingReceipt.values()) {
            received.completeExceptionally(error);
        }
        awaitingReceipt.clear();

        List<AssignmentEvent> remaining = new ArrayList<>();
        events.drainTo(remaining);
        for (AssignmentEvent event : remaining) {
            event.fail(error);
        }
    }

    /**
     * 루프가 아직 꺼내지 않은 이벤트 수.
     */
    int queuedEvents() {
        return events.size();
    }

    @Override
    public String toString() {
        return "WorkAssignmentLoop{" + operationId.getValue() + ", running=" + isRunning()
            + ", transfers=" + transferCount.get() + '}';
    }
}
