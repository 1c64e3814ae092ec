package com.ryuqq.fleet.application.operation;

import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.application.candidate.CandidateSelection;
import com.ryuqq.fleet.application.coordinator.ResourceCoordinator;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.ProcessLifecycleManager;
import com.ryuqq.fleet.core.statemachine.OperationState;
import com.ryuqq.fleet.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 실행 중인 Operation 핸들.
 *
 * <p>Operation이 잡고 있는 자원(취소 신호, 배정 루프, 워커, 레저 등록)을 소유하며
 * {@link #stop()} 또는 {@link #complete()}에서 역순으로 정리합니다.</p>
 *
 * <p><strong>정리 순서:</strong></p>
 * <pre>
 * signal.cancel()          → 대기 중인 waitForCargo / 배정 호출 종료
 * assignment.shutdown()    → 배정 루프 종료
 * stopWorker(workerId...)  → 워커 종료 (개별 실패는 로그 후 계속)
 * unregisterResource(...)  → 레저 등록 해제
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationHandle {

    private static final Logger log = LoggerFactory.getLogger(OperationHandle.class);

    private final OperationId operationId;
    private final CancellationSignal signal;
    private final ResourceCoordinator coordinator;
    private final ProcessLifecycleManager lifecycleManager;

    private final List<String> resourceSymbols = new ArrayList<>();
    private final List<String> workerIds = new ArrayList<>();
    private String siteSymbol;
    private CandidateSelection selection;
    private WorkAssignment assignment;
    private OperationState state = OperationState.PENDING;

    OperationHandle(OperationId operationId, CancellationSignal signal,
                    ResourceCoordinator coordinator, ProcessLifecycleManager lifecycleManager) {
        this.operationId = operationId;
        this.signal = signal;
        this.coordinator = coordinator;
        this.lifecycleManager = lifecycleManager;
    }

    public OperationId operationId() {
        return operationId;
    }

    public CancellationSignal signal() {
        return signal;
    }

    public synchronized OperationState state() {
        return state;
    }

    public synchronized String siteSymbol() {
        return siteSymbol;
    }

    /**
     * 후보 탐색 결과 (작업지를 고정한 경우 empty).
     */
    public synchronized Optional<CandidateSelection> selection() {
        return Optional.ofNullable(selection);
    }

    public synchronized List<String> workerIds() {
        return List.copyOf(workerIds);
    }

    public synchronized List<String> resourceSymbols() {
        return List.copyOf(resourceSymbols);
    }

    public synchronized Optional<WorkAssignment> assignment() {
        return Optional.ofNullable(assignment);
    }

    /**
     * 외부 중단 (RUNNING → STOPPED).
     *
     * @return 이번 호출로 중단되었으면 true, 이미 종료 상태면 false
     */
    public boolean stop() {
        return finish(OperationState.STOPPED);
    }

    /**
     * 정상 완료 (RUNNING → COMPLETED).
     *
     * @return 이번 호출로 완료되었으면 true, 이미 종료 상태면 false
     */
    public boolean complete() {
        return finish(OperationState.COMPLETED);
    }

    // ============================================================
    // OperationLauncher 전용
    // ============================================================

    synchronized void selected(String siteSymbol, CandidateSelection selection) {
        this.siteSymbol = siteSymbol;
        this.selection = selection;
    }

    synchronized void resourceRegistered(String resourceSymbol) {
        resourceSymbols.add(resourceSymbol);
    }

    synchronized void workerStarted(String workerId) {
        workerIds.add(workerId);
    }

    synchronized void assignmentOpened(WorkAssignment assignment) {
        this.assignment = assignment;
    }

    synchronized void running() {
        state = StateTransition.transition(state, OperationState.RUNNING);
    }

    /**
     * 시작 실패 처리: 자원 정리 후 FAILED.
     */
    synchronized void failed() {
        if (state.isTerminal()) {
            return;
        }
        releaseAll();
        state = StateTransition.transition(state, OperationState.FAILED);
    }

    private synchronized boolean finish(OperationState target) {
        if (state.isTerminal()) {
            log.debug("Operation {} already {}, ignoring {}", operationId.getValue(), state, target);
            return false;
        }
        StateTransition.validate(state, target);
        releaseAll();
        state = target;
        log.info("Operation {} → {}", operationId.getValue(), target);
        return true;
    }

    private void releaseAll() {
        signal.cancel();

        if (assignment != null) {
            assignment.shutdown();
        }

        for (String workerId : workerIds) {
            try {
                lifecycleManager.stopWorker(workerId);
            } catch (RuntimeException e) {
                log.warn("Failed to stop worker {} of operation {}", workerId, operationId.getValue(), e);
            }
        }

        for (String resourceSymbol : resourceSymbols) {
            coordinator.unregisterResource(resourceSymbol);
        }
    }

    @Override
    public synchronized String toString() {
        return "OperationHandle{" + operationId.getValue() + ", state=" + state
            + ", site=" + siteSymbol + ", workers=" + workerIds.size() + '}';
    }
}
