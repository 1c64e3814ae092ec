package com.ryuqq.fleet.application.operation;

import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.application.assignment.WorkAssignmentFactory;
import com.ryuqq.fleet.application.candidate.CandidateSelection;
import com.ryuqq.fleet.application.candidate.CandidateSelector;
import com.ryuqq.fleet.application.coordinator.ResourceCoordinator;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.ledger.ResourceLedger;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.ProcessLifecycleManager;
import com.ryuqq.fleet.core.spi.WorkerCommand;
import com.ryuqq.fleet.core.spi.WorkerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Operation을 계획에서 실행 상태까지 끌어올리는 조립기.
 *
 * <p><strong>시작 흐름:</strong></p>
 * <pre>
 * launch(plan)
 *   ↓
 * 1. 작업지 결정: plan.siteSymbol 또는 CandidateSelector
 *   ↓
 * 2. 버퍼마다 ResourceLedger 생성 → registerResource
 *   ↓
 * 3. 운송 워커, 추출 워커 시작 (ProcessLifecycleManager)
 *   ↓
 * 4. 생산자와 소비자가 모두 있으면 WorkAssignment 열기
 *   ↓
 * OperationHandle (RUNNING)
 * </pre>
 *
 * <p>어느 단계든 실패하면 이미 시작한 워커를 멈추고 등록한 레저를 해제한 뒤
 * Operation을 FAILED로 표시하고 예외를 다시 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OperationLauncher {

    private static final Logger log = LoggerFactory.getLogger(OperationLauncher.class);

    private final ResourceCoordinator coordinator;
    private final CandidateSelector candidateSelector;
    private final ProcessLifecycleManager lifecycleManager;
    private final WorkAssignmentFactory assignmentFactory;

    private final ConcurrentMap<OperationId, OperationHandle> handles = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param coordinator 리소스 조정자
     * @param candidateSelector 후보 탐색기
     * @param lifecycleManager 워커 프로세스 관리자
     * @param assignmentFactory 배정 루프 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OperationLauncher(ResourceCoordinator coordinator, CandidateSelector candidateSelector,
                             ProcessLifecycleManager lifecycleManager, WorkAssignmentFactory assignmentFactory) {
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (candidateSelector == null) {
            throw new IllegalArgumentException("candidateSelector cannot be null");
        }
        if (lifecycleManager == null) {
            throw new IllegalArgumentException("lifecycleManager cannot be null");
        }
        if (assignmentFactory == null) {
            throw new IllegalArgumentException("assignmentFactory cannot be null");
        }
        this.coordinator = coordinator;
        this.candidateSelector = candidateSelector;
        this.lifecycleManager = lifecycleManager;
        this.assignmentFactory = assignmentFactory;
    }

    /**
     * Operation 시작.
     *
     * @param parent 상위 취소 신호 (발생하면 Operation 신호도 발생)
     * @param plan 실행 계획
     * @return RUNNING 상태의 핸들
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 같은 Operation이 이미 실행 중인 경우
     * @throws RuntimeException 시작 단계 실패 시 (원래 예외 그대로, Operation은 FAILED)
     */
    public OperationHandle launch(CancellationSignal parent, OperationPlan plan) {
        if (parent == null) {
            throw new IllegalArgumentException("parent signal cannot be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("plan cannot be null");
        }

        OperationId operationId = plan.operationId();
        OperationHandle handle = new OperationHandle(operationId, parent.child(), coordinator, lifecycleManager);
        OperationHandle existing = handles.putIfAbsent(operationId, handle);
        if (existing != null) {
            if (!existing.state().isTerminal()) {
                throw new IllegalStateException("operation " + operationId.getValue() + " is already " + existing.state());
            }
            if (!handles.replace(operationId, existing, handle)) {
                throw new IllegalStateException("operation " + operationId.getValue() + " is being relaunched concurrently");
            }
        }

        log.info("Launching operation {}", operationId.getValue());
        try {
            String siteSymbol = resolveSite(handle, plan);
            registerBuffers(handle, plan, siteSymbol);
            startWorkers(handle, plan, siteSymbol);
            openAssignment(handle, plan);
            handle.running();
        } catch (RuntimeException e) {
            log.error("Failed to launch operation {}", operationId.getValue(), e);
            handle.failed();
            throw e;
        }

        log.info("Operation {} running at {} with {} workers",
            operationId.getValue(), handle.siteSymbol(), handle.workerIds().size());
        return handle;
    }

    /**
     * 가장 최근에 시작한 핸들 조회 (실패한 시작 포함).
     *
     * @param operationId Operation
     * @return 핸들
     */
    public Optional<OperationHandle> find(OperationId operationId) {
        return Optional.ofNullable(handles.get(operationId));
    }

    private String resolveSite(OperationHandle handle, OperationPlan plan) {
        if (!plan.needsCandidateSearch()) {
            handle.selected(plan.siteSymbol(), null);
            return plan.siteSymbol();
        }

        CandidateSelection selection = candidateSelector.selectBestCandidate(handle.signal(), plan.search());
        if (!selection.feasible()) {
            log.warn("Operation {} uses infeasible site {} (round-trip fuel {} > capacity {})",
                plan.operationId().getValue(), selection.siteSymbol(),
                selection.candidate().roundTripFuel(), plan.search().ship().fuelCapacity());
        }
        handle.selected(selection.siteSymbol(), selection);
        return selection.siteSymbol();
    }

    private void registerBuffers(OperationHandle handle, OperationPlan plan, String siteSymbol) {
        for (BufferSpec buffer : plan.buffers()) {
            ResourceLedger ledger = new ResourceLedger(
                buffer.resourceSymbol(), siteSymbol, plan.operationId(), buffer.capacity(), buffer.initialCargo());
            coordinator.registerResource(ledger);
            handle.resourceRegistered(buffer.resourceSymbol());
        }
    }

    private void startWorkers(OperationHandle handle, OperationPlan plan, String siteSymbol) {
        // 운송 → 추출 순서
        for (String ship : plan.transportShips()) {
            String workerId = lifecycleManager.startWorker(
                new WorkerCommand(WorkerType.TRANSPORT, plan.operationId(), ship, siteSymbol, plan.goodSymbol()));
            handle.workerStarted(workerId);
        }
        for (String ship : plan.extractionShips()) {
            String workerId = lifecycleManager.startWorker(
                new WorkerCommand(WorkerType.EXTRACTION, plan.operationId(), ship, siteSymbol, plan.goodSymbol()));
            handle.workerStarted(workerId);
        }
    }

    private void openAssignment(OperationHandle handle, OperationPlan plan) {
        if (!plan.needsAssignment()) {
            return;
        }
        WorkAssignment assignment = assignmentFactory.open(
            plan.operationId(), handle.signal(), plan.transportShips(), plan.extractionShips());
        handle.assignmentOpened(assignment);
    }
}
