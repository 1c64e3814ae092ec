package com.ryuqq.fleet.application.operation;

import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.application.assignment.WorkAssignmentFactory;
import com.ryuqq.fleet.application.candidate.Candidate;
import com.ryuqq.fleet.application.candidate.CandidateEvaluation;
import com.ryuqq.fleet.application.candidate.CandidateSelection;
import com.ryuqq.fleet.application.candidate.CandidateSelector;
import com.ryuqq.fleet.application.candidate.SearchRequest;
import com.ryuqq.fleet.application.candidate.ShipProfile;
import com.ryuqq.fleet.application.coordinator.ResourceCoordinator;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationError;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.ledger.ResourceLedger;
import com.ryuqq.fleet.core.model.ExtractionTarget;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.ProcessLifecycleManager;
import com.ryuqq.fleet.core.spi.WorkerCommand;
import com.ryuqq.fleet.core.spi.WorkerType;
import com.ryuqq.fleet.core.statemachine.OperationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * OperationLauncher 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OperationLauncherTest {

    private static final OperationId OP = OperationId.of("mining-1");

    @Mock
    private ResourceCoordinator coordinator;

    @Mock
    private CandidateSelector candidateSelector;

    @Mock
    private ProcessLifecycleManager lifecycleManager;

    @Mock
    private WorkAssignmentFactory assignmentFactory;

    @Mock
    private WorkAssignment assignment;

    private OperationLauncher launcher;

    @BeforeEach
    void setUp() {
        launcher = new OperationLauncher(coordinator, candidateSelector, lifecycleManager, assignmentFactory);
    }

    private static OperationPlan fixedSitePlan() {
        return new OperationPlan(
            OP,
            "X1-ASTEROID",
            null,
            "ICE_WATER",
            List.of(BufferSpec.empty("STORAGE-1", 80), new BufferSpec("STORAGE-2", 40, Map.of("ICE_WATER", 12))),
            List.of("MINER-1", "MINER-2"),
            List.of("HAULER-1")
        );
    }

    @Test
    void 고정_작업지_계획으로_시작하면_레저_등록_워커_시작_배정_루프_열기() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);

        // when
        OperationHandle handle = launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // then
        assertThat(handle.state()).isEqualTo(OperationState.RUNNING);
        assertThat(handle.siteSymbol()).isEqualTo("X1-ASTEROID");
        assertThat(handle.selection()).isEmpty();
        assertThat(handle.workerIds()).containsExactly("w-1", "w-2", "w-3");
        assertThat(handle.resourceSymbols()).containsExactly("STORAGE-1", "STORAGE-2");
        assertThat(handle.assignment()).contains(assignment);
        verifyNoInteractions(candidateSelector);

        ArgumentCaptor<ResourceLedger> ledgers = ArgumentCaptor.forClass(ResourceLedger.class);
        verify(coordinator, times(2)).registerResource(ledgers.capture());
        assertThat(ledgers.getAllValues()).extracting(ResourceLedger::locationSymbol)
            .containsOnly("X1-ASTEROID");
        assertThat(ledgers.getAllValues().get(1).cargoUnits("ICE_WATER")).isEqualTo(12);

        verify(assignmentFactory).open(eq(OP), eq(handle.signal()), eq(List.of("HAULER-1")), eq(List.of("MINER-1", "MINER-2")));
    }

    @Test
    void 운송_워커를_먼저_시작하고_추출_워커를_시작한다() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);

        // when
        launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // then
        ArgumentCaptor<WorkerCommand> commands = ArgumentCaptor.forClass(WorkerCommand.class);
        verify(lifecycleManager, times(3)).startWorker(commands.capture());
        assertThat(commands.getAllValues()).extracting(WorkerCommand::type)
            .containsExactly(WorkerType.TRANSPORT, WorkerType.EXTRACTION, WorkerType.EXTRACTION);
        assertThat(commands.getAllValues()).extracting(WorkerCommand::shipSymbol)
            .containsExactly("HAULER-1", "MINER-1", "MINER-2");
    }

    @Test
    void 작업지가_없으면_후보_탐색_결과로_시작() {
        // given
        SearchRequest search = SearchRequest.of(ExtractionTarget.ICE, new ShipProfile(400, 30), List.of());
        Candidate candidate = new Candidate("X1-ICE", "X1-MARKET", 42.0, true, 300, 180, CandidateEvaluation.ROUTED);
        when(candidateSelector.selectBestCandidate(any(), eq(search)))
            .thenReturn(new CandidateSelection(candidate, true, 7));
        when(lifecycleManager.startWorker(any())).thenReturn("w-1");
        OperationPlan plan = new OperationPlan(OP, null, search, null,
            List.of(BufferSpec.empty("STORAGE-1", 80)), List.of("MINER-1"), List.of());

        // when
        OperationHandle handle = launcher.launch(CancellationSignal.create(), plan);

        // then
        assertThat(handle.siteSymbol()).isEqualTo("X1-ICE");
        assertThat(handle.selection()).isPresent();
        assertThat(handle.selection().get().evaluatedPairs()).isEqualTo(7);
        assertThat(handle.assignment()).isEmpty();
        verifyNoInteractions(assignmentFactory);
    }

    @Test
    void 워커_시작_실패_시_시작한_워커_중단_레저_해제_FAILED() {
        // given
        when(lifecycleManager.startWorker(any()))
            .thenReturn("w-1")
            .thenThrow(new IllegalStateException("daemon unavailable"));

        // when & then
        assertThatThrownBy(() -> launcher.launch(CancellationSignal.create(), fixedSitePlan()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("daemon unavailable");

        verify(lifecycleManager).stopWorker("w-1");
        verify(coordinator).unregisterResource("STORAGE-1");
        verify(coordinator).unregisterResource("STORAGE-2");
        verifyNoInteractions(assignmentFactory);

        OperationHandle handle = launcher.find(OP).orElseThrow();
        assertThat(handle.state()).isEqualTo(OperationState.FAILED);
        assertThat(handle.signal().isCancelled()).isTrue();
    }

    @Test
    void 후보가_없으면_아무것도_시작하지_않고_FAILED() {
        // given
        SearchRequest search = SearchRequest.of(ExtractionTarget.GAS, new ShipProfile(400, 30), List.of());
        when(candidateSelector.selectBestCandidate(any(), any()))
            .thenThrow(CoordinationException.noFeasibleCandidate("no sites with trait EXPLOSIVE_GASES"));
        OperationPlan plan = new OperationPlan(OP, null, search, null, List.of(), List.of("SIPHON-1"), List.of());

        // when & then
        assertThatThrownBy(() -> launcher.launch(CancellationSignal.create(), plan))
            .isInstanceOfSatisfying(CoordinationException.class,
                e -> assertThat(e.error()).isEqualTo(CoordinationError.NO_FEASIBLE_CANDIDATE));
        verifyNoInteractions(lifecycleManager, coordinator);
        assertThat(launcher.find(OP).orElseThrow().state()).isEqualTo(OperationState.FAILED);
    }

    @Test
    void 레저_등록_중복_시_먼저_등록한_레저만_해제() {
        // given
        doNothing().doThrow(CoordinationException.alreadyRegistered("STORAGE-2"))
            .when(coordinator).registerResource(any());

        // when & then
        assertThatThrownBy(() -> launcher.launch(CancellationSignal.create(), fixedSitePlan()))
            .isInstanceOf(CoordinationException.class);
        verify(coordinator).unregisterResource("STORAGE-1");
        verify(coordinator, never()).unregisterResource("STORAGE-2");
    }

    @Test
    void stop_정리_순서는_신호_배정_워커_레저() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        OperationHandle handle = launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // when
        boolean stopped = handle.stop();

        // then
        assertThat(stopped).isTrue();
        assertThat(handle.state()).isEqualTo(OperationState.STOPPED);
        assertThat(handle.signal().isCancelled()).isTrue();
        InOrder inOrder = inOrder(assignment, lifecycleManager, coordinator);
        inOrder.verify(assignment).shutdown();
        inOrder.verify(lifecycleManager).stopWorker("w-1");
        inOrder.verify(lifecycleManager).stopWorker("w-2");
        inOrder.verify(lifecycleManager).stopWorker("w-3");
        inOrder.verify(coordinator).unregisterResource("STORAGE-1");
        inOrder.verify(coordinator).unregisterResource("STORAGE-2");
    }

    @Test
    void stop_두번_호출해도_한번만_정리() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        OperationHandle handle = launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // when
        handle.stop();
        boolean second = handle.stop();
        boolean completed = handle.complete();

        // then
        assertThat(second).isFalse();
        assertThat(completed).isFalse();
        assertThat(handle.state()).isEqualTo(OperationState.STOPPED);
        verify(assignment, times(1)).shutdown();
        verify(lifecycleManager, times(1)).stopWorker("w-1");
    }

    @Test
    void 워커_중단_실패는_로그만_남기고_나머지_정리_계속() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        doThrow(new IllegalStateException("gone")).when(lifecycleManager).stopWorker("w-2");
        OperationHandle handle = launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // when
        boolean completed = handle.complete();

        // then
        assertThat(completed).isTrue();
        assertThat(handle.state()).isEqualTo(OperationState.COMPLETED);
        verify(lifecycleManager).stopWorker("w-3");
        verify(coordinator).unregisterResource("STORAGE-2");
    }

    @Test
    void 실행_중인_Operation을_다시_시작하면_예외() {
        // given
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        launcher.launch(CancellationSignal.create(), fixedSitePlan());

        // when & then
        assertThatThrownBy(() -> launcher.launch(CancellationSignal.create(), fixedSitePlan()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("RUNNING");
    }

    @Test
    void 실패한_Operation을_동시에_다시_시작하면_하나만_성공한다() throws Exception {
        // given
        when(candidateSelector.selectBestCandidate(any(), any()))
            .thenThrow(CoordinationException.noFeasibleCandidate("no sites with trait COMMON_METAL_DEPOSITS"));
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        SearchRequest search = SearchRequest.of(ExtractionTarget.COMMON_METALS, new ShipProfile(400, 30), List.of());
        OperationPlan failing = new OperationPlan(OP, null, search, null, List.of(), List.of("MINER-1"), List.of());
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            for (int round = 0; round < 20; round++) {
                OperationLauncher fresh = new OperationLauncher(coordinator, candidateSelector, lifecycleManager, assignmentFactory);
                assertThatThrownBy(() -> fresh.launch(CancellationSignal.create(), failing))
                    .isInstanceOf(CoordinationException.class);
                CountDownLatch start = new CountDownLatch(1);
                Callable<OperationHandle> relaunch = () -> {
                    start.await();
                    return fresh.launch(CancellationSignal.create(), fixedSitePlan());
                };

                // when
                List<Future<OperationHandle>> attempts = List.of(executor.submit(relaunch), executor.submit(relaunch));
                start.countDown();

                // then
                List<OperationHandle> launched = new ArrayList<>();
                int rejected = 0;
                for (Future<OperationHandle> attempt : attempts) {
                    try {
                        launched.add(attempt.get(5, TimeUnit.SECONDS));
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                        rejected++;
                    }
                }
                assertThat(launched).hasSize(1);
                assertThat(rejected).isEqualTo(1);
                assertThat(fresh.find(OP)).containsSame(launched.get(0));
                assertThat(launched.get(0).state()).isEqualTo(OperationState.RUNNING);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void 상위_신호가_취소되면_Operation_신호도_취소() {
        // given
        CancellationSignal parent = CancellationSignal.create();
        when(lifecycleManager.startWorker(any())).thenReturn("w-1", "w-2", "w-3");
        when(assignmentFactory.open(eq(OP), any(), anyList(), anyList())).thenReturn(assignment);
        OperationHandle handle = launcher.launch(parent, fixedSitePlan());

        // when
        parent.cancel();

        // then
        assertThat(handle.signal().isCancelled()).isTrue();
    }

    @Test
    void 생성자_null_의존성_예외() {
        assertThatThrownBy(() -> new OperationLauncher(null, candidateSelector, lifecycleManager, assignmentFactory))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("coordinator");
    }
}
