package com.ryuqq.fleet.adapter.runner.assignment;

import com.ryuqq.fleet.application.assignment.WorkAssignment;
import com.ryuqq.fleet.application.assignment.WorkAssignmentFactory;
import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.model.OperationId;
import com.ryuqq.fleet.core.spi.CoordinationObserver;
import com.ryuqq.fleet.core.spi.noop.NoOpCoordinationObserver;

import java.util.Collection;

/**
 * Operation마다 새 {@link WorkAssignmentLoop}를 시작하는 팩토리.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkAssignmentLoopFactory implements WorkAssignmentFactory {

    private final AssignmentLoopConfig config;
    private final CoordinationObserver observer;

    public WorkAssignmentLoopFactory() {
        this(new AssignmentLoopConfig(), NoOpCoordinationObserver.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param config 모든 루프에 적용할 설정
     * @param observer 짝짓기/전송 관측자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public WorkAssignmentLoopFactory(AssignmentLoopConfig config, CoordinationObserver observer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        this.config = config;
        this.observer = observer;
    }

    @Override
    public WorkAssignment open(OperationId operationId, CancellationSignal operationSignal,
                               Collection<String> consumerIds, Collection<String> producerIds) {
        WorkAssignmentLoop loop = new WorkAssignmentLoop(
            operationId, operationSignal, consumerIds, producerIds, config, observer);
        loop.start();
        return loop;
    }
}
