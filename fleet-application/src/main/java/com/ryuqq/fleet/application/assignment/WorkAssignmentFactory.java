package com.ryuqq.fleet.application.assignment;

import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.model.OperationId;

import java.util.Collection;

/**
 * Operation별 {@link WorkAssignment} 생성.
 */
@FunctionalInterface
public interface WorkAssignmentFactory {

    /**
     * 시작된 배정 루프를 엽니다.
     *
     * @param operationId Operation
     * @param operationSignal 발생 시 루프를 종료할 Operation 신호
     * @param consumerIds 등록할 소비자 ID
     * @param producerIds 등록할 생산자 ID
     * @return 실행 중인 배정 루프
     */
    WorkAssignment open(OperationId operationId, CancellationSignal operationSignal,
                        Collection<String> consumerIds, Collection<String> producerIds);
}
