package com.ryuqq.fleet.application.coordinator;

import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;
import com.ryuqq.fleet.core.ledger.ResourceLedger;
import com.ryuqq.fleet.core.model.OperationId;

import java.util.List;
import java.util.Optional;

/**
 * Operation 단위로 버퍼 리소스를 묶고, 화물을 기다리는 워커를 FIFO로 공정하게 깨우는 조정자.
 *
 * <p>운송 워커는 {@link #waitForCargo}로 화물이 쌓일 때까지 대기하고, 추출 워커는
 * {@link #reserveSpaceForDeposit} → 전송 → {@link #confirmDeposit} 순으로 입고합니다.
 * 입고가 일어날 때마다 같은 (Operation, 상품) 대기열이 도착 순서대로 처리됩니다.</p>
 *
 * <p><strong>FIFO 규칙:</strong> 대기열의 맨 앞 대기자를 만족시킬 수 없으면 처리를 멈춥니다.
 * 뒤의 작은 요청이 지금 재고로 만족 가능하더라도 앞질러 처리하지 않습니다.
 * 새로 들어온 호출은 대기열에 들어가기 전에 즉시 예약을 먼저 시도합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 모든 메서드는 여러 스레드에서 동시에 호출할 수 있습니다.
 * {@link #waitForCargo}만 블로킹되며 나머지는 즉시 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResourceCoordinator {

    /**
     * 리소스 등록.
     *
     * <p>초기 재고가 있는 리소스가 등록되면 해당 상품들의 대기열을 즉시 처리합니다
     * (재시작 후 운송 워커가 먼저 대기에 들어간 경우의 복구 순서).</p>
     *
     * @param ledger 등록할 레저
     * @throws IllegalArgumentException ledger가 null인 경우
     * @throws CoordinationException ALREADY_REGISTERED - 같은 심볼이 이미 등록된 경우
     */
    void registerResource(ResourceLedger ledger);

    /**
     * 리소스 등록 해제.
     *
     * <p>해당 Operation의 모든 대기자는 RESOURCE_GONE을 받고 대기열이 비워집니다.
     * 리소스의 입고 구독도 닫힙니다. 알 수 없는 심볼은 무시합니다.</p>
     *
     * @param resourceSymbol 리소스 심볼
     */
    void unregisterResource(String resourceSymbol);

    /**
     * 최소 수량 이상의 화물이 예약될 때까지 대기.
     *
     * <p>결과는 정확히 하나입니다: 예약 성공, 취소(WAIT_CANCELLED), 리소스 해제(RESOURCE_GONE).
     * 취소로 끝난 경우 대기열에 흔적이 남지 않고 어떤 레저의 예약도 변하지 않습니다.
     * 대기 중 스레드 인터럽트는 취소로 처리하며 인터럽트 플래그를 복원합니다.</p>
     *
     * @param signal 호출자의 취소 신호
     * @param operationId Operation
     * @param goodSymbol 상품
     * @param minUnits 최소 수량 (양수)
     * @return 예약 (가용 화물 전부, minUnits 이상)
     * @throws IllegalArgumentException minUnits가 0 이하이거나 인자가 null인 경우
     * @throws CoordinationException OPERATION_NOT_FOUND, WAIT_CANCELLED, RESOURCE_GONE
     */
    CargoReservation waitForCargo(CancellationSignal signal, OperationId operationId, String goodSymbol, int minUnits);

    /**
     * 예약 없이 이미 전송된 화물을 반영하고 구독자와 대기열에 알립니다.
     *
     * @param resourceSymbol 리소스
     * @param goodSymbol 상품
     * @param units 수량
     */
    void notifyDeposit(String resourceSymbol, String goodSymbol, int units);

    /**
     * 공간 예약을 재고로 확정하고 구독자와 대기열에 알립니다.
     *
     * @param resourceSymbol 리소스
     * @param goodSymbol 상품
     * @param units 수량
     */
    void confirmDeposit(String resourceSymbol, String goodSymbol, int units);

    /**
     * 폐기된 화물을 레저에서 제거 (공간 계산 보정).
     *
     * @param resourceSymbol 리소스
     * @param goodSymbol 상품
     * @param units 수량
     */
    void notifyJettison(String resourceSymbol, String goodSymbol, int units);

    /**
     * 전송 실패 시 공간 예약 해제.
     *
     * @param resourceSymbol 리소스
     * @param units 수량
     */
    void releaseReservedSpace(String resourceSymbol, int units);

    /**
     * 화물 인수 확정 (재고와 예약 차감).
     *
     * @throws CoordinationException RESOURCE_GONE - 알 수 없는 리소스, INSUFFICIENT_CARGO - 예약 초과
     */
    void confirmWithdrawal(String resourceSymbol, String goodSymbol, int units);

    /**
     * 화물 예약 취소. 풀린 화물로 같은 상품의 대기열을 다시 처리합니다.
     *
     * @throws CoordinationException RESOURCE_GONE - 알 수 없는 리소스, INSUFFICIENT_CARGO - 예약 초과
     */
    void cancelWithdrawal(String resourceSymbol, String goodSymbol, int units);

    /**
     * 공간이 있는 첫 리소스(등록 순)에 min(units, 남은 공간)을 원자적으로 예약.
     *
     * @param operationId Operation
     * @param units 원하는 공간 (양수)
     * @return 예약, 공간이 없으면 empty
     */
    Optional<SpaceReservation> reserveSpaceForDeposit(OperationId operationId, int units);

    /**
     * Operation 전체의 예약 가능한 화물 합계.
     */
    int totalAvailableCargo(OperationId operationId, String goodSymbol);

    Optional<ResourceLedger> findResourceWithSpace(OperationId operationId, int minSpace);

    Optional<ResourceLedger> findResource(String resourceSymbol);

    /**
     * Operation의 리소스 목록 (등록 순).
     */
    List<ResourceLedger> resourcesForOperation(OperationId operationId);

    /**
     * 현재 대기열 길이.
     */
    int waitingCount(OperationId operationId, String goodSymbol);

    /**
     * 입고 알림 구독. 아직 등록되지 않은 리소스도 구독할 수 있습니다.
     *
     * @param resourceSymbol 리소스
     * @return 구독 (사용 후 close)
     */
    DepositSubscription subscribeToDeposits(String resourceSymbol);
}
