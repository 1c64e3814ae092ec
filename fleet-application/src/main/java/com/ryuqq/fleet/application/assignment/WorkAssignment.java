package com.ryuqq.fleet.application.assignment;

import com.ryuqq.fleet.core.cancel.CancellationSignal;
import com.ryuqq.fleet.core.error.CoordinationException;

/**
 * 한 Operation의 생산자-소비자 짝짓기 창구.
 *
 * <p>소비자는 {@link #requestProducer}로 생산자를 요청하고, 생산자는 {@link #signalAvailability}로
 * 대기 중임을 알립니다. 짝짓기 결정은 한 스레드가 이벤트를 하나씩 처리하여 내리며,
 * 호출자는 메시지로만 상호작용합니다.</p>
 *
 * <p><strong>짝짓기 규칙:</strong></p>
 * <ul>
 *   <li>요청 시 대기 중인 생산자가 있으면 공급 수준이 가장 높은 생산자 선택 (동률이면 먼저 알린 생산자)</li>
 *   <li>대기 중인 소비자가 있으면 새로 알린 생산자를 FIFO 맨 앞 소비자와 즉시 짝지음</li>
 *   <li>전송 완료 시 생산자에게 화물 인수를 알리고 전송 횟수 증가</li>
 * </ul>
 *
 * <p>Operation이 종료되면 진행 중인 모든 호출은 OPERATION_SHUTDOWN으로 끝납니다.
 * 호출자는 이를 실패가 아닌 종료로 취급해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkAssignment {

    /**
     * 생산자 배정 요청 (소비자 측, 블로킹).
     *
     * @param signal 호출자의 취소 신호
     * @param consumerId 등록된 소비자 ID
     * @return 배정된 생산자 ID
     * @throws IllegalArgumentException 등록되지 않은 소비자인 경우
     * @throws CoordinationException WAIT_CANCELLED - 호출자 취소, OPERATION_SHUTDOWN - 루프 종료
     */
    String requestProducer(CancellationSignal signal, String consumerId);

    /**
     * 생산자 대기 알림 (생산자 측). 소비자가 화물을 넘겨받을 때까지 블로킹됩니다.
     *
     * @param signal 호출자의 취소 신호
     * @param producerId 등록된 생산자 ID
     * @param supplyLevel 현재 공급 수준 (0 이상)
     * @throws IllegalArgumentException 등록되지 않은 생산자이거나 supplyLevel이 음수인 경우
     * @throws CoordinationException WAIT_CANCELLED - 호출자 취소, OPERATION_SHUTDOWN - 루프 종료
     */
    void signalAvailability(CancellationSignal signal, String producerId, int supplyLevel);

    /**
     * 전송 완료 알림 (비블로킹).
     *
     * @param consumerId 소비자 ID
     * @param producerId 생산자 ID
     * @throws CoordinationException OPERATION_SHUTDOWN - 루프 종료
     */
    void notifyTransferComplete(String consumerId, String producerId);

    long transferCount();

    boolean isRunning();

    /**
     * 이벤트 루프 시작 (멱등).
     */
    void start();

    /**
     * 이벤트 루프 종료 (멱등). 대기 중인 호출은 OPERATION_SHUTDOWN을 받습니다.
     */
    void shutdown();
}
