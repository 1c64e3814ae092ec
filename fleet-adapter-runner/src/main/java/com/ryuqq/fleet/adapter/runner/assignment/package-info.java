/**
 * 생산자-소비자 짝짓기 이벤트 루프.
 *
 * <p>{@link com.ryuqq.fleet.adapter.runner.assignment.WorkAssignmentLoop}는 Operation마다 하나의
 * 스레드로 요청, 대기 알림, 전송 완료 이벤트를 순서대로 처리합니다. 짝짓기 상태를 공유 락 없이
 * 한 스레드만 다루므로 호출자 사이의 경쟁은 이벤트 큐 순서로 정리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.fleet.adapter.runner.assignment;
