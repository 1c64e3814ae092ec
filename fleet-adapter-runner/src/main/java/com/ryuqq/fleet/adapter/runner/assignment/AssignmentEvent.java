package com.ryuqq.fleet.adapter.runner.assignment;

import com.ryuqq.fleet.core.error.CoordinationException;

import java.util.concurrent.CompletableFuture;

/**
 * 배정 루프가 처리하는 이벤트.
 *
 * <p>블로킹 호출(Request, Availability)은 응답 슬롯을 함께 보냅니다. 호출자가 취소하면 슬롯이
 * 먼저 닫히고, 루프는 그런 이벤트를 꺼낼 때 건너뜁니다.</p>
 */
sealed interface AssignmentEvent {

    /**
     * 루프 종료 시 처리되지 못한 이벤트의 호출자에게 오류를 전달합니다.
     */
    default void fail(CoordinationException error) {
    }

    /**
     * 소비자의 생산자 요청. 응답은 배정된 생산자 ID.
     */
    record Request(String consumerId, CompletableFuture<String> reply) implements AssignmentEvent {

        boolean isAbandoned() {
            return reply.isDone();
        }

        @Override
        public void fail(CoordinationException error) {
            reply.completeExceptionally(error);
        }
    }

    /**
     * 생산자의 대기 알림. 슬롯은 소비자가 화물을 넘겨받으면 완료됩니다.
     */
    record Availability(String producerId, int supplyLevel, CompletableFuture<Void> received)
        implements AssignmentEvent {

        boolean isAbandoned() {
            return received.isDone();
        }

        @Override
        public void fail(CoordinationException error) {
            received.completeExceptionally(error);
        }
    }

    record Completion(String consumerId, String producerId) implements AssignmentEvent {
    }

    enum Shutdown implements AssignmentEvent {
        INSTANCE
    }
}
