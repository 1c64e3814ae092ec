package com.ryuqq.fleet.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING, STOPPED, FAILED</li>
 *   <li>RUNNING → COMPLETED, STOPPED, FAILED</li>
 * </ul>
 *
 * <p>종료 상태(COMPLETED, STOPPED, FAILED)에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    private static final Map<OperationState, Set<OperationState>> ALLOWED = new EnumMap<>(OperationState.class);

    static {
        Set<OperationState> endings = EnumSet.of(OperationState.STOPPED, OperationState.FAILED);

        Set<OperationState> fromPending = EnumSet.of(OperationState.RUNNING);
        fromPending.addAll(endings);
        ALLOWED.put(OperationState.PENDING, Collections.unmodifiableSet(fromPending));

        Set<OperationState> fromRunning = EnumSet.of(OperationState.COMPLETED);
        fromRunning.addAll(endings);
        ALLOWED.put(OperationState.RUNNING, Collections.unmodifiableSet(fromRunning));
    }

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(OperationState from, OperationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!allowedTargets(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s (allowed: %s)", from, to, allowedTargets(from))
            );
        }
    }

    /**
     * 주어진 상태에서 전이할 수 있는 상태 목록. 종료 상태는 빈 집합.
     *
     * @param from 현재 상태
     * @return 불변 집합
     */
    public static Set<OperationState> allowedTargets(OperationState from) {
        Set<OperationState> targets = ALLOWED.get(from);
        return targets == null ? Set.of() : targets;
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static OperationState transition(OperationState current, OperationState next) {
        validate(current, next);
        return next;
    }
}
