package com.ryuqq.smokestack.core.statemachine;

import com.ryuqq.smokestack.core.error.SmokestackException;

/**
 * 상태 전이 검증.
 *
 * <p>이 클래스는 Operation의 상태 변경이 허용된 규칙을 따르는지 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PLANNED → IN_PROGRESS, CANCELED</li>
 *   <li>PAUSED → IN_PROGRESS</li>
 *   <li>IN_PROGRESS → PAUSED, COMPLETED, ABORTED</li>
 *   <li>X → X (상태 변경 없음)</li>
 * </ul>
 *
 * <p>그 외 모든 전이(종료 상태에서의 전이 포함)는
 * {@link com.ryuqq.smokestack.core.error.ErrorKind#INVALID_STATE_TRANSITION}으로 거부됩니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되는 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean canTransition(OperationState from, OperationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from == to) {
            return true;
        }
        return switch (from) {
            case PLANNED -> to == OperationState.IN_PROGRESS || to == OperationState.CANCELED;
            case PAUSED -> to == OperationState.IN_PROGRESS;
            case IN_PROGRESS -> to == OperationState.PAUSED
                || to == OperationState.COMPLETED
                || to == OperationState.ABORTED;
            case COMPLETED, ABORTED, CANCELED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws SmokestackException 유효하지 않은 전이인 경우 (INVALID_STATE_TRANSITION)
     */
    public static void validate(OperationState from, OperationState to) {
        if (!canTransition(from, to)) {
            throw SmokestackException.invalidStateTransition(from, to);
        }
    }
}
