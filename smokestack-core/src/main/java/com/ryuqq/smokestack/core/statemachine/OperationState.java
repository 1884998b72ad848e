package com.ryuqq.smokestack.core.statemachine;

import java.util.Locale;

/**
 * Operation의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PLANNED → IN_PROGRESS (시작)</li>
 *   <li>PLANNED → CANCELED (시작 전 취소)</li>
 *   <li>IN_PROGRESS → PAUSED (일시 정지)</li>
 *   <li>PAUSED → IN_PROGRESS (재개)</li>
 *   <li>IN_PROGRESS → COMPLETED (성공)</li>
 *   <li>IN_PROGRESS → ABORTED (실패)</li>
 *   <li>동일 상태로의 전이는 항상 허용 (no-op)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PLANNED ──► CANCELED
 *    │
 *    ▼ (시작)
 * IN_PROGRESS ◄──► PAUSED
 *    │
 *    ├─► COMPLETED (성공)
 *    │
 *    └─► ABORTED (실패)
 * </pre>
 *
 * <p>외부 표현(스냅샷, 필터)에는 {@link #wireName()}을 사용합니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public enum OperationState {

    /**
     * 계획됨 (아직 시작 안 됨).
     */
    PLANNED("planned"),

    /**
     * 진행 중.
     */
    IN_PROGRESS("in_progress"),

    /**
     * 일시 정지.
     */
    PAUSED("paused"),

    /**
     * 완료 (성공).
     */
    COMPLETED("completed"),

    /**
     * 중단 (실패).
     */
    ABORTED("aborted"),

    /**
     * 시작 전 취소.
     */
    CANCELED("canceled");

    private final String wireName;

    OperationState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 표현 이름 조회 (예: {@code in_progress}).
     *
     * @return snake_case 상태 이름
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, ABORTED, CANCELED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return 종료 상태인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == CANCELED;
    }

    /**
     * 시작된 후 아직 종료되지 않은 상태인지 확인.
     *
     * @return IN_PROGRESS 또는 PAUSED인 경우 true
     */
    public boolean isActive() {
        return this == IN_PROGRESS || this == PAUSED;
    }

    /**
     * 외부 표현 이름으로 상태 조회 (대소문자 무시).
     *
     * @param name 상태 이름 (예: {@code in_progress}, {@code COMPLETED})
     * @return 대응하는 상태
     * @throws IllegalArgumentException name이 null이거나 알 수 없는 상태인 경우
     */
    public static OperationState fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("state name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (OperationState state : values()) {
            if (state.wireName.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("unknown operation state: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
