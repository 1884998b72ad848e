package com.ryuqq.smokestack.application.engine;

/**
 * CoordinationEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>firstOperationId: 빈 저장소에서 처음 할당할 Operation id (기본 1234)</li>
 *   <li>retainLocksWhilePaused: PAUSED 상태에서 잠금 유지 여부 (기본 true)</li>
 *   <li>sharedLocksOnAllComponents: locks에 없는 모든 컴포넌트에 SHARED 잠금을 잡을지 여부 (기본 false)</li>
 * </ul>
 *
 * <p>retainLocksWhilePaused=false이면 PAUSED로 전이할 때 잠금을 해제하고,
 * 재개(IN_PROGRESS) 시 다시 획득합니다. 재개 시 다른 Operation이 잠금을 가져갔다면 LOCK_FAILED입니다.</p>
 *
 * <p>sharedLocksOnAllComponents=false이면 SHARED 잠금은 다른 활성 Operation이 EXCLUSIVE로 잡은
 * 컴포넌트에만 요구되므로, 먼저 시작한 읽기 Operation이 나중의 쓰기 Operation을 막지 않습니다.
 * true이면 읽기 Operation이 끝날 때까지 같은 컴포넌트의 EXCLUSIVE 잠금이 거부됩니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 * @param firstOperationId 첫 Operation id (0 이상)
 * @param retainLocksWhilePaused PAUSED 상태의 잠금 유지 여부
 * @param sharedLocksOnAllComponents 모든 비잠금 컴포넌트에 SHARED 잠금을 잡을지 여부
 */
public record EngineConfig(long firstOperationId, boolean retainLocksWhilePaused, boolean sharedLocksOnAllComponents) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: firstOperationId=1234, retainLocksWhilePaused=true, sharedLocksOnAllComponents=false</p>
     */
    public EngineConfig() {
        this(1234L, true, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (firstOperationId < 0) {
            throw new IllegalArgumentException(
                "firstOperationId must not be negative (current: " + firstOperationId + ")"
            );
        }
    }

    public EngineConfig withFirstOperationId(long firstOperationId) {
        return new EngineConfig(firstOperationId, this.retainLocksWhilePaused, this.sharedLocksOnAllComponents);
    }

    public EngineConfig withRetainLocksWhilePaused(boolean retainLocksWhilePaused) {
        return new EngineConfig(this.firstOperationId, retainLocksWhilePaused, this.sharedLocksOnAllComponents);
    }

    public EngineConfig withSharedLocksOnAllComponents(boolean sharedLocksOnAllComponents) {
        return new EngineConfig(this.firstOperationId, this.retainLocksWhilePaused, sharedLocksOnAllComponents);
    }
}
