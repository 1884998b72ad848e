package com.ryuqq.smokestack.core.lock;

/**
 * 컴포넌트 잠금 모드.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public enum LockMode {

    /**
     * 공유 잠금.
     *
     * <p>Operation이 컴포넌트에 영향을 주지만 locks에 포함하지 않은 경우 획득합니다.
     * 여러 Operation이 동시에 보유할 수 있습니다.</p>
     */
    SHARED,

    /**
     * 배타적 잠금.
     *
     * <p>Operation의 locks에 포함된 컴포넌트에 대해 획득합니다.
     * 한 시점에 하나의 Operation만 보유할 수 있습니다.</p>
     */
    EXCLUSIVE;

    /**
     * 이미 이 모드로 잠긴 컴포넌트에 requested 모드를 추가로 획득할 수 있는지 확인.
     *
     * @param requested 요청 모드
     * @return 둘 다 SHARED인 경우에만 true
     */
    public boolean isCompatibleWith(LockMode requested) {
        return this == SHARED && requested == SHARED;
    }
}
