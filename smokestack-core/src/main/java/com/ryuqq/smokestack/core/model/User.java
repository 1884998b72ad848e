package com.ryuqq.smokestack.core.model;

/**
 * 인증된 사용자.
 *
 * <p>최초 인증 시 생성되며 삭제되지 않습니다.</p>
 *
 * @param name 고유 이름
 * @param subscriptions 구독 집합
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record User(String name, SubscriptionSet subscriptions) {

    public User {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (subscriptions == null) {
            subscriptions = SubscriptionSet.empty();
        }
    }

    /**
     * 구독이 없는 User 생성.
     *
     * @param name 이름
     * @return 새 User
     */
    public static User of(String name) {
        return new User(name, SubscriptionSet.empty());
    }

    public User withSubscriptions(SubscriptionSet subscriptions) {
        return new User(name, subscriptions);
    }
}
