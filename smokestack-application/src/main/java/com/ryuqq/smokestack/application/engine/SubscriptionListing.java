package com.ryuqq.smokestack.application.engine;

import com.ryuqq.smokestack.core.model.SubscriptionSet;

import java.util.List;

/**
 * 구독 목록 조회 결과 (정렬됨).
 *
 * @param operations 구독한 Operation id
 * @param components 구독한 Component 이름
 * @param tags 구독한 Tag 이름
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record SubscriptionListing(List<Long> operations, List<String> components, List<String> tags) {

    public SubscriptionListing {
        operations = List.copyOf(operations);
        components = List.copyOf(components);
        tags = List.copyOf(tags);
    }

    static SubscriptionListing from(SubscriptionSet subscriptions) {
        return new SubscriptionListing(
            List.copyOf(subscriptions.operations()),
            List.copyOf(subscriptions.components()),
            List.copyOf(subscriptions.tags())
        );
    }
}
