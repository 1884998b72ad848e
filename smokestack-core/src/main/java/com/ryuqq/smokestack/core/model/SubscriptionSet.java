package com.ryuqq.smokestack.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * User가 알림을 받고자 하는 Operation id, Component 이름, Tag 이름의 집합.
 *
 * <p><strong>매칭 규칙:</strong> Operation의 id가 operations에 있거나,
 * Operation의 components/tags 중 하나라도 대응하는 집합에 있으면 매칭됩니다.</p>
 *
 * <p>세 집합은 모두 정렬된 불변 집합이므로 목록 조회 결과가 결정적입니다.
 * 추가는 새 인스턴스를 반환합니다.</p>
 *
 * @param operations 구독한 Operation id
 * @param components 구독한 Component 이름
 * @param tags 구독한 Tag 이름
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record SubscriptionSet(
    SortedSet<Long> operations,
    SortedSet<String> components,
    SortedSet<String> tags
) {

    private static final SubscriptionSet EMPTY = new SubscriptionSet(null, null, null);

    public SubscriptionSet {
        operations = sorted(operations);
        components = sorted(components);
        tags = sorted(tags);
    }

    private static <T> SortedSet<T> sorted(Collection<T> values) {
        return values == null
            ? Collections.emptySortedSet()
            : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    public static SubscriptionSet empty() {
        return EMPTY;
    }

    public SubscriptionSet withOperation(long operationId) {
        TreeSet<Long> updated = new TreeSet<>(operations);
        updated.add(operationId);
        return new SubscriptionSet(updated, components, tags);
    }

    public SubscriptionSet withComponent(String component) {
        TreeSet<String> updated = new TreeSet<>(components);
        updated.add(component);
        return new SubscriptionSet(operations, updated, tags);
    }

    public SubscriptionSet withTag(String tag) {
        TreeSet<String> updated = new TreeSet<>(tags);
        updated.add(tag);
        return new SubscriptionSet(operations, components, updated);
    }

    /**
     * Operation이 이 구독 집합과 매칭되는지 확인.
     *
     * @param operation 검사할 Operation
     * @return 매칭되면 true
     */
    public boolean matches(Operation operation) {
        if (operations.contains(operation.id())) {
            return true;
        }
        for (String component : operation.components()) {
            if (components.contains(component)) {
                return true;
            }
        }
        for (String tag : operation.tags()) {
            if (tags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return operations.isEmpty() && components.isEmpty() && tags.isEmpty();
    }
}
