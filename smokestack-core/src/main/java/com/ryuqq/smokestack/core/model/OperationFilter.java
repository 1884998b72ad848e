package com.ryuqq.smokestack.core.model;

import com.ryuqq.smokestack.core.statemachine.OperationState;

import java.util.Collection;
import java.util.Set;

/**
 * Operation 목록 조회 필터.
 *
 * <p>필드 내에서는 OR, 필드 간에는 AND로 결합됩니다. 비어 있는 필드는 조건을 두지 않습니다.</p>
 *
 * <pre>
 * // db 또는 cache에 영향을 주면서 진행 중인 Operation
 * OperationFilter filter = OperationFilter.all()
 *     .withComponents(Set.of("db", "cache"))
 *     .withStatuses(Set.of(OperationState.IN_PROGRESS));
 * </pre>
 *
 * @param components Component 이름 조건
 * @param tags Tag 이름 조건
 * @param operators 담당자 이름 조건
 * @param statuses 상태 조건
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record OperationFilter(
    Set<String> components,
    Set<String> tags,
    Set<String> operators,
    Set<OperationState> statuses
) {

    private static final OperationFilter ALL = new OperationFilter(null, null, null, null);

    public OperationFilter {
        components = components == null ? Set.of() : Set.copyOf(components);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        operators = operators == null ? Set.of() : Set.copyOf(operators);
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
    }

    /**
     * 조건 없는 필터.
     *
     * @return 모든 Operation과 매칭되는 필터
     */
    public static OperationFilter all() {
        return ALL;
    }

    public OperationFilter withComponents(Collection<String> components) {
        return new OperationFilter(Set.copyOf(components), tags, operators, statuses);
    }

    public OperationFilter withTags(Collection<String> tags) {
        return new OperationFilter(components, Set.copyOf(tags), operators, statuses);
    }

    public OperationFilter withOperators(Collection<String> operators) {
        return new OperationFilter(components, tags, Set.copyOf(operators), statuses);
    }

    public OperationFilter withStatuses(Collection<OperationState> statuses) {
        return new OperationFilter(components, tags, operators, Set.copyOf(statuses));
    }

    public boolean matches(Operation operation) {
        if (!components.isEmpty() && operation.components().stream().noneMatch(components::contains)) {
            return false;
        }
        if (!tags.isEmpty() && operation.tags().stream().noneMatch(tags::contains)) {
            return false;
        }
        if (!operators.isEmpty() && operation.operators().stream().noneMatch(operators::contains)) {
            return false;
        }
        return statuses.isEmpty() || statuses.contains(operation.status());
    }
}
