package com.ryuqq.smokestack.core.lock;

import com.ryuqq.smokestack.core.model.Operation;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operation이 실행 중일 때 보유해야 하는 잠금 계산.
 *
 * <p>locks의 컴포넌트는 항상 EXCLUSIVE입니다. 나머지 components 중 SHARED가 필요한 컴포넌트는
 * 호출자가 정합니다 (다른 활성 Operation이 EXCLUSIVE로 잡고 있는 컴포넌트, 또는 전체).</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class LockRequirements {

    private LockRequirements() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * locks는 EXCLUSIVE, 나머지 모든 components는 SHARED.
     *
     * @param operation 대상 Operation
     * @return 컴포넌트 이름 순으로 정렬된 불변 Map
     */
    public static Map<String, LockMode> of(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return of(operation, operation.components());
    }

    /**
     * locks는 EXCLUSIVE, contested에 포함된 나머지 components만 SHARED.
     *
     * <p>contested 중 Operation의 components에 없는 이름은 무시합니다.</p>
     *
     * @param operation 대상 Operation
     * @param contested SHARED가 필요한 컴포넌트 후보
     * @return 컴포넌트 이름 순으로 정렬된 불변 Map
     */
    public static Map<String, LockMode> of(Operation operation, Collection<String> contested) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (contested == null) {
            throw new IllegalArgumentException("contested cannot be null");
        }
        Map<String, LockMode> required = new TreeMap<>();
        for (String component : operation.components()) {
            if (contested.contains(component)) {
                required.put(component, LockMode.SHARED);
            }
        }
        for (String lock : operation.locks()) {
            required.put(lock, LockMode.EXCLUSIVE);
        }
        return Collections.unmodifiableMap(required);
    }
}
