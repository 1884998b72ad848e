package com.ryuqq.smokestack.application.engine;

import com.ryuqq.smokestack.application.store.EntityStore;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.statemachine.OperationState;

/**
 * 선행 Operation 완료 조건 검사.
 *
 * <p>Operation이 IN_PROGRESS가 되려면 depends_on의 모든 Operation이 COMPLETED여야 합니다.
 * 쓰기 잠금 안에서 저장소의 현재 상태로 평가하므로 검사와 전이 사이에 경합이 없습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
final class DependencyGate {

    private DependencyGate() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 후보 Operation의 선행 조건 검사.
     *
     * <p>후보 상태가 IN_PROGRESS가 아니면 검사하지 않습니다.</p>
     *
     * @param candidate 커밋하려는 Operation
     * @param store 현재 저장소
     * @throws SmokestackException 완료되지 않은 선행 Operation이 있는 경우 (UNMET_DEPENDENCY)
     */
    static void check(Operation candidate, EntityStore store) {
        if (candidate.status() != OperationState.IN_PROGRESS) {
            return;
        }
        for (Long dependency : candidate.dependsOn()) {
            if (store.operation(dependency).status() != OperationState.COMPLETED) {
                throw SmokestackException.unmetDependency(dependency);
            }
        }
    }
}
