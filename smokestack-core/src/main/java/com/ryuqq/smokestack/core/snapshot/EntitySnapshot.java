package com.ryuqq.smokestack.core.snapshot;

import com.ryuqq.smokestack.core.model.Component;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.Tag;
import com.ryuqq.smokestack.core.model.User;

import java.util.List;

/**
 * 전체 엔티티 그래프의 불변 스냅샷.
 *
 * <p>호스트 프로세스가 주기적으로 저장하고, 시작 시 복원하는 단위입니다.
 * 잠금 테이블은 포함하지 않으며, 복원 시 IN_PROGRESS/PAUSED Operation으로부터 다시 계산합니다.</p>
 *
 * @param nextId 다음에 할당할 Operation id
 * @param users User 목록 (이름 순)
 * @param operations Operation 목록 (id 순)
 * @param components Component 목록 (이름 순)
 * @param tags Tag 목록 (이름 순)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record EntitySnapshot(
    long nextId,
    List<User> users,
    List<Operation> operations,
    List<Component> components,
    List<Tag> tags
) {

    public EntitySnapshot {
        users = users == null ? List.of() : List.copyOf(users);
        operations = operations == null ? List.of() : List.copyOf(operations);
        components = components == null ? List.of() : List.copyOf(components);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * 빈 스냅샷.
     *
     * @param nextId 첫 Operation id
     * @return 엔티티가 없는 스냅샷
     */
    public static EntitySnapshot empty(long nextId) {
        return new EntitySnapshot(nextId, List.of(), List.of(), List.of(), List.of());
    }
}
