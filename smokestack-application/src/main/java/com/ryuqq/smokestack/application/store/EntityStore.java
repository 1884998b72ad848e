package com.ryuqq.smokestack.application.store;

import com.ryuqq.smokestack.core.error.EntityKind;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.Component;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.Tag;
import com.ryuqq.smokestack.core.model.User;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * User, Component, Tag, Operation의 단일 저장소.
 *
 * <p><strong>자료 구조:</strong></p>
 * <ul>
 *   <li>users, components, tags: 이름 순 TreeMap</li>
 *   <li>operations: id 순 TreeMap</li>
 *   <li>nextId: 다음에 할당할 Operation id</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 스레드 안전하지 않습니다. {@code CoordinationEngine}의
 * 읽기/쓰기 잠금 아래에서만 접근해야 합니다.</p>
 *
 * <p>조회 메서드({@link #user(String)} 등)는 엔티티가 없으면 NOT_FOUND를 던지므로
 * 참조 무결성 검사에 그대로 사용할 수 있습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class EntityStore {

    private final Map<String, User> users = new TreeMap<>();
    private final Map<String, Component> components = new TreeMap<>();
    private final Map<String, Tag> tags = new TreeMap<>();
    private final Map<Long, Operation> operations = new TreeMap<>();
    private long nextId;

    /**
     * 빈 저장소 생성.
     *
     * @param firstOperationId 첫 Operation id
     */
    public EntityStore(long firstOperationId) {
        this.nextId = firstOperationId;
    }

    /**
     * 스냅샷으로부터 저장소 생성.
     *
     * @param snapshot 복원할 스냅샷
     * @return 스냅샷 내용을 담은 저장소
     * @throws IllegalArgumentException snapshot이 null인 경우
     */
    public static EntityStore fromSnapshot(EntitySnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        EntityStore store = new EntityStore(snapshot.nextId());
        snapshot.users().forEach(user -> store.users.put(user.name(), user));
        snapshot.components().forEach(component -> store.components.put(component.name(), component));
        snapshot.tags().forEach(tag -> store.tags.put(tag.name(), tag));
        snapshot.operations().forEach(operation -> store.operations.put(operation.id(), operation));
        return store;
    }

    /**
     * 현재 내용의 불변 스냅샷.
     *
     * @return 스냅샷
     */
    public EntitySnapshot toSnapshot() {
        return new EntitySnapshot(
            nextId,
            new ArrayList<>(users.values()),
            new ArrayList<>(operations.values()),
            new ArrayList<>(components.values()),
            new ArrayList<>(tags.values())
        );
    }

    // ========== User ==========

    public User user(String name) {
        User user = name == null ? null : users.get(name);
        if (user == null) {
            throw SmokestackException.notFound(EntityKind.USER, name);
        }
        return user;
    }

    public Optional<User> findUser(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(users.get(name));
    }

    /**
     * User 신규 저장.
     *
     * @param user 저장할 User
     * @throws SmokestackException 같은 이름이 이미 있는 경우 (ALREADY_EXISTS)
     */
    public void insertUser(User user) {
        if (users.putIfAbsent(user.name(), user) != null) {
            throw SmokestackException.alreadyExists(EntityKind.USER, user.name());
        }
    }

    /**
     * 기존 User 교체 (구독 변경).
     *
     * @param user 교체할 User
     */
    public void replaceUser(User user) {
        user(user.name());
        users.put(user.name(), user);
    }

    public Collection<User> users() {
        return List.copyOf(users.values());
    }

    // ========== Component ==========

    public Component component(String name) {
        Component component = name == null ? null : components.get(name);
        if (component == null) {
            throw SmokestackException.notFound(EntityKind.COMPONENT, name);
        }
        return component;
    }

    public void insertComponent(Component component) {
        if (components.putIfAbsent(component.name(), component) != null) {
            throw SmokestackException.alreadyExists(EntityKind.COMPONENT, component.name());
        }
    }

    public List<Component> components() {
        return List.copyOf(components.values());
    }

    // ========== Tag ==========

    public Tag tag(String name) {
        Tag tag = name == null ? null : tags.get(name);
        if (tag == null) {
            throw SmokestackException.notFound(EntityKind.TAG, name);
        }
        return tag;
    }

    public void insertTag(Tag tag) {
        if (tags.putIfAbsent(tag.name(), tag) != null) {
            throw SmokestackException.alreadyExists(EntityKind.TAG, tag.name());
        }
    }

    public List<Tag> tags() {
        return List.copyOf(tags.values());
    }

    // ========== Operation ==========

    public Operation operation(long id) {
        Operation operation = operations.get(id);
        if (operation == null) {
            throw SmokestackException.notFound(EntityKind.OPERATION, id);
        }
        return operation;
    }

    /**
     * Operation 저장 (신규 또는 교체).
     *
     * @param operation 저장할 Operation
     * @return 이전 값, 신규인 경우 null
     */
    public Operation putOperation(Operation operation) {
        return operations.put(operation.id(), operation);
    }

    public List<Operation> operations() {
        return List.copyOf(operations.values());
    }

    /**
     * 다음 Operation id 조회 (할당하지 않음).
     *
     * @return 다음 id
     */
    public long peekNextId() {
        return nextId;
    }

    /**
     * 다음 Operation id 할당.
     *
     * <p>검증이 끝나고 커밋할 때만 호출합니다. 실패한 생성 요청은 id를 소모하지 않습니다.</p>
     *
     * @return 할당된 id
     */
    public long allocateId() {
        return nextId++;
    }
}
