package com.ryuqq.smokestack.application.engine;

import com.ryuqq.smokestack.application.request.CreateComponentRequest;
import com.ryuqq.smokestack.application.request.CreateOperationRequest;
import com.ryuqq.smokestack.application.request.CreateSubscriptionRequest;
import com.ryuqq.smokestack.application.request.CreateTagRequest;
import com.ryuqq.smokestack.application.request.UpdateOperationRequest;
import com.ryuqq.smokestack.application.store.EntityStore;
import com.ryuqq.smokestack.application.validation.EntityValidator;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.lock.LockMode;
import com.ryuqq.smokestack.core.lock.LockRequirements;
import com.ryuqq.smokestack.core.lock.LockTable;
import com.ryuqq.smokestack.core.model.Component;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.OperationFilter;
import com.ryuqq.smokestack.core.model.SubscriptionSet;
import com.ryuqq.smokestack.core.model.Tag;
import com.ryuqq.smokestack.core.model.User;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import com.ryuqq.smokestack.core.spi.Broadcaster;
import com.ryuqq.smokestack.core.spi.OperationWatch;
import com.ryuqq.smokestack.core.statemachine.OperationState;
import com.ryuqq.smokestack.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 변경 작업(Operation) 조정 엔진.
 *
 * <p>저장소, 검증기, 상태 머신, 선행 조건 검사, 컴포넌트 잠금, 변경 알림을 하나의 진입점으로 묶습니다.</p>
 *
 * <p><strong>쓰기 경로 (Operation upsert):</strong></p>
 * <ol>
 *   <li>쓰기 잠금 획득</li>
 *   <li>요청 병합 및 정규화/참조 검증 ({@link EntityValidator})</li>
 *   <li>상태 전이 검증 ({@link StateTransition})</li>
 *   <li>선행 조건 검사 (결과 상태가 IN_PROGRESS인 경우)</li>
 *   <li>잠금 요구사항 재계산 및 원자적 교체 ({@link LockTable#replace(long, Map)})</li>
 *   <li>커밋 후 쓰기 잠금 해제 (예외와 {@link Error} 모두 finally에서 해제)</li>
 *   <li>값이 바뀐 경우에만 {@link Broadcaster#publish(Operation)}</li>
 * </ol>
 *
 * <p><strong>잠금 요구사항:</strong> locks의 컴포넌트는 EXCLUSIVE, 그 밖의 컴포넌트는 다른 활성 Operation이
 * EXCLUSIVE로 잡고 있는 경우에만 SHARED를 요구합니다. 그런 SHARED 요청은 항상 충돌하므로
 * 먼저 시작한 읽기 Operation은 나중의 쓰기 Operation을 막지 않습니다.
 * {@link EngineConfig#sharedLocksOnAllComponents()}가 true이면 모든 비잠금 컴포넌트에 SHARED를 잡습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>저장소와 잠금 테이블 전체를 하나의 {@link ReentrantReadWriteLock}으로 보호</li>
 *   <li>조회는 읽기 잠금, 모든 변경은 쓰기 잠금</li>
 *   <li>알림은 쓰기 잠금 밖에서 전달. 쓰기 잠금을 놓기 전에 publishLock을 잡으므로
 *       구독자는 커밋 순서대로 변경을 관찰합니다.</li>
 * </ul>
 *
 * <p><strong>실패 원자성:</strong> 모든 검증은 변경 전에 수행됩니다.
 * 예외가 발생한 쓰기 요청은 저장소, 잠금 테이블, id 카운터를 변경하지 않습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class CoordinationEngine {

    private static final Logger log = LoggerFactory.getLogger(CoordinationEngine.class);

    private final EngineConfig config;
    private final Broadcaster broadcaster;
    private final EntityStore store;
    private final EntityValidator validator;
    private final LockTable lockTable = new LockTable();

    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Lock readLock = rwLock.readLock();
    private final Lock writeLock = rwLock.writeLock();
    private final Lock publishLock = new ReentrantLock();

    /**
     * 빈 저장소로 엔진 생성.
     *
     * @param config 엔진 설정
     * @param broadcaster 변경 알림 fan-out
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public CoordinationEngine(EngineConfig config, Broadcaster broadcaster) {
        this(config, broadcaster, new EntityStore(requireConfig(config).firstOperationId()));
    }

    private CoordinationEngine(EngineConfig config, Broadcaster broadcaster, EntityStore store) {
        if (broadcaster == null) {
            throw new IllegalArgumentException("broadcaster cannot be null");
        }
        this.config = requireConfig(config);
        this.broadcaster = broadcaster;
        this.store = store;
        this.validator = new EntityValidator(store);
    }

    private static EngineConfig requireConfig(EngineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    /**
     * 스냅샷으로부터 엔진 복원.
     *
     * <p>IN_PROGRESS (그리고 설정에 따라 PAUSED) Operation의 잠금을 id 순으로 다시 획득합니다.
     * 기본 설정에서는 EXCLUSIVE 잠금만 복원합니다.</p>
     *
     * @param snapshot 저장된 스냅샷
     * @param config 엔진 설정
     * @param broadcaster 변경 알림 fan-out
     * @return 복원된 엔진
     * @throws IllegalStateException 스냅샷의 활성 Operation끼리 잠금이 충돌하는 경우
     */
    public static CoordinationEngine restore(EntitySnapshot snapshot, EngineConfig config, Broadcaster broadcaster) {
        CoordinationEngine engine = new CoordinationEngine(config, broadcaster, EntityStore.fromSnapshot(snapshot));
        for (Operation operation : engine.store.operations()) {
            try {
                engine.lockTable.acquireAll(operation.id(), engine.restoredLocks(operation));
            } catch (SmokestackException e) {
                log.error("Lock reconstruction failed: operation={}, reason={}", operation.id(), e.getMessage());
                throw new IllegalStateException(
                    "inconsistent snapshot: operation " + operation.id() + " cannot reacquire its locks", e);
            }
        }
        log.info("Engine restored: users={}, components={}, tags={}, operations={}, lockedComponents={}",
            snapshot.users().size(), snapshot.components().size(), snapshot.tags().size(),
            snapshot.operations().size(), engine.lockTable.snapshot().size());
        return engine;
    }

    // ========== User ==========

    /**
     * User 생성.
     *
     * @param name 이름
     * @return 생성된 User
     * @throws SmokestackException 이름이 공백이거나 (BLANK_ITEM) 이미 있는 경우 (ALREADY_EXISTS)
     */
    public User createUser(String name) {
        String normalized = EntityValidator.requireText("name", name);
        writeLock.lock();
        try {
            User user = User.of(normalized);
            store.insertUser(user);
            log.info("User created: {}", normalized);
            return user;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * User 조회, 없으면 생성.
     *
     * @param name 이름
     * @return 기존 또는 새 User
     */
    public User ensureUser(String name) {
        String normalized = EntityValidator.requireText("username", name);
        writeLock.lock();
        try {
            return store.findUser(normalized).orElseGet(() -> {
                User user = User.of(normalized);
                store.insertUser(user);
                log.info("User created on first authentication: {}", normalized);
                return user;
            });
        } finally {
            writeLock.unlock();
        }
    }

    public User getUser(String name) {
        readLock.lock();
        try {
            return store.user(name);
        } finally {
            readLock.unlock();
        }
    }

    // ========== Component / Tag ==========

    public Component createComponent(CreateComponentRequest request) {
        requireRequest(request);
        writeLock.lock();
        try {
            Component component = validator.validateComponent(
                new Component(request.name(), request.description(),
                    EntityValidator.normalizeNames("owners", request.owners())));
            store.insertComponent(component);
            log.info("Component created: {} (owners={})", component.name(), component.owners());
            return component;
        } finally {
            writeLock.unlock();
        }
    }

    public Component getComponent(String name) {
        readLock.lock();
        try {
            return store.component(name);
        } finally {
            readLock.unlock();
        }
    }

    public List<Component> listComponents() {
        readLock.lock();
        try {
            return store.components();
        } finally {
            readLock.unlock();
        }
    }

    public Tag createTag(CreateTagRequest request) {
        requireRequest(request);
        writeLock.lock();
        try {
            Tag tag = validator.validateTag(new Tag(request.name(), request.description()));
            store.insertTag(tag);
            log.info("Tag created: {}", tag.name());
            return tag;
        } finally {
            writeLock.unlock();
        }
    }

    public Tag getTag(String name) {
        readLock.lock();
        try {
            return store.tag(name);
        } finally {
            readLock.unlock();
        }
    }

    public List<Tag> listTags() {
        readLock.lock();
        try {
            return store.tags();
        } finally {
            readLock.unlock();
        }
    }

    // ========== Operation ==========

    /**
     * Operation 생성.
     *
     * <p>id는 자동 할당되고 상태는 항상 PLANNED입니다.
     * operators가 비어 있으면 요청한 User가 담당자가 됩니다.</p>
     *
     * @param username 요청한 User
     * @param request 생성 요청
     * @return 저장된 Operation
     * @throws SmokestackException 검증 실패 시
     */
    public Operation createOperation(String username, CreateOperationRequest request) {
        requireRequest(request);
        Operation created;
        boolean handedOff = false;
        writeLock.lock();
        try {
            store.user(username);
            EntityValidator.requireText("title", request.title());
            EntityValidator.requireText("purpose", request.purpose());
            URI url = EntityValidator.parseUrl(request.url());
            List<String> components = EntityValidator.normalizeNames("components", request.components());
            List<String> locks = EntityValidator.normalizeNames("locks", request.locks());
            List<String> tags = EntityValidator.normalizeNames("tags", request.tags());
            List<Long> dependsOn = EntityValidator.normalizeIds(request.dependsOn());
            List<String> operators = request.operators().isEmpty()
                ? List.of(username)
                : EntityValidator.normalizeNames("operators", request.operators());

            Operation draft = new Operation(store.peekNextId(), request.title(), request.purpose(), url,
                components, locks, tags, dependsOn, operators, OperationState.PLANNED, request.annotations());
            created = upsert(null, validator.validateOperation(draft));
            store.allocateId();
            handedOff = true;
            publishAfterUnlock(created);
        } finally {
            if (!handedOff) {
                writeLock.unlock();
            }
        }
        log.info("Operation created: id={}, title={}, components={}", created.id(), created.title(),
            created.components());
        return created;
    }

    /**
     * Operation 부분 수정 (상태 전이 포함).
     *
     * @param id Operation id
     * @param request 수정 요청
     * @return 저장된 Operation
     * @throws SmokestackException 검증, 상태 전이, 선행 조건, 잠금 실패 시
     */
    public Operation updateOperation(long id, UpdateOperationRequest request) {
        requireRequest(request);
        Operation current;
        Operation updated;
        boolean handedOff = false;
        writeLock.lock();
        try {
            current = store.operation(id);
            Operation candidate = validator.validateOperation(request.applyTo(current));
            updated = upsert(current, candidate);
            if (!updated.equals(current)) {
                handedOff = true;
                publishAfterUnlock(updated);
            }
        } finally {
            if (!handedOff) {
                writeLock.unlock();
            }
        }
        if (updated.equals(current)) {
            log.debug("Operation unchanged: id={}", id);
            return updated;
        }
        if (current.status() != updated.status()) {
            log.info("Operation status changed: id={}, {} -> {}", id, current.status(), updated.status());
        }
        return updated;
    }

    /**
     * 검증된 후보를 상태 머신, 선행 조건, 잠금 테이블에 통과시킨 후 커밋.
     *
     * <p>쓰기 잠금 안에서만 호출합니다. 잠금 교체는 마지막 검사이며 실패 시 스스로 복원하므로,
     * 예외가 나면 저장소와 잠금 테이블은 변경되지 않습니다.</p>
     */
    private Operation upsert(Operation previous, Operation candidate) {
        if (previous == null) {
            if (candidate.status() != OperationState.PLANNED) {
                throw new IllegalArgumentException(
                    "new operation must be planned (current: " + candidate.status() + ")");
            }
        } else {
            StateTransition.validate(previous.status(), candidate.status());
        }
        DependencyGate.check(candidate, store);
        lockTable.replace(candidate.id(), requiredLocks(previous, candidate));
        store.putOperation(candidate);
        return candidate;
    }

    /**
     * 후보가 보유해야 할 잠금.
     *
     * <p>이미 잠금을 보유하던 Operation은 이전 컴포넌트에 대해 다시 SHARED를 요구하지 않습니다.
     * 나중에 시작한 쓰기 Operation 때문에 제목 수정 같은 편집이 실패하지 않도록 하기 위함입니다.</p>
     */
    private Map<String, LockMode> requiredLocks(Operation previous, Operation candidate) {
        if (!holdsLocks(candidate)) {
            return Map.of();
        }
        if (config.sharedLocksOnAllComponents()) {
            return LockRequirements.of(candidate);
        }
        Set<String> contested = new HashSet<>(lockTable.exclusivelyHeldByOthers(candidate.id()));
        if (previous != null && holdsLocks(previous)) {
            contested.removeAll(previous.components());
        }
        return LockRequirements.of(candidate, contested);
    }

    private Map<String, LockMode> restoredLocks(Operation operation) {
        if (!holdsLocks(operation)) {
            return Map.of();
        }
        return config.sharedLocksOnAllComponents()
            ? LockRequirements.of(operation)
            : LockRequirements.of(operation, Set.of());
    }

    private boolean holdsLocks(Operation operation) {
        return operation.status() == OperationState.IN_PROGRESS
            || (operation.status() == OperationState.PAUSED && config.retainLocksWhilePaused());
    }

    /**
     * 쓰기 잠금을 놓고 알림 전달. 호출 시점에 쓰기 잠금을 보유하고 있어야 합니다.
     */
    private void publishAfterUnlock(Operation operation) {
        publishLock.lock();
        try {
            writeLock.unlock();
            broadcaster.publish(operation);
        } catch (RuntimeException e) {
            log.warn("Broadcast failed: operation={}, reason={}", operation.id(), e.getMessage());
        } finally {
            publishLock.unlock();
        }
    }

    public Operation getOperation(long id) {
        readLock.lock();
        try {
            return store.operation(id);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Operation 목록 조회 (id 순).
     *
     * @param filter 필터 ({@link OperationFilter#all()}이면 전체)
     * @return 매칭되는 Operation
     */
    public List<Operation> listOperations(OperationFilter filter) {
        OperationFilter effective = filter == null ? OperationFilter.all() : filter;
        readLock.lock();
        try {
            return store.operations().stream()
                .filter(effective::matches)
                .collect(Collectors.toList());
        } finally {
            readLock.unlock();
        }
    }

    // ========== Subscription ==========

    /**
     * 구독 추가.
     *
     * <p>같은 대상을 다시 구독해도 오류가 아닙니다.</p>
     *
     * @param username 구독하는 User
     * @param request operation, component, tag 중 정확히 하나
     * @return 갱신된 구독 목록
     * @throws SmokestackException 대상이 하나가 아니거나 (SUBSCRIBING_MULTIPLE_ENTITIES) 없는 경우 (NOT_FOUND)
     */
    public SubscriptionListing subscribe(String username, CreateSubscriptionRequest request) {
        requireRequest(request);
        if (request.targetCount() != 1) {
            throw SmokestackException.subscribingMultipleEntities();
        }
        writeLock.lock();
        try {
            User user = store.user(username);
            SubscriptionSet subscriptions = user.subscriptions();
            if (request.operation() != null) {
                store.operation(request.operation());
                subscriptions = subscriptions.withOperation(request.operation());
            } else if (request.component() != null) {
                String component = EntityValidator.requireText("component", request.component());
                store.component(component);
                subscriptions = subscriptions.withComponent(component);
            } else {
                String tag = EntityValidator.requireText("tag", request.tag());
                store.tag(tag);
                subscriptions = subscriptions.withTag(tag);
            }
            store.replaceUser(user.withSubscriptions(subscriptions));
            log.debug("Subscription added: user={}, subscriptions={}", username, subscriptions);
            return SubscriptionListing.from(subscriptions);
        } finally {
            writeLock.unlock();
        }
    }

    public SubscriptionListing listSubscriptions(String username) {
        readLock.lock();
        try {
            return SubscriptionListing.from(store.user(username).subscriptions());
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 실시간 변경 스트림 열기.
     *
     * <p>현재 모든 Operation을 먼저 내보낸 후, 이후 변경 중 User의 구독과 매칭되는 것만 내보냅니다.
     * 구독 집합은 호출 시점 값으로 고정됩니다.</p>
     *
     * @param username 구독하는 User
     * @return 수신 핸들 (사용 후 close)
     */
    public WatchHandle watch(String username) {
        readLock.lock();
        try {
            SubscriptionSet filter = store.user(username).subscriptions();
            OperationWatch watch = broadcaster.open(filter);
            List<Operation> initial = store.operations();
            log.debug("Watch opened: user={}, initial={}", username, initial.size());
            return new WatchHandle(initial, watch);
        } finally {
            readLock.unlock();
        }
    }

    // ========== Inspection ==========

    /**
     * 전체 엔티티 스냅샷.
     *
     * @return 읽기 잠금 아래에서 만든 일관된 스냅샷
     */
    public EntitySnapshot snapshot() {
        readLock.lock();
        try {
            return store.toSnapshot();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 현재 잠금 상태.
     *
     * @return 컴포넌트 이름 → 잠금 모드 (불변)
     */
    public Map<String, LockMode> locks() {
        readLock.lock();
        try {
            return lockTable.snapshot();
        } finally {
            readLock.unlock();
        }
    }

    public EngineConfig config() {
        return config;
    }

    private static void requireRequest(Object request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }
}
