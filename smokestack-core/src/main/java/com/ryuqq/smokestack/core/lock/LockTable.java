package com.ryuqq.smokestack.core.lock;

import com.ryuqq.smokestack.core.error.SmokestackException;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 컴포넌트 단위 상호 배제 테이블.
 *
 * <p>컴포넌트마다 현재 잠금 모드와 보유 Operation id를 추적합니다.
 * 항목은 하나 이상의 보유자가 있을 때만 존재하며, 항목이 없으면 잠기지 않은 상태입니다.</p>
 *
 * <p><strong>획득 규칙:</strong></p>
 * <ul>
 *   <li>항목 없음 → 요청 모드로 생성</li>
 *   <li>기존 모드 또는 요청 모드가 EXCLUSIVE → LOCK_FAILED</li>
 *   <li>둘 다 SHARED → 보유자 추가</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 이 클래스는 스레드 안전하지 않습니다.
 * 엔진의 쓰기 잠금 안에서만 변경해야 하며, 그 덕분에 check-then-acquire가 원자적입니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class LockTable {

    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * 단일 컴포넌트 잠금 획득.
     *
     * <p>같은 보유자가 같은 컴포넌트를 다시 요청하면, 현재 보유자가 자신뿐인 경우 모드를 갱신합니다.</p>
     *
     * @param component 컴포넌트 이름
     * @param mode 요청 모드
     * @param holder 보유 Operation id
     * @throws SmokestackException 충돌 시 (LOCK_FAILED)
     */
    public void acquire(String component, LockMode mode, long holder) {
        if (component == null || mode == null) {
            throw new IllegalArgumentException("component and mode cannot be null");
        }
        Entry entry = entries.get(component);
        if (entry == null) {
            entries.put(component, new Entry(mode, holder));
            return;
        }
        if (entry.holders.size() == 1 && entry.holders.contains(holder)) {
            entry.mode = mode;
            return;
        }
        if (!entry.mode.isCompatibleWith(mode)) {
            throw SmokestackException.lockFailed(component);
        }
        entry.holders.add(holder);
    }

    /**
     * 여러 컴포넌트 잠금을 원자적으로 획득.
     *
     * <p>하나라도 실패하면 이번 호출에서 획득한 잠금을 모두 되돌린 후 예외를 던집니다.</p>
     *
     * @param holder 보유 Operation id
     * @param required 컴포넌트별 요청 모드
     * @throws SmokestackException 충돌 시 (LOCK_FAILED)
     */
    public void acquireAll(long holder, Map<String, LockMode> required) {
        Map<String, LockMode> previous = heldBy(holder);
        Map<String, LockMode> acquired = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, LockMode> requirement : required.entrySet()) {
                acquire(requirement.getKey(), requirement.getValue(), holder);
                acquired.put(requirement.getKey(), requirement.getValue());
            }
        } catch (SmokestackException e) {
            for (String component : acquired.keySet()) {
                releaseOne(component, holder);
            }
            previous.forEach((component, mode) -> acquire(component, mode, holder));
            throw e;
        }
    }

    /**
     * 보유자의 잠금을 required로 교체.
     *
     * <p>기존 잠금을 해제하고 새 잠금을 획득합니다. 실패하면 기존 잠금을 그대로 복원합니다.</p>
     *
     * @param holder 보유 Operation id
     * @param required 새로 보유할 잠금 (비어 있으면 모두 해제)
     * @throws SmokestackException 충돌 시 (LOCK_FAILED)
     */
    public void replace(long holder, Map<String, LockMode> required) {
        Map<String, LockMode> previous = heldBy(holder);
        if (previous.equals(required)) {
            return;
        }
        releaseAll(holder);
        try {
            acquireAll(holder, required);
        } catch (SmokestackException e) {
            previous.forEach((component, mode) -> acquire(component, mode, holder));
            throw e;
        }
    }

    /**
     * 보유자의 모든 잠금 해제.
     *
     * @param holder 보유 Operation id
     */
    public void releaseAll(long holder) {
        for (String component : heldBy(holder).keySet()) {
            releaseOne(component, holder);
        }
    }

    private void releaseOne(String component, long holder) {
        Entry entry = entries.get(component);
        if (entry == null) {
            return;
        }
        entry.holders.remove(holder);
        if (entry.holders.isEmpty()) {
            entries.remove(component);
        }
    }

    /**
     * 컴포넌트의 현재 잠금 모드.
     *
     * @param component 컴포넌트 이름
     * @return 잠금 모드, 잠기지 않았으면 empty
     */
    public Optional<LockMode> modeOf(String component) {
        Entry entry = entries.get(component);
        return entry == null ? Optional.empty() : Optional.of(entry.mode);
    }

    /**
     * 컴포넌트를 보유 중인 Operation id.
     *
     * @param component 컴포넌트 이름
     * @return 정렬된 불변 집합
     */
    public Set<Long> holdersOf(String component) {
        Entry entry = entries.get(component);
        return entry == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(entry.holders));
    }

    /**
     * 보유자가 가진 잠금.
     *
     * @param holder 보유 Operation id
     * @return 컴포넌트 이름 순 Map (복사본)
     */
    public Map<String, LockMode> heldBy(long holder) {
        Map<String, LockMode> held = new TreeMap<>();
        entries.forEach((component, entry) -> {
            if (entry.holders.contains(holder)) {
                held.put(component, entry.mode);
            }
        });
        return held;
    }

    /**
     * 현재 잠금 상태 스냅샷.
     *
     * @return 컴포넌트 이름 순 불변 Map
     */
    public Map<String, LockMode> snapshot() {
        Map<String, LockMode> view = new TreeMap<>();
        entries.forEach((component, entry) -> view.put(component, entry.mode));
        return Collections.unmodifiableMap(view);
    }

    /**
     * 다른 보유자가 EXCLUSIVE로 잡고 있는 컴포넌트.
     *
     * @param holder 기준 Operation id (자신이 보유한 잠금은 제외)
     * @return 컴포넌트 이름 순 불변 집합
     */
    public Set<String> exclusivelyHeldByOthers(long holder) {
        Set<String> held = new TreeSet<>();
        entries.forEach((component, entry) -> {
            if (entry.mode == LockMode.EXCLUSIVE && !entry.holders.contains(holder)) {
                held.add(component);
            }
        });
        return Collections.unmodifiableSet(held);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private static final class Entry {
        private LockMode mode;
        private final Set<Long> holders = new TreeSet<>();

        private Entry(LockMode mode, long holder) {
            this.mode = mode;
            this.holders.add(holder);
        }
    }
}
