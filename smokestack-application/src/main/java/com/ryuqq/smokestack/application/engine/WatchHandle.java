package com.ryuqq.smokestack.application.engine;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.spi.OperationWatch;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 한 구독자의 변경 스트림 핸들.
 *
 * <p>두 단계로 Operation을 내보냅니다.</p>
 * <ul>
 *   <li><strong>초기 단계:</strong> 핸들을 연 시점의 모든 Operation (id 순), 대기 없이 반환</li>
 *   <li><strong>실시간 단계:</strong> 이후 broadcast되고 구독과 매칭되는 Operation</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (WatchHandle handle = engine.watch("alice")) {
 *     Operation next;
 *     while ((next = handle.next(30, TimeUnit.SECONDS)) != null) {
 *         send(next);
 *     }
 * }
 * </pre>
 *
 * <p>한 스레드에서만 소비해야 합니다. 전송 실패 시 {@link #close()}로 구독을 해제합니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class WatchHandle implements AutoCloseable {

    private final Deque<Operation> initial;
    private final OperationWatch watch;

    /**
     * 생성자 (엔진 내부에서만 사용).
     *
     * @param initial 초기 단계에 내보낼 Operation
     * @param watch 실시간 단계 수신 핸들
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    WatchHandle(List<Operation> initial, OperationWatch watch) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        if (watch == null) {
            throw new IllegalArgumentException("watch cannot be null");
        }
        this.initial = new ArrayDeque<>(initial);
        this.watch = watch;
    }

    /**
     * 다음 Operation.
     *
     * @param timeout 실시간 단계의 최대 대기 시간
     * @param unit 시간 단위
     * @return 다음 Operation, 시간 초과 또는 닫힌 경우 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public Operation next(long timeout, TimeUnit unit) throws InterruptedException {
        Operation pending = initial.pollFirst();
        if (pending != null) {
            return pending;
        }
        return watch.poll(timeout, unit);
    }

    /**
     * 초기 단계에서 아직 내보내지 않은 Operation 수.
     *
     * @return 남은 수
     */
    public int remainingInitial() {
        return initial.size();
    }

    /**
     * 버퍼 초과로 놓친 실시간 이벤트 수.
     *
     * @return 누적 drop 수
     */
    public long droppedCount() {
        return watch.droppedCount();
    }

    public boolean isOpen() {
        return watch.isOpen();
    }

    @Override
    public void close() {
        initial.clear();
        watch.close();
    }

    @Override
    public String toString() {
        return "WatchHandle{remainingInitial=" + initial.size() + ", open=" + watch.isOpen()
            + ", dropped=" + watch.droppedCount() + "}";
    }
}
