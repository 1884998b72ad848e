package com.ryuqq.smokestack.adapter.runner.snapshot;

import com.ryuqq.smokestack.application.engine.CoordinationEngine;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 주기적 스냅샷 저장 컴포넌트.
 *
 * <p>엔진의 읽기 잠금 아래에서 스냅샷을 만들고, 파일 쓰기는 잠금 밖에서 수행합니다.</p>
 *
 * <p><strong>저장 시나리오:</strong></p>
 * <pre>
 * 1. start() → saveIntervalMs 주기로 save() 예약
 * 2. save() → engine.snapshot() (읽기 잠금) → SnapshotFile.write() (잠금 밖)
 * 3. 쓰기 실패 → 경고 로그, 다음 주기에 다시 시도
 * 4. shutdown() → 예약 중지 후 마지막으로 한 번 저장
 * </pre>
 *
 * <p>저장은 최선 노력(best-effort)입니다. 실패가 엔진의 쓰기 경로로 전파되지 않습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class SnapshotSaver {

    private static final Logger log = LoggerFactory.getLogger(SnapshotSaver.class);

    private final CoordinationEngine engine;
    private final SnapshotFile file;
    private final SnapshotConfig config;
    private ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param engine 저장할 엔진
     * @param file 스냅샷 파일
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SnapshotSaver(CoordinationEngine engine, SnapshotFile file, SnapshotConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.file = file;
        this.config = config;
    }

    /**
     * 현재 상태를 한 번 저장.
     *
     * @return 저장 성공 여부
     */
    public boolean save() {
        try {
            EntitySnapshot snapshot = engine.snapshot();
            file.write(snapshot);
            log.debug("Snapshot saved: operations={}", snapshot.operations().size());
            return true;
        } catch (Exception e) {
            log.warn("Failed to save snapshot to {}", file.path(), e);
            return false;
        }
    }

    /**
     * 주기적 저장 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("SnapshotSaver already started");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "smokestack-snapshot-saver");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::save, config.saveIntervalMs(), config.saveIntervalMs(),
            TimeUnit.MILLISECONDS);
        log.info("SnapshotSaver started: interval={}ms, file={}", config.saveIntervalMs(), file.path());
    }

    /**
     * 주기적 저장 중지 후 마지막으로 한 번 저장.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(config.saveIntervalMs(), TimeUnit.MILLISECONDS)) {
            log.warn("SnapshotSaver did not terminate in time, forcing shutdown");
            scheduler.shutdownNow();
        }
        scheduler = null;
        save();
        log.info("SnapshotSaver stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }
}
