package com.ryuqq.smokestack.adapter.runner.snapshot;

import java.nio.file.Path;

/**
 * SnapshotSaver 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>saveIntervalMs: 저장 주기 (기본 10000ms = 10초)</li>
 *   <li>stateFile: 스냅샷 파일 경로 (기본 state.json)</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 * @param saveIntervalMs 저장 주기 (밀리초, 양수여야 함)
 * @param stateFile 스냅샷 파일 경로
 */
public record SnapshotConfig(long saveIntervalMs, Path stateFile) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: saveIntervalMs=10000ms, stateFile=state.json</p>
     */
    public SnapshotConfig() {
        this(10000, Path.of("state.json"));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SnapshotConfig {
        if (saveIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "saveIntervalMs must be positive (current: " + saveIntervalMs + ")"
            );
        }
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile cannot be null");
        }
    }

    public SnapshotConfig withSaveIntervalMs(long saveIntervalMs) {
        return new SnapshotConfig(saveIntervalMs, this.stateFile);
    }

    public SnapshotConfig withStateFile(Path stateFile) {
        return new SnapshotConfig(this.saveIntervalMs, stateFile);
    }
}
