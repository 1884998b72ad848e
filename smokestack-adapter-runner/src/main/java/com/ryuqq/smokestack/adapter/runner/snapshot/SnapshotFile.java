package com.ryuqq.smokestack.adapter.runner.snapshot;

import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import com.ryuqq.smokestack.core.spi.SnapshotCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 스냅샷 파일 입출력.
 *
 * <p>쓰기는 같은 디렉터리의 임시 파일에 먼저 쓴 뒤 원자적 이동으로 교체하므로,
 * 저장 도중 프로세스가 종료되어도 이전 스냅샷이 손상되지 않습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class SnapshotFile {

    private static final Logger log = LoggerFactory.getLogger(SnapshotFile.class);

    private final Path path;
    private final SnapshotCodec codec;

    /**
     * 생성자.
     *
     * @param path 스냅샷 파일 경로
     * @param codec 직렬화 codec
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public SnapshotFile(Path path, SnapshotCodec codec) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.path = path;
        this.codec = codec;
    }

    /**
     * 스냅샷 읽기.
     *
     * @return 스냅샷, 파일이 없으면 empty
     * @throws IOException 읽기 또는 해석 실패 시
     */
    public Optional<EntitySnapshot> read() throws IOException {
        if (!Files.exists(path)) {
            log.info("No snapshot file at {}, starting empty", path);
            return Optional.empty();
        }
        EntitySnapshot snapshot = codec.decode(Files.readAllBytes(path));
        log.info("Snapshot loaded from {}: operations={}", path, snapshot.operations().size());
        return Optional.of(snapshot);
    }

    /**
     * 스냅샷 쓰기 (임시 파일 + 원자적 이동).
     *
     * @param snapshot 저장할 스냅샷
     * @throws IOException 직렬화 또는 쓰기 실패 시
     */
    public void write(EntitySnapshot snapshot) throws IOException {
        byte[] blob = codec.encode(snapshot);
        Path absolute = path.toAbsolutePath();
        Path directory = absolute.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, blob);
            try {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", absolute);
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Snapshot written to {} ({} bytes)", absolute, blob.length);
    }

    public Path path() {
        return path;
    }
}
