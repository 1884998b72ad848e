package com.ryuqq.smokestack.adapter.runner.snapshot;

import com.ryuqq.smokestack.adapter.runner.codec.JsonSnapshotCodec;
import com.ryuqq.smokestack.core.model.Tag;
import com.ryuqq.smokestack.core.model.User;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SnapshotFile 유닛 테스트.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class SnapshotFileTest {

    @TempDir
    Path tempDir;

    @Test
    void read_파일이_없으면_empty() throws IOException {
        // Given
        SnapshotFile file = new SnapshotFile(tempDir.resolve("state.json"), new JsonSnapshotCodec());

        // When & Then
        assertThat(file.read()).isEmpty();
    }

    @Test
    void write_후_read하면_같은_스냅샷() throws IOException {
        // Given
        SnapshotFile file = new SnapshotFile(tempDir.resolve("nested/state.json"), new JsonSnapshotCodec(true));
        EntitySnapshot snapshot = new EntitySnapshot(1300L, List.of(User.of("alice")), List.of(), List.of(),
            List.of(new Tag("urgent", "Needs attention")));

        // When
        file.write(snapshot);

        // Then
        assertThat(file.read()).contains(snapshot);
    }

    @Test
    void write_기존_파일을_교체하고_임시_파일을_남기지_않음() throws IOException {
        // Given
        Path path = tempDir.resolve("state.json");
        SnapshotFile file = new SnapshotFile(path, new JsonSnapshotCodec());
        file.write(EntitySnapshot.empty(1234L));

        // When
        file.write(EntitySnapshot.empty(2000L));

        // Then
        assertThat(file.read()).contains(EntitySnapshot.empty(2000L));
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries).containsExactly(path);
        }
    }

    @Test
    void read_손상된_파일이면_IOException() throws IOException {
        // Given
        Path path = tempDir.resolve("state.json");
        Files.writeString(path, "{broken");
        SnapshotFile file = new SnapshotFile(path, new JsonSnapshotCodec());

        // When & Then
        assertThatThrownBy(file::read).isInstanceOf(IOException.class);
    }

    @Test
    void constructor_null_파라미터는_예외() {
        assertThatThrownBy(() -> new SnapshotFile(null, new JsonSnapshotCodec()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnapshotFile(tempDir, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
