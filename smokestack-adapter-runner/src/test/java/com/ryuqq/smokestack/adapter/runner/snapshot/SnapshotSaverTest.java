package com.ryuqq.smokestack.adapter.runner.snapshot;

import com.ryuqq.smokestack.application.engine.CoordinationEngine;
import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * SnapshotSaver 유닛 테스트.
 *
 * <ul>
 *   <li>save 성공: 엔진 스냅샷을 파일에 기록</li>
 *   <li>save 실패: 예외를 삼키지 않고 로그 후 false 반환</li>
 *   <li>start/shutdown: 주기 저장 후 종료 시 마지막 저장</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class SnapshotSaverTest {

    @Mock
    private CoordinationEngine engine;

    @Mock
    private SnapshotFile file;

    private SnapshotSaver saver;
    private final EntitySnapshot snapshot = EntitySnapshot.empty(1234L);

    @BeforeEach
    void setUp() {
        saver = new SnapshotSaver(engine, file, new SnapshotConfig().withSaveIntervalMs(20));
    }

    @Test
    void save_엔진_스냅샷을_파일에_기록() throws IOException {
        // given
        when(engine.snapshot()).thenReturn(snapshot);

        // when
        boolean saved = saver.save();

        // then
        assertThat(saved).isTrue();
        verify(file).write(snapshot);
    }

    @Test
    void save_쓰기_실패시_false_반환하고_계속_진행() throws IOException {
        // given
        when(engine.snapshot()).thenReturn(snapshot);
        when(file.path()).thenReturn(Path.of("state.json"));
        doThrow(new IOException("disk full")).doNothing().when(file).write(snapshot);

        // when & then
        assertThat(saver.save()).isFalse();
        assertThat(saver.save()).isTrue();
        verify(file, times(2)).write(snapshot);
    }

    @Test
    void start_주기적으로_저장하고_shutdown시_마지막_저장() throws Exception {
        // given
        when(engine.snapshot()).thenReturn(snapshot);
        when(file.path()).thenReturn(Path.of("state.json"));

        // when
        saver.start();
        verify(file, timeout(2000).atLeast(2)).write(snapshot);
        saver.shutdown();

        // then
        assertThat(saver.isRunning()).isFalse();
        verify(engine, atLeast(3)).snapshot();
    }

    @Test
    void start_두번_호출하면_예외() throws Exception {
        // given
        lenient().when(engine.snapshot()).thenReturn(snapshot);
        lenient().when(file.path()).thenReturn(Path.of("state.json"));
        saver.start();

        // when & then
        try {
            assertThatThrownBy(saver::start).isInstanceOf(IllegalStateException.class);
        } finally {
            saver.shutdown();
        }
    }

    @Test
    void constructor_null_의존성은_예외() {
        assertThatThrownBy(() -> new SnapshotSaver(null, file, new SnapshotConfig()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SnapshotSaver(engine, file, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void config_기본값과_검증() {
        SnapshotConfig config = new SnapshotConfig();

        assertThat(config.saveIntervalMs()).isEqualTo(10000L);
        assertThat(config.stateFile()).isEqualTo(Path.of("state.json"));
        assertThatThrownBy(() -> config.withSaveIntervalMs(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withStateFile(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
