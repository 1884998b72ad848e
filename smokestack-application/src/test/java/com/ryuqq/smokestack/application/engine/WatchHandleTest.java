package com.ryuqq.smokestack.application.engine;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.spi.OperationWatch;
import com.ryuqq.smokestack.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * WatchHandle 유닛 테스트.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WatchHandleTest {

    @Mock
    private OperationWatch watch;

    private static Operation operation(long id) {
        return new Operation(id, "title", "purpose", URI.create("https://example.com"), List.of("db"),
            List.of(), List.of(), List.of(), List.of("alice"), OperationState.PLANNED, null);
    }

    @Test
    void next_초기_목록을_먼저_내보낸_후_실시간_수신() throws InterruptedException {
        // given
        Operation live = operation(1236L).withStatus(OperationState.IN_PROGRESS);
        when(watch.poll(5, TimeUnit.SECONDS)).thenReturn(live);
        WatchHandle handle = new WatchHandle(List.of(operation(1234L), operation(1235L)), watch);

        // when & then
        assertThat(handle.next(5, TimeUnit.SECONDS).id()).isEqualTo(1234L);
        assertThat(handle.remainingInitial()).isEqualTo(1);
        assertThat(handle.next(5, TimeUnit.SECONDS).id()).isEqualTo(1235L);
        assertThat(handle.next(5, TimeUnit.SECONDS)).isEqualTo(live);
        verify(watch, times(1)).poll(5, TimeUnit.SECONDS);
    }

    @Test
    void next_시간_초과면_null() throws InterruptedException {
        // given
        when(watch.poll(10, TimeUnit.MILLISECONDS)).thenReturn(null);
        WatchHandle handle = new WatchHandle(List.of(), watch);

        // when & then
        assertThat(handle.next(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void close_남은_초기_목록을_버리고_구독_해제() {
        // given
        WatchHandle handle = new WatchHandle(List.of(operation(1234L)), watch);

        // when
        handle.close();

        // then
        assertThat(handle.remainingInitial()).isZero();
        verify(watch).close();
    }

    @Test
    void droppedCount와_isOpen은_watch에_위임() {
        // given
        when(watch.droppedCount()).thenReturn(3L);
        when(watch.isOpen()).thenReturn(true);
        WatchHandle handle = new WatchHandle(List.of(), watch);

        // when & then
        assertThat(handle.droppedCount()).isEqualTo(3L);
        assertThat(handle.isOpen()).isTrue();
    }

    @Test
    void constructor_null_파라미터는_예외() {
        assertThatThrownBy(() -> new WatchHandle(null, watch))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WatchHandle(List.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
