package com.ryuqq.smokestack.adapter.inmemory.broadcast;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.SubscriptionSet;
import com.ryuqq.smokestack.core.spi.OperationWatch;
import com.ryuqq.smokestack.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Unit tests for {@link InMemoryBroadcaster}.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
class InMemoryBroadcasterTest {

    private static Operation operation(long id, List<String> components, List<String> tags) {
        return new Operation(id, "title", "purpose", URI.create("https://example.com"), components,
            List.of(), tags, List.of(), List.of("alice"), OperationState.PLANNED, null);
    }

    @Test
    void publish_DeliversOnlyToMatchingWatchers() throws InterruptedException {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
        OperationWatch dbWatch = broadcaster.open(SubscriptionSet.empty().withComponent("db"));
        OperationWatch tagWatch = broadcaster.open(SubscriptionSet.empty().withTag("urgent"));
        OperationWatch idWatch = broadcaster.open(SubscriptionSet.empty().withOperation(1235L));

        // When
        broadcaster.publish(operation(1234L, List.of("db"), List.of()));
        broadcaster.publish(operation(1235L, List.of("api"), List.of("urgent")));

        // Then
        assertThat(dbWatch.poll(100, TimeUnit.MILLISECONDS).id()).isEqualTo(1234L);
        assertThat(dbWatch.poll(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(tagWatch.poll(100, TimeUnit.MILLISECONDS).id()).isEqualTo(1235L);
        assertThat(idWatch.poll(100, TimeUnit.MILLISECONDS).id()).isEqualTo(1235L);
    }

    @Test
    void publish_EmptyFilterReceivesNothing() throws InterruptedException {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
        OperationWatch watch = broadcaster.open(SubscriptionSet.empty());

        // When
        broadcaster.publish(operation(1234L, List.of("db"), List.of("urgent")));

        // Then
        assertThat(watch.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void publish_FullBufferDropsOldestAndCounts() throws InterruptedException {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster(new BroadcastConfig(2));
        OperationWatch slow = broadcaster.open(SubscriptionSet.empty().withComponent("db"));

        // When
        for (long id = 1234L; id < 1239L; id++) {
            broadcaster.publish(operation(id, List.of("db"), List.of()));
        }

        // Then
        assertThat(slow.droppedCount()).isEqualTo(3L);
        assertThat(slow.poll(100, TimeUnit.MILLISECONDS).id()).isEqualTo(1237L);
        assertThat(slow.poll(100, TimeUnit.MILLISECONDS).id()).isEqualTo(1238L);
    }

    @Test
    void publish_NeverBlocksOnStalledWatcher() {
        // Given: a watcher that never polls
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster(new BroadcastConfig(1));
        OperationWatch stalled = broadcaster.open(SubscriptionSet.empty().withComponent("db"));
        Operation operation = operation(1234L, List.of("db"), List.of());

        // When
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            for (int i = 0; i < 10_000; i++) {
                broadcaster.publish(operation);
            }
        });

        // Then
        assertThat(stalled.droppedCount()).isEqualTo(9_999L);
    }

    @Test
    void publish_PreservesOrderPerWatcher() throws InterruptedException {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
        OperationWatch watch = broadcaster.open(SubscriptionSet.empty().withComponent("db"));
        Operation planned = operation(1234L, List.of("db"), List.of());

        // When
        broadcaster.publish(planned);
        broadcaster.publish(planned.withStatus(OperationState.IN_PROGRESS));
        broadcaster.publish(planned.withStatus(OperationState.COMPLETED));

        // Then
        assertThat(watch.poll(100, TimeUnit.MILLISECONDS).status()).isEqualTo(OperationState.PLANNED);
        assertThat(watch.poll(100, TimeUnit.MILLISECONDS).status()).isEqualTo(OperationState.IN_PROGRESS);
        assertThat(watch.poll(100, TimeUnit.MILLISECONDS).status()).isEqualTo(OperationState.COMPLETED);
    }

    @Test
    void close_UnregistersAndIsIdempotent() throws InterruptedException {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
        OperationWatch watch = broadcaster.open(SubscriptionSet.empty().withComponent("db"));
        broadcaster.publish(operation(1234L, List.of("db"), List.of()));

        // When
        watch.close();
        watch.close();
        broadcaster.publish(operation(1235L, List.of("db"), List.of()));

        // Then
        assertThat(watch.isOpen()).isFalse();
        assertThat(broadcaster.watcherCount()).isZero();
        assertThat(watch.poll(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void poll_WakesUpWhenOperationIsPublished() throws Exception {
        // Given
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();
        OperationWatch watch = broadcaster.open(SubscriptionSet.empty().withComponent("db"));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch polling = new CountDownLatch(1);

        try {
            // When
            Future<Operation> received = executor.submit(() -> {
                polling.countDown();
                return watch.poll(5, TimeUnit.SECONDS);
            });
            assertThat(polling.await(5, TimeUnit.SECONDS)).isTrue();
            broadcaster.publish(operation(1234L, List.of("db"), List.of()));

            // Then
            assertThat(received.get(5, TimeUnit.SECONDS).id()).isEqualTo(1234L);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void invalidArguments_AreRejected() {
        InMemoryBroadcaster broadcaster = new InMemoryBroadcaster();

        assertThatThrownBy(() -> broadcaster.publish(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> broadcaster.open(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryBroadcaster(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BroadcastConfig(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("current: 0");
    }
}
