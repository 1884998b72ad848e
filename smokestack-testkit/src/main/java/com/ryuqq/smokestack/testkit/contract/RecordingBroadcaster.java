package com.ryuqq.smokestack.testkit.contract;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.SubscriptionSet;
import com.ryuqq.smokestack.core.spi.Broadcaster;
import com.ryuqq.smokestack.core.spi.OperationWatch;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Broadcaster for contract tests that records every published operation.
 *
 * <p>Watches opened through {@link #open(SubscriptionSet)} are unbounded and never drop events,
 * so tests can assert on exact delivery.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public class RecordingBroadcaster implements Broadcaster {

    private final List<Operation> published = new CopyOnWriteArrayList<>();
    private final List<RecordingWatch> watches = new CopyOnWriteArrayList<>();

    @Override
    public void publish(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        published.add(operation);
        for (RecordingWatch watch : watches) {
            if (watch.filter.matches(operation)) {
                watch.queue.add(operation);
            }
        }
    }

    @Override
    public OperationWatch open(SubscriptionSet filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        RecordingWatch watch = new RecordingWatch(filter);
        watches.add(watch);
        return watch;
    }

    @Override
    public int watcherCount() {
        return watches.size();
    }

    /**
     * Returns every operation published so far, in publish order.
     *
     * @return copy of the published operations
     */
    public List<Operation> published() {
        return new ArrayList<>(published);
    }

    /**
     * Returns the ids of every published operation, in publish order.
     *
     * @return published ids
     */
    public List<Long> publishedIds() {
        List<Long> ids = new ArrayList<>();
        for (Operation operation : published) {
            ids.add(operation.id());
        }
        return ids;
    }

    /**
     * Clears recorded operations. Used for test cleanup.
     */
    public void clear() {
        published.clear();
    }

    private final class RecordingWatch implements OperationWatch {

        private final SubscriptionSet filter;
        private final LinkedBlockingQueue<Operation> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean open = new AtomicBoolean(true);

        private RecordingWatch(SubscriptionSet filter) {
            this.filter = filter;
        }

        @Override
        public Operation poll(long timeout, TimeUnit unit) throws InterruptedException {
            return open.get() ? queue.poll(timeout, unit) : null;
        }

        @Override
        public long droppedCount() {
            return 0;
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                watches.remove(this);
            }
        }
    }
}
