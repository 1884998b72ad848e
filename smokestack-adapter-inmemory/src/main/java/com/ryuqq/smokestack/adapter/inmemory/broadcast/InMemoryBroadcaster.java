package com.ryuqq.smokestack.adapter.inmemory.broadcast;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.SubscriptionSet;
import com.ryuqq.smokestack.core.spi.Broadcaster;
import com.ryuqq.smokestack.core.spi.OperationWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Broadcaster}.
 *
 * <p>Each watcher owns a bounded {@link ArrayBlockingQueue}. {@link #publish(Operation)} offers the
 * operation to every open watcher whose filter matches, and never blocks: when a watcher's queue
 * is full its oldest pending event is discarded and counted.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Watchers:</strong> CopyOnWriteArrayList&lt;Watch&gt; - publish iterates a stable snapshot</li>
 *   <li><strong>Buffer:</strong> ArrayBlockingQueue&lt;Operation&gt; per watcher, drop-oldest on overflow</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Broadcaster broadcaster = new InMemoryBroadcaster(new BroadcastConfig(256));
 * try (OperationWatch watch = broadcaster.open(user.subscriptions())) {
 *     Operation next = watch.poll(30, TimeUnit.SECONDS);
 * }
 * </pre>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public class InMemoryBroadcaster implements Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcaster.class);

    private final List<Watch> watchers = new CopyOnWriteArrayList<>();
    private final int capacity;

    /**
     * Creates a broadcaster with the default configuration.
     */
    public InMemoryBroadcaster() {
        this(new BroadcastConfig());
    }

    /**
     * Creates a broadcaster.
     *
     * @param config buffer configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryBroadcaster(BroadcastConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.capacity = config.capacity();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Watchers closed since the last publish are skipped</li>
     *   <li>Delivery to one watcher never waits on another</li>
     * </ul>
     */
    @Override
    public void publish(Operation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        int delivered = 0;
        for (Watch watch : watchers) {
            if (watch.isOpen() && watch.filter.matches(operation)) {
                watch.offer(operation);
                delivered++;
            }
        }
        log.debug("Operation {} broadcast to {} of {} watchers", operation.id(), delivered, watchers.size());
    }

    @Override
    public OperationWatch open(SubscriptionSet filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        Watch watch = new Watch(filter, capacity);
        watchers.add(watch);
        return watch;
    }

    @Override
    public int watcherCount() {
        return watchers.size();
    }

    private final class Watch implements OperationWatch {

        private final SubscriptionSet filter;
        private final ArrayBlockingQueue<Operation> buffer;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private final AtomicLong dropped = new AtomicLong();

        private Watch(SubscriptionSet filter, int capacity) {
            this.filter = filter;
            this.buffer = new ArrayBlockingQueue<>(capacity);
        }

        private void offer(Operation operation) {
            while (!buffer.offer(operation)) {
                if (buffer.poll() != null) {
                    long total = dropped.incrementAndGet();
                    log.warn("Watcher buffer full, dropped oldest event (total dropped: {})", total);
                }
            }
        }

        @Override
        public Operation poll(long timeout, TimeUnit unit) throws InterruptedException {
            if (!open.get()) {
                return null;
            }
            return buffer.poll(timeout, unit);
        }

        @Override
        public long droppedCount() {
            return dropped.get();
        }

        @Override
        public boolean isOpen() {
            return open.get();
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                watchers.remove(this);
                buffer.clear();
            }
        }
    }
}
