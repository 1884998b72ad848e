package com.ryuqq.smokestack.adapter.inmemory.broadcast;

/**
 * Configuration for {@link InMemoryBroadcaster} (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>capacity: per-watcher buffer size (default 1024). When a watcher's buffer is full
 *       the oldest pending event is dropped to make room.</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 * @param capacity per-watcher buffer size (must be positive)
 */
public record BroadcastConfig(int capacity) {

    /**
     * Default configuration: capacity=1024.
     */
    public BroadcastConfig() {
        this(1024);
    }

    public BroadcastConfig {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
    }

    public BroadcastConfig withCapacity(int capacity) {
        return new BroadcastConfig(capacity);
    }
}
