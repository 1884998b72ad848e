/**
 * In-memory {@link com.ryuqq.smokestack.core.spi.Broadcaster} with bounded, drop-oldest per-watcher buffers.
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.adapter.inmemory.broadcast;
