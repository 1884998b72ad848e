/**
 * Service Provider Interfaces for the coordination engine's external collaborators.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.core.spi.Broadcaster} - bounded, non-blocking fan-out of operation changes</li>
 *   <li>{@link com.ryuqq.smokestack.core.spi.OperationWatch} - per-subscriber receive handle</li>
 *   <li>{@link com.ryuqq.smokestack.core.spi.CredentialStore} - bearer credential issuance and resolution</li>
 *   <li>{@link com.ryuqq.smokestack.core.spi.SnapshotCodec} - entity graph serialization</li>
 * </ul>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Thread-safe: every method may be called from many request-handling threads</li>
 *   <li>Never block the engine's write path on network or disk I/O</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Smokestack Team
 */
package com.ryuqq.smokestack.core.spi;
