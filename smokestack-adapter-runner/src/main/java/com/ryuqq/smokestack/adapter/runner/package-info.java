/**
 * Runner Adapter Layer - 스냅샷 영속화.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.adapter.runner.codec.JsonSnapshotCodec} - Jackson 기반 JSON codec</li>
 *   <li>{@link com.ryuqq.smokestack.adapter.runner.snapshot.SnapshotFile} - 원자적 파일 교체</li>
 *   <li>{@link com.ryuqq.smokestack.adapter.runner.snapshot.SnapshotSaver} - 주기적 최선 노력 저장</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (SnapshotSaver, JsonSnapshotCodec)
 *   ↓ implements / uses
 * application (CoordinationEngine)
 *   ↓ depends on
 * core (EntitySnapshot, SnapshotCodec)
 * </pre>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
package com.ryuqq.smokestack.adapter.runner;
