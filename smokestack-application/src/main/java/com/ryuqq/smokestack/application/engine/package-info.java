/**
 * Smokestack Application Layer - 변경 작업 조정 엔진.
 *
 * <p>요청을 검증하고 상태 머신, 선행 조건, 컴포넌트 잠금을 거쳐 커밋한 뒤
 * 변경을 구독자에게 알립니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.smokestack.application.engine.CoordinationEngine} - 단일 읽기/쓰기 잠금 아래의 조정 엔진</li>
 *   <li>{@link com.ryuqq.smokestack.application.engine.WatchHandle} - 초기 목록 + 실시간 변경 스트림</li>
 *   <li>{@link com.ryuqq.smokestack.application.engine.EngineConfig} - 엔진 설정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 알림 전달과 인증은 core의 SPI로 분리</li>
 *   <li><strong>실패 원자성:</strong> 검증 실패 시 어떤 상태도 변경되지 않음</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
package com.ryuqq.smokestack.application.engine;
