package com.ryuqq.smokestack.core.spi;

import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.SubscriptionSet;

/**
 * Operation 변경 알림 fan-out SPI.
 *
 * <p>엔진은 Operation 변경이 커밋된 후, 저장소 잠금 밖에서 {@link #publish(Operation)}를 호출합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 스레드에서 동시에 호출 가능해야 함</li>
 *   <li>Non-blocking: publish는 느린 구독자 때문에 대기하거나 실패해서는 안 됨</li>
 *   <li>Bounded: 너무 뒤처진 구독자는 이벤트를 놓칠 수 있음 (쌓지 않고 버림)</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public interface Broadcaster {

    /**
     * 변경된 Operation을 매칭되는 모든 구독자에게 전달.
     *
     * <p>엔진은 커밋 순서를 지키기 위해 publish 잠금을 잡은 채 이 메서드를 호출합니다.
     * 다음 쓰기 요청은 자신의 쓰기 잠금을 잡은 채 같은 publish 잠금을 기다리므로,
     * 구현은 구독자의 소비를 기다리거나 I/O로 블로킹해서는 안 됩니다.
     * 블로킹되면 이후의 모든 쓰기와, 그 쓰기 잠금 뒤에 대기하는 조회까지 멈춥니다.</p>
     *
     * @param operation 커밋된 Operation
     */
    void publish(Operation operation);

    /**
     * 새 구독자 등록.
     *
     * <p>등록 이후 publish되고 filter와 매칭되는 Operation만 수신합니다.</p>
     *
     * @param filter 매칭 기준
     * @return 수신 핸들
     */
    OperationWatch open(SubscriptionSet filter);

    /**
     * 현재 열려 있는 구독자 수.
     *
     * @return 구독자 수
     */
    int watcherCount();
}
