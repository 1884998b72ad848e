package com.ryuqq.smokestack.core.spi;

import com.ryuqq.smokestack.core.model.Operation;

import java.util.concurrent.TimeUnit;

/**
 * 한 구독자의 수신 핸들.
 *
 * <p>구독자마다 자신의 핸들과 전송 루프를 소유하며, 엔진의 쓰기 경로와 분리됩니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public interface OperationWatch extends AutoCloseable {

    /**
     * 다음 Operation 수신 (대기).
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 수신한 Operation, 시간 초과 또는 닫힌 경우 null
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    Operation poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 버퍼가 가득 차서 버려진 이벤트 수.
     *
     * @return 누적 drop 수
     */
    long droppedCount();

    boolean isOpen();

    /**
     * 구독 해제. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();
}
