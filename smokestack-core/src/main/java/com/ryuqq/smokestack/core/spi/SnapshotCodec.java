package com.ryuqq.smokestack.core.spi;

import com.ryuqq.smokestack.core.snapshot.EntitySnapshot;

import java.io.IOException;

/**
 * 스냅샷 직렬화 SPI.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public interface SnapshotCodec {

    /**
     * 스냅샷을 바이트 배열로 직렬화.
     *
     * @param snapshot 스냅샷
     * @return 직렬화된 blob
     * @throws IOException 직렬화 실패 시
     */
    byte[] encode(EntitySnapshot snapshot) throws IOException;

    /**
     * 바이트 배열에서 스냅샷 복원.
     *
     * @param blob 직렬화된 blob
     * @return 스냅샷
     * @throws IOException 형식이 잘못된 경우
     */
    EntitySnapshot decode(byte[] blob) throws IOException;
}
