package com.ryuqq.smokestack.core.spi;

import java.util.Optional;

/**
 * Bearer 인증 정보 발급/해석 SPI.
 *
 * <p>엔진은 "인증 정보 → 사용자 이름" 해석 기능만 필요로 합니다.
 * 토큰 형식, 서명, 만료 정책은 구현체가 결정합니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public interface CredentialStore {

    /**
     * 사용자 이름에 묶인 새 인증 정보 발급.
     *
     * @param username 사용자 이름
     * @return 불투명한 bearer 토큰
     * @throws IllegalArgumentException username이 null 또는 공백인 경우
     */
    String issue(String username);

    /**
     * 인증 정보 해석.
     *
     * @param token bearer 토큰
     * @return 사용자 이름, 알 수 없는 토큰이면 empty
     */
    Optional<String> resolve(String token);
}
