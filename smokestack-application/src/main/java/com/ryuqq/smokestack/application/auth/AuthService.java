package com.ryuqq.smokestack.application.auth;

import com.ryuqq.smokestack.application.engine.CoordinationEngine;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.User;
import com.ryuqq.smokestack.core.spi.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 인증 서비스.
 *
 * <p>엔진에 필요한 인증 기능은 "bearer 토큰 → 존재하는 User 이름" 하나뿐입니다.
 * 토큰 발급과 해석은 {@link CredentialStore}에 위임합니다.</p>
 *
 * <p><strong>토큰 해석 실패:</strong></p>
 * <ul>
 *   <li>토큰이 없거나 공백: MISSING_TOKEN</li>
 *   <li>알 수 없는 토큰: INVALID_TOKEN</li>
 *   <li>토큰에 묶인 User가 없음: NOT_FOUND</li>
 * </ul>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String BEARER_SCHEME = "Bearer";

    private final CoordinationEngine engine;
    private final CredentialStore credentials;

    /**
     * 생성자.
     *
     * @param engine User 저장소를 가진 엔진
     * @param credentials 토큰 발급/해석
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public AuthService(CoordinationEngine engine, CredentialStore credentials) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        this.engine = engine;
        this.credentials = credentials;
    }

    /**
     * 인증 후 토큰 발급. User가 없으면 생성합니다.
     *
     * @param username User 이름
     * @return bearer 토큰
     * @throws SmokestackException 이름이 공백인 경우 (BLANK_ITEM)
     */
    public String authenticate(String username) {
        User user = engine.ensureUser(username);
        String token = credentials.issue(user.name());
        log.info("Token issued: user={}", user.name());
        return token;
    }

    /**
     * Authorization 값 해석.
     *
     * <p>"Bearer" scheme이 있으면 제거합니다 (대소문자 구분 없음).</p>
     *
     * @param authorization Authorization 헤더 값 또는 토큰
     * @return 존재하는 User 이름
     * @throws SmokestackException MISSING_TOKEN, INVALID_TOKEN, NOT_FOUND
     */
    public String resolve(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw SmokestackException.missingToken();
        }
        String token = authorization.trim();
        if (hasBearerScheme(token)) {
            token = token.substring(BEARER_SCHEME.length()).trim();
        }
        if (token.isEmpty()) {
            throw SmokestackException.missingToken();
        }
        String username = credentials.resolve(token).orElseThrow(() -> {
            log.debug("Unknown token rejected");
            return SmokestackException.invalidToken();
        });
        return engine.getUser(username).name();
    }

    private static boolean hasBearerScheme(String value) {
        return value.regionMatches(true, 0, BEARER_SCHEME, 0, BEARER_SCHEME.length())
            && (value.length() == BEARER_SCHEME.length()
                || Character.isWhitespace(value.charAt(BEARER_SCHEME.length())));
    }
}
