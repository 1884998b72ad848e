package com.ryuqq.smokestack.core.error;

/**
 * 엔진이 호출자에게 반환하는 오류 종류.
 *
 * <p>닫힌 집합으로 정의되어 전송 계층이 각 종류를 안정적인 상태 코드로 매핑할 수 있습니다.
 * {@link #statusCode()}는 HTTP 상태 코드 기준입니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** 인증 정보 없음. */
    MISSING_TOKEN(401),

    /** 인증 정보가 유효하지 않음. */
    INVALID_TOKEN(400),

    /** 참조한 엔티티가 존재하지 않음. */
    NOT_FOUND(404),

    /** 이미 존재하는 식별자로 생성 시도. */
    ALREADY_EXISTS(400),

    /** 필수 목록이 비어 있음. */
    MISSING_ITEM(400),

    /** 필수 문자열이 공백. */
    BLANK_ITEM(400),

    /** URL scheme이 http/https가 아님. */
    INVALID_URL_SCHEME(400),

    /** locks에 components 밖의 컴포넌트가 포함됨. */
    LOCKING_NON_AFFECTED_COMPONENT(400),

    /** 선행 Operation이 완료되지 않음. */
    UNMET_DEPENDENCY(424),

    /** 허용되지 않은 상태 전이. */
    INVALID_STATE_TRANSITION(400),

    /** 컴포넌트 잠금 획득 실패. */
    LOCK_FAILED(423),

    /** 구독 대상이 정확히 하나가 아님. */
    SUBSCRIBING_MULTIPLE_ENTITIES(400),

    /** 예상하지 못한 내부 오류. */
    INTERNAL(500);

    private final int statusCode;

    ErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * 전송 계층에서 사용할 상태 코드.
     *
     * @return HTTP 상태 코드
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * 호출자 측 오류인지 확인.
     *
     * @return 4xx 계열인 경우 true
     */
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
