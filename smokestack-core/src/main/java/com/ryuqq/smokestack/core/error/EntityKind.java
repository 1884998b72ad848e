package com.ryuqq.smokestack.core.error;

/**
 * 오류 메시지와 상세 정보에 사용되는 엔티티 종류.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public enum EntityKind {

    USER("user"),
    COMPONENT("component"),
    TAG("tag"),
    OPERATION("operation");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    /**
     * 소문자 표시 이름.
     *
     * @return 표시 이름 (예: {@code component})
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
