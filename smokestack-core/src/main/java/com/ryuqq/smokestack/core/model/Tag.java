package com.ryuqq.smokestack.core.model;

/**
 * Operation 분류용 태그.
 *
 * @param name 고유 이름
 * @param description 설명
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record Tag(String name, String description) {
}
