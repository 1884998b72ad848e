package com.ryuqq.smokestack.application.request;

/**
 * Tag 생성 요청.
 *
 * @param name 이름
 * @param description 설명
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record CreateTagRequest(String name, String description) {
}
