package com.ryuqq.smokestack.application.request;

import java.util.List;

/**
 * Component 생성 요청.
 *
 * @param name 이름
 * @param description 설명
 * @param owners 소유 User 이름 (1개 이상)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record CreateComponentRequest(String name, String description, List<String> owners) {
}
