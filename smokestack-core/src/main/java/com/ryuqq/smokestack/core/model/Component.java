package com.ryuqq.smokestack.core.model;

import java.util.List;

/**
 * Operation이 공유 또는 배타적으로 접근하는 이름 있는 자원.
 *
 * <p>생성 후 수정/삭제 불가.</p>
 *
 * @param name 고유 이름
 * @param description 설명
 * @param owners 소유 User 이름 (정렬, 중복 제거됨)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record Component(String name, String description, List<String> owners) {

    public Component {
        owners = owners == null ? List.of() : List.copyOf(owners);
    }
}
