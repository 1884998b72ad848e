package com.ryuqq.smokestack.core.model;

import com.ryuqq.smokestack.core.statemachine.OperationState;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * 하나 이상의 Component에 영향을 주는 변경 작업.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 변경은 {@code withX} 메서드로 새 인스턴스를 만들고
 * 엔진의 검증된 upsert 경로로만 반영됩니다.</p>
 *
 * <p><strong>불변식 (엔진 검증 후):</strong></p>
 * <ul>
 *   <li>목록 필드는 trim, 정렬, 중복 제거된 상태</li>
 *   <li>locks ⊆ components</li>
 *   <li>components, operators는 비어 있지 않음</li>
 * </ul>
 *
 * <p>equals는 모든 필드를 비교하므로, 저장된 값과 다른지 여부로 변경 알림 필요성을 판단합니다.</p>
 *
 * @param id 서버가 할당한 식별자
 * @param title 제목
 * @param purpose 목적
 * @param url 관련 문서 URL (http/https)
 * @param components 영향받는 Component 이름
 * @param locks 배타적 접근이 필요한 Component 이름
 * @param tags Tag 이름
 * @param dependsOn 먼저 완료되어야 하는 Operation id
 * @param operators 담당 User 이름
 * @param status 현재 상태
 * @param annotations 자유 형식 주석 (수정 시 병합)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record Operation(
    long id,
    String title,
    String purpose,
    URI url,
    List<String> components,
    List<String> locks,
    List<String> tags,
    List<Long> dependsOn,
    List<String> operators,
    OperationState status,
    Map<String, String> annotations
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException status가 null인 경우
     */
    public Operation {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        components = components == null ? List.of() : List.copyOf(components);
        locks = locks == null ? List.of() : List.copyOf(locks);
        tags = tags == null ? List.of() : List.copyOf(tags);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        operators = operators == null ? List.of() : List.copyOf(operators);
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public Operation withTitle(String title) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withPurpose(String purpose) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withUrl(URI url) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withComponents(List<String> components) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withLocks(List<String> locks) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withTags(List<String> tags) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withDependsOn(List<Long> dependsOn) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withOperators(List<String> operators) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withStatus(OperationState status) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public Operation withAnnotations(Map<String, String> annotations) {
        return new Operation(id, title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }
}
