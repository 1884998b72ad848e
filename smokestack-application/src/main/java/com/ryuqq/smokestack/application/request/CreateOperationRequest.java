package com.ryuqq.smokestack.application.request;

import java.util.List;
import java.util.Map;

/**
 * Operation 생성 요청.
 *
 * <p>locks, tags, dependsOn, annotations는 생략 시 비어 있습니다.
 * operators가 비어 있으면 요청한 User가 담당자가 됩니다.
 * 상태는 항상 PLANNED로 생성됩니다.</p>
 *
 * <pre>
 * CreateOperationRequest request = CreateOperationRequest
 *     .of("Migrate users table", "Add index", "https://example.com/runbook", List.of("db"))
 *     .withLocks(List.of("db"));
 * </pre>
 *
 * @param title 제목
 * @param purpose 목적
 * @param url 관련 문서 URL
 * @param components 영향받는 Component 이름
 * @param locks 배타적 잠금이 필요한 Component 이름
 * @param tags Tag 이름
 * @param dependsOn 선행 Operation id
 * @param operators 담당 User 이름
 * @param annotations 자유 형식 주석
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record CreateOperationRequest(
    String title,
    String purpose,
    String url,
    List<String> components,
    List<String> locks,
    List<String> tags,
    List<Long> dependsOn,
    List<String> operators,
    Map<String, String> annotations
) {

    public CreateOperationRequest {
        components = components == null ? List.of() : components;
        locks = locks == null ? List.of() : locks;
        tags = tags == null ? List.of() : tags;
        dependsOn = dependsOn == null ? List.of() : dependsOn;
        operators = operators == null ? List.of() : operators;
        annotations = annotations == null ? Map.of() : annotations;
    }

    public static CreateOperationRequest of(String title, String purpose, String url, List<String> components) {
        return new CreateOperationRequest(title, purpose, url, components, null, null, null, null, null);
    }

    public CreateOperationRequest withTitle(String title) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }

    public CreateOperationRequest withLocks(List<String> locks) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }

    public CreateOperationRequest withTags(List<String> tags) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }

    public CreateOperationRequest withDependsOn(List<Long> dependsOn) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }

    public CreateOperationRequest withOperators(List<String> operators) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }

    public CreateOperationRequest withAnnotations(Map<String, String> annotations) {
        return new CreateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, annotations);
    }
}
