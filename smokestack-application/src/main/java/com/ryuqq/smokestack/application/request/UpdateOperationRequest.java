package com.ryuqq.smokestack.application.request;

import com.ryuqq.smokestack.application.validation.EntityValidator;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.statemachine.OperationState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Operation 부분 수정 요청.
 *
 * <p>null인 필드는 변경하지 않습니다. annotations는 교체하지 않고 기존 값 위에 병합합니다.</p>
 *
 * <pre>
 * engine.updateOperation(id, UpdateOperationRequest.empty().withStatus(OperationState.IN_PROGRESS));
 * </pre>
 *
 * @param title 제목 (선택)
 * @param purpose 목적 (선택)
 * @param url URL (선택)
 * @param components 영향받는 Component (선택)
 * @param locks 배타적 잠금 Component (선택)
 * @param tags Tag (선택)
 * @param dependsOn 선행 Operation id (선택)
 * @param operators 담당자 (선택)
 * @param status 새 상태 (선택)
 * @param annotations 병합할 주석 (null이면 빈 Map)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record UpdateOperationRequest(
    String title,
    String purpose,
    String url,
    List<String> components,
    List<String> locks,
    List<String> tags,
    List<Long> dependsOn,
    List<String> operators,
    OperationState status,
    Map<String, String> annotations
) {

    private static final UpdateOperationRequest EMPTY =
        new UpdateOperationRequest(null, null, null, null, null, null, null, null, null, null);

    public UpdateOperationRequest {
        annotations = annotations == null ? Map.of() : annotations;
    }

    /**
     * 아무것도 변경하지 않는 요청.
     *
     * @return 빈 요청
     */
    public static UpdateOperationRequest empty() {
        return EMPTY;
    }

    /**
     * 상태만 변경하는 요청.
     *
     * @param status 새 상태
     * @return 요청
     */
    public static UpdateOperationRequest status(OperationState status) {
        return EMPTY.withStatus(status);
    }

    /**
     * 현재 값에 요청을 적용한 초안 생성 (검증 전).
     *
     * @param current 저장된 Operation
     * @return 병합된 Operation
     */
    public Operation applyTo(Operation current) {
        Operation draft = current;
        if (title != null) {
            draft = draft.withTitle(title);
        }
        if (purpose != null) {
            draft = draft.withPurpose(purpose);
        }
        if (url != null) {
            draft = draft.withUrl(EntityValidator.parseUrl(url));
        }
        if (components != null) {
            draft = draft.withComponents(EntityValidator.normalizeNames("components", components));
        }
        if (locks != null) {
            draft = draft.withLocks(EntityValidator.normalizeNames("locks", locks));
        }
        if (tags != null) {
            draft = draft.withTags(EntityValidator.normalizeNames("tags", tags));
        }
        if (dependsOn != null) {
            draft = draft.withDependsOn(EntityValidator.normalizeIds(dependsOn));
        }
        if (operators != null) {
            draft = draft.withOperators(EntityValidator.normalizeNames("operators", operators));
        }
        if (status != null) {
            draft = draft.withStatus(status);
        }
        if (!annotations.isEmpty()) {
            Map<String, String> merged = new HashMap<>(draft.annotations());
            merged.putAll(annotations);
            draft = draft.withAnnotations(merged);
        }
        return draft;
    }

    public UpdateOperationRequest withTitle(String title) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withPurpose(String purpose) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withUrl(String url) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withComponents(List<String> components) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withLocks(List<String> locks) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withTags(List<String> tags) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withDependsOn(List<Long> dependsOn) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withOperators(List<String> operators) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withStatus(OperationState status) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }

    public UpdateOperationRequest withAnnotations(Map<String, String> annotations) {
        return new UpdateOperationRequest(title, purpose, url, components, locks, tags, dependsOn, operators, status, annotations);
    }
}
