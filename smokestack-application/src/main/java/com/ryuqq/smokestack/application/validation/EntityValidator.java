package com.ryuqq.smokestack.application.validation;

import com.ryuqq.smokestack.application.store.EntityStore;
import com.ryuqq.smokestack.core.error.SmokestackException;
import com.ryuqq.smokestack.core.model.Component;
import com.ryuqq.smokestack.core.model.Operation;
import com.ryuqq.smokestack.core.model.Tag;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * 엔티티 값 정규화 및 참조 무결성 검증.
 *
 * <p><strong>정규화 규칙:</strong></p>
 * <ul>
 *   <li>문자열 필드는 trim, 결과가 비면 BLANK_ITEM</li>
 *   <li>목록 필드는 각 원소 trim 후 정렬, 중복 제거</li>
 *   <li>필수 목록(components, operators, owners)이 비면 MISSING_ITEM</li>
 * </ul>
 *
 * <p><strong>참조 검증:</strong> 참조하는 Component, Tag, Operation, User가 저장소에 없으면 NOT_FOUND.</p>
 *
 * <p>모든 검사는 저장소를 변경하지 않으며, 실패 시 첫 번째 위반을 예외로 던집니다.
 * 검사 순서는 필드 선언 순서를 따릅니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class EntityValidator {

    private final EntityStore store;

    /**
     * 생성자.
     *
     * @param store 참조 검증에 사용할 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public EntityValidator(EntityStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * Component 정규화 및 검증.
     *
     * <p>이름 중복은 저장 시점에 검사합니다.</p>
     *
     * @param draft 요청 값
     * @return 정규화된 Component
     */
    public Component validateComponent(Component draft) {
        String name = requireText("name", draft.name());
        String description = requireText("description", draft.description());
        List<String> owners = requireNonEmpty("owner", normalizeNames("owners", draft.owners()));
        owners.forEach(store::user);
        return new Component(name, description, owners);
    }

    /**
     * Tag 정규화 및 검증.
     *
     * @param draft 요청 값
     * @return 정규화된 Tag
     */
    public Tag validateTag(Tag draft) {
        String name = requireText("name", draft.name());
        String description = requireText("description", draft.description());
        return new Tag(name, description);
    }

    /**
     * Operation 정규화 및 검증.
     *
     * <p>상태 전이, 선행 조건, 잠금 검사는 포함하지 않습니다.</p>
     *
     * @param draft 병합된 요청 값
     * @return 정규화된 Operation
     */
    public Operation validateOperation(Operation draft) {
        String title = requireText("title", draft.title());
        String purpose = requireText("purpose", draft.purpose());
        requireHttpScheme(draft.url());

        List<String> components = requireNonEmpty("component", normalizeNames("components", draft.components()));
        components.forEach(store::component);

        List<String> locks = normalizeNames("locks", draft.locks());
        if (!components.containsAll(locks)) {
            throw SmokestackException.lockingNonAffectedComponent();
        }

        List<String> tags = normalizeNames("tags", draft.tags());
        tags.forEach(store::tag);

        List<Long> dependsOn = normalizeIds(draft.dependsOn());
        dependsOn.forEach(store::operation);

        List<String> operators = requireNonEmpty("operator", normalizeNames("operators", draft.operators()));
        operators.forEach(store::user);

        return new Operation(draft.id(), title, purpose, draft.url(), components, locks, tags, dependsOn,
            operators, draft.status(), draft.annotations());
    }

    /**
     * 문자열 trim 후 공백 검사.
     *
     * @param field 필드 이름 (오류 상세 정보용)
     * @param value 값
     * @return trim된 값
     * @throws SmokestackException null 또는 공백인 경우 (BLANK_ITEM)
     */
    public static String requireText(String field, String value) {
        if (value == null) {
            throw SmokestackException.blankItem(field);
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw SmokestackException.blankItem(field);
        }
        return trimmed;
    }

    /**
     * URL 문자열 해석.
     *
     * @param raw URL 문자열
     * @return 해석된 URI
     * @throws SmokestackException 공백이거나 (BLANK_ITEM) 해석할 수 없는 경우 (INVALID_URL_SCHEME)
     */
    public static URI parseUrl(String raw) {
        String trimmed = requireText("url", raw);
        try {
            return new URI(trimmed);
        } catch (URISyntaxException e) {
            throw SmokestackException.invalidUrlScheme();
        }
    }

    private static void requireHttpScheme(URI url) {
        String scheme = url == null ? null : url.getScheme();
        if (scheme == null) {
            throw SmokestackException.invalidUrlScheme();
        }
        String lower = scheme.toLowerCase(Locale.ROOT);
        if (!lower.equals("http") && !lower.equals("https")) {
            throw SmokestackException.invalidUrlScheme();
        }
    }

    /**
     * 이름 목록 정규화 (trim, 정렬, 중복 제거).
     *
     * @param field 필드 이름
     * @param values 원본 목록 (null이면 빈 목록)
     * @return 정규화된 목록
     * @throws SmokestackException 항목이 null 또는 공백인 경우 (BLANK_ITEM)
     */
    public static List<String> normalizeNames(String field, Collection<String> values) {
        if (values == null) {
            return List.of();
        }
        TreeSet<String> normalized = new TreeSet<>();
        for (String value : values) {
            if (value == null || value.isBlank()) {
                throw SmokestackException.blankItem(field);
            }
            normalized.add(value.trim());
        }
        return new ArrayList<>(normalized);
    }

    /**
     * id 목록 정규화 (정렬, 중복 제거).
     *
     * @param values 원본 목록 (null이면 빈 목록)
     * @return 정규화된 목록
     */
    public static List<Long> normalizeIds(Collection<Long> values) {
        if (values == null) {
            return List.of();
        }
        TreeSet<Long> normalized = new TreeSet<>();
        for (Long value : values) {
            if (value == null) {
                throw SmokestackException.blankItem("depends_on");
            }
            normalized.add(value);
        }
        return new ArrayList<>(normalized);
    }

    private static <T> List<T> requireNonEmpty(String itemKind, List<T> values) {
        if (values.isEmpty()) {
            throw SmokestackException.missingItem(itemKind);
        }
        return values;
    }
}
