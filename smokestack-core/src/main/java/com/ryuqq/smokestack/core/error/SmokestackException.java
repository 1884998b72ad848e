package com.ryuqq.smokestack.core.error;

import com.ryuqq.smokestack.core.statemachine.OperationState;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 엔진의 모든 검증 및 불변식 위반 오류.
 *
 * <p>{@link ErrorKind}와 구조화된 상세 정보({@link #details()})를 함께 전달합니다.
 * 메시지만으로 오류를 구분하지 않도록, 호출자는 {@link #kind()}로 분기해야 합니다.</p>
 *
 * <p><strong>상세 정보 키:</strong></p>
 * <ul>
 *   <li>NOT_FOUND, ALREADY_EXISTS: {@code entity}, {@code id}</li>
 *   <li>MISSING_ITEM: {@code kind}</li>
 *   <li>BLANK_ITEM: {@code field}</li>
 *   <li>LOCK_FAILED: {@code component}</li>
 *   <li>INVALID_STATE_TRANSITION: {@code from}, {@code to}</li>
 *   <li>UNMET_DEPENDENCY: {@code operation} (완료되지 않은 선행 Operation id)</li>
 * </ul>
 *
 * <p>엔진은 이 오류를 재시도하지 않습니다. 모든 검증은 변경 전에 수행되므로
 * 이 예외가 발생한 쓰기 요청은 저장소를 변경하지 않습니다.</p>
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public final class SmokestackException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final Map<String, String> details;

    private SmokestackException(ErrorKind kind, String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.details = Map.copyOf(details);
    }

    private static SmokestackException of(ErrorKind kind, String message, String... keyValues) {
        Map<String, String> details = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            details.put(keyValues[i], keyValues[i + 1]);
        }
        return new SmokestackException(kind, message, details, null);
    }

    public static SmokestackException missingToken() {
        return of(ErrorKind.MISSING_TOKEN, "no token provided");
    }

    public static SmokestackException invalidToken() {
        return of(ErrorKind.INVALID_TOKEN, "invalid token");
    }

    public static SmokestackException notFound(EntityKind entity, Object id) {
        return of(ErrorKind.NOT_FOUND, entity + " " + id + " not found",
            "entity", entity.label(), "id", String.valueOf(id));
    }

    public static SmokestackException alreadyExists(EntityKind entity, Object id) {
        return of(ErrorKind.ALREADY_EXISTS, entity + " " + id + " already exists",
            "entity", entity.label(), "id", String.valueOf(id));
    }

    public static SmokestackException missingItem(String itemKind) {
        return of(ErrorKind.MISSING_ITEM, "at least one " + itemKind + " is required", "kind", itemKind);
    }

    public static SmokestackException blankItem(String field) {
        return of(ErrorKind.BLANK_ITEM, field + " cannot be blank", "field", field);
    }

    public static SmokestackException invalidUrlScheme() {
        return of(ErrorKind.INVALID_URL_SCHEME, "url should have http or https scheme");
    }

    public static SmokestackException lockingNonAffectedComponent() {
        return of(ErrorKind.LOCKING_NON_AFFECTED_COMPONENT,
            "locked component must be one of the affected components");
    }

    public static SmokestackException unmetDependency(long dependencyId) {
        return of(ErrorKind.UNMET_DEPENDENCY,
            "Dependent operations must be completed before starting this operation",
            "operation", String.valueOf(dependencyId));
    }

    public static SmokestackException invalidStateTransition(OperationState from, OperationState to) {
        return of(ErrorKind.INVALID_STATE_TRANSITION, "invalid state transition",
            "from", from.wireName(), "to", to.wireName());
    }

    public static SmokestackException lockFailed(String component) {
        return of(ErrorKind.LOCK_FAILED, "failed to acquire lock on component " + component,
            "component", component);
    }

    public static SmokestackException subscribingMultipleEntities() {
        return of(ErrorKind.SUBSCRIBING_MULTIPLE_ENTITIES,
            "exactly one of operation, component, or tag must be specified");
    }

    public static SmokestackException internal(Throwable cause) {
        return new SmokestackException(ErrorKind.INTERNAL, "internal error", Map.of(), cause);
    }

    /**
     * 오류 종류 조회.
     *
     * @return 오류 종류 (non-null)
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * 구조화된 상세 정보 조회.
     *
     * @return 불변 Map (상세 정보가 없으면 빈 Map)
     */
    public Map<String, String> details() {
        return details;
    }

    /**
     * 상세 정보 단건 조회.
     *
     * @param key 상세 정보 키
     * @return 값, 없으면 null
     */
    public String detail(String key) {
        return details.get(key);
    }

    @Override
    public String toString() {
        return "SmokestackException{kind=" + kind + ", message=" + getMessage() + ", details=" + details + "}";
    }
}
