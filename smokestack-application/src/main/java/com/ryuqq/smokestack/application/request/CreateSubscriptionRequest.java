package com.ryuqq.smokestack.application.request;

/**
 * 구독 생성 요청.
 *
 * <p>operation, component, tag 중 정확히 하나만 지정해야 합니다.</p>
 *
 * @param operation 구독할 Operation id (선택)
 * @param component 구독할 Component 이름 (선택)
 * @param tag 구독할 Tag 이름 (선택)
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
public record CreateSubscriptionRequest(Long operation, String component, String tag) {

    public static CreateSubscriptionRequest forOperation(long operation) {
        return new CreateSubscriptionRequest(operation, null, null);
    }

    public static CreateSubscriptionRequest forComponent(String component) {
        return new CreateSubscriptionRequest(null, component, null);
    }

    public static CreateSubscriptionRequest forTag(String tag) {
        return new CreateSubscriptionRequest(null, null, tag);
    }

    /**
     * 지정된 대상 수.
     *
     * @return 0~3
     */
    public int targetCount() {
        int count = 0;
        if (operation != null) {
            count++;
        }
        if (component != null) {
            count++;
        }
        if (tag != null) {
            count++;
        }
        return count;
    }
}
