/**
 * 엔진 쓰기 요청 record.
 *
 * @author Smokestack Team
 * @since 1.0.0
 */
package com.ryuqq.smokestack.application.request;
