package io.hhplus.storefront.common.exception;

/**
 * 에러 분류
 *
 * HTTP 상태 매핑과 재시도 가능 여부 판단에 사용한다.
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    INSUFFICIENT_STOCK,
    PAYMENT_GATEWAY,
    RETRYABLE_INFRASTRUCTURE,
    PERMANENT_FAILURE
}
