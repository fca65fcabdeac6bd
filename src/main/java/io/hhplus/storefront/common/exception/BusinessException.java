package io.hhplus.storefront.common.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 *
 * ErrorCode의 ErrorType으로 응답 상태와 재시도 가능 여부가 결정된다.
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage) {
        super(customMessage);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.errorCode = errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public ErrorType getType() {
        return errorCode.getType();
    }
}
