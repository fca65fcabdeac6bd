package io.hhplus.storefront.presentation.common;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.common.exception.ErrorType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        HttpStatus status = mapErrorTypeToHttpStatus(e.getType());
        if (status.is5xxServerError()) {
            log.error("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage(), e);
        } else {
            log.warn("Business exception occurred: code={}, message={}", e.getCode(), e.getMessage());
        }

        ErrorResponse errorResponse = ErrorResponse.of(e.getCode(), e.getMessage(), isRetryable(e.getType()));
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        e.getBindingResult().getFieldErrors()
            .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        log.warn("Validation failed: {}", fieldErrors);
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            ErrorCode.INVALID_INPUT.getCode(),
            ErrorCode.INVALID_INPUT.getMessage(),
            false,
            fieldErrors
        ));
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingRequestHeaderException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(
            ErrorCode.INVALID_INPUT.getCode(),
            ErrorCode.INVALID_INPUT.getMessage(),
            false
        ));
    }

    /**
     * 잠금 대기 초과, 교착 상태 희생, 트랜잭션 타임아웃. 클라이언트가 다시 시도하면 된다.
     */
    @ExceptionHandler({
        PessimisticLockingFailureException.class,
        CannotAcquireLockException.class,
        TransactionTimedOutException.class,
        QueryTimeoutException.class
    })
    public ResponseEntity<ErrorResponse> handleLockFailure(Exception e) {
        log.warn("Lock or transaction timeout: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.of(
            ErrorCode.LOCK_ACQUISITION_FAILED.getCode(),
            ErrorCode.LOCK_ACQUISITION_FAILED.getMessage(),
            true
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);

        ErrorResponse errorResponse = ErrorResponse.of(
            ErrorCode.INTERNAL_SERVER_ERROR.getCode(),
            ErrorCode.INTERNAL_SERVER_ERROR.getMessage(),
            false
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private HttpStatus mapErrorTypeToHttpStatus(ErrorType errorType) {
        return switch (errorType) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, INSUFFICIENT_STOCK -> HttpStatus.CONFLICT;
            case PAYMENT_GATEWAY -> HttpStatus.BAD_GATEWAY;
            case RETRYABLE_INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERMANENT_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private boolean isRetryable(ErrorType errorType) {
        return errorType == ErrorType.PAYMENT_GATEWAY || errorType == ErrorType.RETRYABLE_INFRASTRUCTURE;
    }
}
