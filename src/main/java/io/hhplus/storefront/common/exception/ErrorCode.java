package io.hhplus.storefront.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 재고 관련 (S)
    // ====================================
    PRODUCT_NOT_FOUND("S001", "상품을 찾을 수 없습니다", ErrorType.NOT_FOUND),
    INSUFFICIENT_STOCK("S002", "재고가 부족합니다", ErrorType.INSUFFICIENT_STOCK),
    INVALID_QUANTITY("S003", "수량은 1 이상이어야 합니다", ErrorType.VALIDATION),

    // ====================================
    // 장바구니 관련 (CART)
    // ====================================
    CART_NOT_FOUND("CART001", "장바구니를 찾을 수 없습니다", ErrorType.NOT_FOUND),
    CART_ITEM_NOT_FOUND("CART002", "장바구니 상품을 찾을 수 없습니다", ErrorType.NOT_FOUND),
    CART_ALREADY_CONVERTED("CART003", "이미 주문으로 전환된 장바구니입니다", ErrorType.CONFLICT),
    CART_OWNERSHIP_MISMATCH("CART004", "장바구니 소유자가 일치하지 않습니다", ErrorType.CONFLICT),
    CART_EMPTY("CART005", "장바구니가 비어 있습니다", ErrorType.VALIDATION),

    // ====================================
    // 쿠폰 관련 (C)
    // ====================================
    INVALID_COUPON("C001", "유효하지 않은 쿠폰입니다", ErrorType.VALIDATION),
    COUPON_NOT_STARTED("C002", "아직 사용할 수 없는 쿠폰입니다", ErrorType.VALIDATION),
    EXPIRED_COUPON("C003", "만료된 쿠폰입니다", ErrorType.VALIDATION),
    COUPON_USAGE_LIMIT_REACHED("C004", "쿠폰 사용 한도에 도달했습니다", ErrorType.VALIDATION),
    COUPON_MINIMUM_NOT_MET("C005", "쿠폰 최소 주문 금액을 충족하지 않습니다", ErrorType.VALIDATION),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    ORDER_NOT_FOUND("O001", "주문을 찾을 수 없습니다", ErrorType.NOT_FOUND),
    INVALID_ORDER_STATUS("O002", "주문 상태가 올바르지 않습니다", ErrorType.CONFLICT),
    ORDER_NOT_CANCELLABLE("O003", "결제 대기 중인 주문만 취소할 수 있습니다", ErrorType.CONFLICT),
    CREDIT_LIMIT_EXCEEDED("O004", "신용 한도를 초과했습니다", ErrorType.VALIDATION),
    TENANT_NOT_FOUND("O005", "상점을 찾을 수 없습니다", ErrorType.NOT_FOUND),

    // ====================================
    // 결제 관련 (PAY)
    // ====================================
    PAYMENT_GATEWAY_ERROR("PAY001", "결제 게이트웨이 호출에 실패했습니다", ErrorType.PAYMENT_GATEWAY),
    PAYMENT_NOT_REFUNDABLE("PAY002", "환불할 수 없는 결제 상태입니다", ErrorType.CONFLICT),
    INVALID_WEBHOOK_SIGNATURE("PAY003", "웹훅 서명 검증에 실패했습니다", ErrorType.VALIDATION),
    INVALID_WEBHOOK_PAYLOAD("PAY004", "웹훅 본문을 해석할 수 없습니다", ErrorType.VALIDATION),

    // ====================================
    // 후처리 재시도 관련 (OP)
    // ====================================
    UNSUPPORTED_OPERATION("OP001", "지원하지 않는 후처리 작업입니다", ErrorType.PERMANENT_FAILURE),
    OPERATION_PERMANENTLY_FAILED("OP002", "후처리 작업이 최종 실패했습니다", ErrorType.PERMANENT_FAILURE),
    WEBHOOK_DELIVERY_FAILED("OP003", "웹훅 전송에 실패했습니다", ErrorType.RETRYABLE_INFRASTRUCTURE),
    NOTIFICATION_FAILED("OP004", "알림 발행에 실패했습니다", ErrorType.RETRYABLE_INFRASTRUCTURE),
    EVENT_PUBLISH_FAILED("OP005", "주문 이벤트 발행에 실패했습니다", ErrorType.RETRYABLE_INFRASTRUCTURE),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    INTERNAL_SERVER_ERROR("COMMON001", "서버 내부 오류가 발생했습니다", ErrorType.PERMANENT_FAILURE),
    INVALID_INPUT("COMMON002", "입력값이 올바르지 않습니다", ErrorType.VALIDATION),
    LOCK_ACQUISITION_FAILED("COMMON003", "잠금 획득에 실패했습니다. 잠시 후 다시 시도해주세요", ErrorType.RETRYABLE_INFRASTRUCTURE),
    DUPLICATE_REQUEST("COMMON004", "동일한 요청이 처리 중입니다", ErrorType.CONFLICT);

    private final String code;
    private final String message;
    private final ErrorType type;
}
