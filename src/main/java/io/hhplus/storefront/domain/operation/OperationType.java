package io.hhplus.storefront.domain.operation;

/**
 * 재시도 가능한 후속 처리 종류
 */
public enum OperationType {
    STOCK_DEDUCTION,
    COUPON_TRACKING,
    NOTIFICATION,
    ORDER_EVENT_PUBLISH,
    WEBHOOK_DELIVERY
}
