package io.hhplus.storefront.domain.order;

/**
 * 주문의 결제 상태
 */
public enum PaymentStatus {
    PENDING,
    CAPTURED,
    FAILED,
    REFUNDED,
    PARTIALLY_REFUNDED;

    /**
     * 아직 대금을 받지 못한 상태 (신용 한도 노출액 계산 대상)
     */
    public boolean isUnpaid() {
        return this == PENDING || this == FAILED;
    }

    public boolean isRefundable() {
        return this == CAPTURED || this == PARTIALLY_REFUNDED;
    }
}
