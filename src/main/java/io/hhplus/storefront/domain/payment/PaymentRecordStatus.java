package io.hhplus.storefront.domain.payment;

public enum PaymentRecordStatus {
    CAPTURED,
    FAILED,
    REFUNDED,
    PARTIALLY_REFUNDED
}
