package io.hhplus.storefront.application.payment.dto;

import io.hhplus.storefront.domain.payment.Payment;
import io.hhplus.storefront.domain.payment.PaymentRecordStatus;

import java.time.LocalDateTime;

public record PaymentResponse(
    Long paymentId,
    Long orderId,
    long amountCents,
    String currency,
    PaymentRecordStatus status,
    String paymentIntentId,
    String chargeId,
    String errorCode,
    String errorMessage,
    LocalDateTime createdAt
) {
    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
            payment.getId(),
            payment.getOrderId(),
            payment.getAmountCents(),
            payment.getCurrency(),
            payment.getStatus(),
            payment.getPaymentIntentId(),
            payment.getChargeId(),
            payment.getErrorCode(),
            payment.getErrorMessage(),
            payment.getCreatedAt()
        );
    }
}
