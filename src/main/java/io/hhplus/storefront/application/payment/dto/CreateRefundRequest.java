package io.hhplus.storefront.application.payment.dto;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * @param amountCents 비우면 남은 금액 전액 환불
 */
public record CreateRefundRequest(
    @Positive(message = "환불 금액은 0보다 커야 합니다")
    Long amountCents,

    @Size(max = 200)
    String reason
) {
}
