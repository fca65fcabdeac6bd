package io.hhplus.storefront.infrastructure.gateway;

public record RefundResult(
    String id,
    String paymentIntentId,
    long amountCents,
    String status
) {
}
