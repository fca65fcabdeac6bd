package io.hhplus.storefront.infrastructure.gateway;

public record PaymentIntent(
    String id,
    String clientSecret,
    long amountCents,
    String currency,
    String status
) {
}
