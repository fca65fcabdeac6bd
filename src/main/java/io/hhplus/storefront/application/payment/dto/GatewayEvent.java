package io.hhplus.storefront.application.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 게이트웨이 웹훅 이벤트
 *
 * <pre>
 * {
 *   "id": "evt_123",
 *   "type": "payment_intent.succeeded",
 *   "data": {
 *     "paymentIntentId": "pi_abc",
 *     "chargeId": "ch_abc",
 *     "amount": 10824,
 *     "amountRefunded": 0,
 *     "currency": "usd",
 *     "metadata": { "tenantId": "1", "orderId": "42" }
 *   }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayEvent(
    String id,
    String type,
    GatewayEventData data
) {
    public static final String PAYMENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_FAILED = "payment_intent.payment_failed";
    public static final String CHARGE_REFUNDED = "charge.refunded";
}
