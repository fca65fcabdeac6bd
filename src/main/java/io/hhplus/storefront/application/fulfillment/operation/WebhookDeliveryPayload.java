package io.hhplus.storefront.application.fulfillment.operation;

/**
 * @param body 최초 시도 때 만든 본문. 재시도에도 같은 본문을 보낸다
 */
public record WebhookDeliveryPayload(
    Long endpointId,
    String event,
    String body
) {
}
