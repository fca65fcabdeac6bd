package io.hhplus.storefront.application.fulfillment.operation;

/**
 * 주문 단위 후속 처리 페이로드
 */
public record OrderOperationPayload(
    Long orderId,
    String orderNumber
) {
}
