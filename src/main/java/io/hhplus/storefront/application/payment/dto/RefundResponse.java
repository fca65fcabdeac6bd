package io.hhplus.storefront.application.payment.dto;

/**
 * 환불 요청 접수 결과. 주문 상태는 환불 웹훅이 도착해야 바뀐다.
 */
public record RefundResponse(
    Long orderId,
    String refundId,
    long amountCents,
    String status,
    String idempotencyKey
) {
}
