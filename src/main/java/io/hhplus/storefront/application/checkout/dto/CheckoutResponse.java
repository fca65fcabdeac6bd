package io.hhplus.storefront.application.checkout.dto;

import io.hhplus.storefront.application.order.dto.OrderResponse;

/**
 * @param paymentInitialized 결제 인텐트가 준비되었는지. false면 조회 또는 재시도 시 복구된다.
 * @param clientSecret 클라이언트 결제 위젯용 시크릿 (없을 수 있음)
 */
public record CheckoutResponse(
    OrderResponse order,
    String paymentIntentId,
    String clientSecret,
    boolean paymentInitialized
) {
    public static CheckoutResponse withoutPayment(OrderResponse order) {
        return new CheckoutResponse(order, order.paymentIntentId(), null, order.paymentIntentId() != null);
    }
}
