package io.hhplus.storefront.application.order.dto;

import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderStatus;
import io.hhplus.storefront.domain.order.PaymentStatus;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 조회 응답 (트랜잭션 안에서 만들어 지연 로딩 없이 전달한다)
 */
public record OrderResponse(
    Long orderId,
    Long tenantId,
    String orderNumber,
    Long cartId,
    Long customerId,
    String email,
    OrderStatus status,
    PaymentStatus paymentStatus,
    String paymentIntentId,
    String couponCode,
    long subtotalCents,
    long discountCents,
    long shippingCents,
    long taxCents,
    long grandTotalCents,
    long refundedCents,
    String currency,
    List<OrderItemResponse> items,
    LocalDateTime createdAt,
    LocalDateTime confirmedAt,
    LocalDateTime cancelledAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
            order.getId(),
            order.getTenantId(),
            order.getOrderNumber(),
            order.getCartId(),
            order.getCustomerId(),
            order.getEmail(),
            order.getStatus(),
            order.getPaymentStatus(),
            order.getPaymentIntentId(),
            order.getCouponCode(),
            order.getSubtotalCents(),
            order.getDiscountCents(),
            order.getShippingCents(),
            order.getTaxCents(),
            order.getGrandTotalCents(),
            order.getRefundedCents(),
            order.getCurrency(),
            order.getItems().stream().map(OrderItemResponse::from).toList(),
            order.getCreatedAt(),
            order.getConfirmedAt(),
            order.getCancelledAt()
        );
    }

    public boolean isAwaitingPayment() {
        return status == OrderStatus.PENDING && paymentStatus.isUnpaid();
    }
}
