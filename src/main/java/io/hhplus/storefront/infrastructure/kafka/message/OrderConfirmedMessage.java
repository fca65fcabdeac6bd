package io.hhplus.storefront.infrastructure.kafka.message;

import io.hhplus.storefront.domain.order.Order;

import java.time.LocalDateTime;

/**
 * Kafka 주문 확정 메시지 DTO
 * - Kafka Topic: order-confirmed
 * - Producer: OrderEventProducer
 */
public record OrderConfirmedMessage(
    Long tenantId,
    Long orderId,
    String orderNumber,
    Long customerId,
    long grandTotalCents,
    String currency,
    LocalDateTime confirmedAt
) {
    public static OrderConfirmedMessage from(Order order) {
        return new OrderConfirmedMessage(
            order.getTenantId(),
            order.getId(),
            order.getOrderNumber(),
            order.getCustomerId(),
            order.getGrandTotalCents(),
            order.getCurrency(),
            order.getConfirmedAt()
        );
    }
}
