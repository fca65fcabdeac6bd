package io.hhplus.storefront.application.order.dto;

import io.hhplus.storefront.domain.order.OrderItem;

public record OrderItemResponse(
    Long orderItemId,
    Long productId,
    String sku,
    String name,
    int quantity,
    long unitPriceCents,
    long totalPriceCents
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
            item.getId(),
            item.getProductId(),
            item.getSku(),
            item.getName(),
            item.getQuantity(),
            item.getUnitPriceCents(),
            item.getTotalPriceCents()
        );
    }
}
