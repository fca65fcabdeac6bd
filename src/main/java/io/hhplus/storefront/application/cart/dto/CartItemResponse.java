package io.hhplus.storefront.application.cart.dto;

import io.hhplus.storefront.domain.cart.CartItem;

public record CartItemResponse(
    Long cartItemId,
    Long productId,
    int quantity,
    int reservedQuantity,
    long unitPriceCents,
    long lineTotalCents
) {
    public static CartItemResponse from(CartItem item) {
        return new CartItemResponse(
            item.getId(),
            item.getProductId(),
            item.getQuantity(),
            item.getReservedQuantity(),
            item.getUnitPriceCents(),
            item.lineTotalCents()
        );
    }
}
