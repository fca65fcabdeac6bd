package io.hhplus.storefront.application.cart.dto;

import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartStatus;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

public record CartResponse(
    Long cartId,
    Long customerId,
    String sessionToken,
    CartStatus status,
    List<CartItemResponse> items,
    String couponCode,
    long subtotalCents,
    long discountCents,
    long shippingCents,
    long taxCents,
    long grandTotalCents,
    LocalDateTime expiresAt
) {
    public static CartResponse from(Cart cart) {
        return new CartResponse(
            cart.getId(),
            cart.getCustomerId(),
            cart.getSessionToken(),
            cart.getStatus(),
            cart.getItems().stream()
                .sorted(Comparator.comparing(item -> item.getId() == null ? Long.MAX_VALUE : item.getId()))
                .map(CartItemResponse::from)
                .toList(),
            cart.getCouponCode(),
            cart.getSubtotal(),
            cart.getDiscountAmount(),
            cart.getShippingTotal(),
            cart.getTaxTotal(),
            cart.getGrandTotal(),
            cart.getExpiresAt()
        );
    }
}
