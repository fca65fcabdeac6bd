package io.hhplus.storefront.domain.cart;

/**
 * 장바구니 금액 (모두 센트 단위)
 */
public record CartTotals(
    long subtotal,
    long discount,
    long shipping,
    long tax,
    long grandTotal
) {
    public static CartTotals empty() {
        return new CartTotals(0L, 0L, 0L, 0L, 0L);
    }
}
