package io.hhplus.storefront.domain.cart;

import io.hhplus.storefront.domain.coupon.Coupon;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 장바구니 금액 계산 정책
 *
 * 부동소수점 오차를 피하기 위해 모든 금액을 센트 단위 정수로 계산한다.
 * <pre>
 * subtotal   = Σ(unitPriceCents × qty)
 * shipping   = subtotal >= freeThreshold ? 0 : flatRate
 * discount   = 쿠폰 할인 (최대 할인액, subtotal 초과 불가)
 * tax        = round((subtotal - discount) × taxRate)
 * grandTotal = subtotal - discount + shipping + tax
 * </pre>
 */
public class CartPricingPolicy {

    private final BigDecimal taxRate;
    private final long flatShippingCents;
    private final long freeShippingThresholdCents;

    public CartPricingPolicy(BigDecimal taxRate, long flatShippingCents, long freeShippingThresholdCents) {
        this.taxRate = taxRate;
        this.flatShippingCents = flatShippingCents;
        this.freeShippingThresholdCents = freeShippingThresholdCents;
    }

    public CartTotals calculate(List<CartItem> items, Coupon coupon) {
        if (items.isEmpty()) {
            return CartTotals.empty();
        }

        long subtotal = items.stream()
            .mapToLong(CartItem::lineTotalCents)
            .sum();

        long shipping = subtotal >= freeShippingThresholdCents ? 0L : flatShippingCents;
        long discount = coupon == null ? 0L : coupon.calculateDiscount(subtotal);
        long tax = BigDecimal.valueOf(subtotal - discount)
            .multiply(taxRate)
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();

        return new CartTotals(subtotal, discount, shipping, tax, subtotal - discount + shipping + tax);
    }
}
