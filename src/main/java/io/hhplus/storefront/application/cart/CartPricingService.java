package io.hhplus.storefront.application.cart;

import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartPricingPolicy;
import io.hhplus.storefront.domain.cart.CartTotals;
import io.hhplus.storefront.domain.coupon.Coupon;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 장바구니 금액 재계산
 *
 * 연결된 쿠폰은 적용 시점에 검증되었으므로 여기서는 할인액만 다시 계산한다.
 * 쿠폰이 삭제되어 더 이상 없으면 할인 없이 계산한다.
 */
@Component
@RequiredArgsConstructor
public class CartPricingService {

    private final CartPricingPolicy pricingPolicy;
    private final CouponRepository couponRepository;

    public CartTotals reprice(Cart cart) {
        Coupon coupon = cart.getCouponCode() == null
            ? null
            : couponRepository.findByTenantIdAndCode(cart.getTenantId(), cart.getCouponCode()).orElse(null);

        CartTotals totals = pricingPolicy.calculate(cart.getItems(), coupon);
        cart.applyTotals(totals);
        return totals;
    }
}
