package io.hhplus.storefront.domain.coupon;

public enum DiscountType {
    PERCENTAGE,    // discountValue = 할인율(%)
    FIXED_AMOUNT   // discountValue = 할인 금액(센트)
}
