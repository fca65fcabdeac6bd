package io.hhplus.storefront.domain.coupon;

public interface CouponUsageRepository {

    CouponUsage save(CouponUsage usage);

    long countByCouponIdAndCustomerId(Long couponId, Long customerId);

    boolean existsByCouponIdAndOrderId(Long couponId, Long orderId);
}
