package io.hhplus.storefront.infrastructure.persistence.coupon;

import io.hhplus.storefront.domain.coupon.CouponUsage;
import io.hhplus.storefront.domain.coupon.CouponUsageRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public interface JpaCouponUsageRepository extends JpaRepository<CouponUsage, Long>, CouponUsageRepository {

    @Override
    CouponUsage save(CouponUsage usage);

    @Override
    long countByCouponIdAndCustomerId(Long couponId, Long customerId);

    @Override
    boolean existsByCouponIdAndOrderId(Long couponId, Long orderId);
}
