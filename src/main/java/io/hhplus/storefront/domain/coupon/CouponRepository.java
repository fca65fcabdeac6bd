package io.hhplus.storefront.domain.coupon;

import java.util.Optional;

public interface CouponRepository {

    Optional<Coupon> findByTenantIdAndCode(Long tenantId, String code);

    /**
     * 쿠폰 행을 배타 잠금으로 조회한다.
     * 동시 적용/사용 집계가 같은 쿠폰의 한도를 동시에 검사하지 못하도록 직렬화한다.
     */
    Optional<Coupon> findByCodeForUpdate(Long tenantId, String code);

    Optional<Coupon> findByIdForUpdate(Long id);

    Coupon save(Coupon coupon);
}
