package io.hhplus.storefront.infrastructure.persistence.coupon;

import io.hhplus.storefront.domain.coupon.Coupon;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaCouponRepository extends JpaRepository<Coupon, Long>, CouponRepository {

    @Override
    Optional<Coupon> findByTenantIdAndCode(Long tenantId, String code);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT c FROM Coupon c WHERE c.tenantId = :tenantId AND c.code = :code")
    Optional<Coupon> findByCodeForUpdate(@Param("tenantId") Long tenantId, @Param("code") String code);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT c FROM Coupon c WHERE c.id = :id")
    Optional<Coupon> findByIdForUpdate(@Param("id") Long id);

    @Override
    Coupon save(Coupon coupon);
}
