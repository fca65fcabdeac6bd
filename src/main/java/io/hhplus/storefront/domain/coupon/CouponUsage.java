package io.hhplus.storefront.domain.coupon;

import io.hhplus.storefront.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 쿠폰 사용 기록
 *
 * (coupon_id, order_id) 유니크 제약으로 주문당 한 번만 기록된다.
 */
@Entity
@Table(
    name = "coupon_usages",
    uniqueConstraints = @UniqueConstraint(name = "uk_coupon_usage_order", columnNames = {"coupon_id", "order_id"}),
    indexes = @Index(name = "idx_coupon_usage_customer", columnList = "coupon_id, customer_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CouponUsage extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "coupon_id", nullable = false)
    private Long couponId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    public static CouponUsage of(Long tenantId, Long couponId, Long customerId, Long orderId) {
        CouponUsage usage = new CouponUsage();
        usage.tenantId = tenantId;
        usage.couponId = couponId;
        usage.customerId = customerId;
        usage.orderId = orderId;
        return usage;
    }
}
