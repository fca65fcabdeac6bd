package io.hhplus.storefront.domain.coupon;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * 쿠폰
 *
 * 적용(applyCoupon) 시점에는 검증만 하고 timesUsed는 증가시키지 않는다.
 * 사용 횟수는 결제 확정 후 CouponTrackingOperation에서만 증가한다.
 */
@Entity
@Table(
    name = "coupons",
    uniqueConstraints = @UniqueConstraint(name = "uk_coupon_tenant_code", columnNames = {"tenant_id", "code"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Coupon extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 50)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 20)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false)
    private long discountValue;

    @Column(name = "maximum_discount_cents")
    private Long maximumDiscountCents;

    @Column(name = "minimum_order_cents")
    private Long minimumOrderCents;

    @Column(name = "usage_limit")
    private Integer usageLimit;

    @Column(name = "per_customer_limit")
    private Integer perCustomerLimit;

    @Column(name = "times_used", nullable = false)
    private int timesUsed;

    @Column(name = "starts_at")
    private LocalDateTime startsAt;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    private boolean active;

    public static Coupon percentage(Long tenantId, String code, long percent) {
        if (percent <= 0 || percent > 100) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "할인율은 1~100 사이여야 합니다");
        }
        return create(tenantId, code, DiscountType.PERCENTAGE, percent);
    }

    public static Coupon fixedAmount(Long tenantId, String code, long amountCents) {
        if (amountCents <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "할인 금액은 0보다 커야 합니다");
        }
        return create(tenantId, code, DiscountType.FIXED_AMOUNT, amountCents);
    }

    private static Coupon create(Long tenantId, String code, DiscountType type, long value) {
        Coupon coupon = new Coupon();
        coupon.tenantId = tenantId;
        coupon.code = normalize(code);
        coupon.discountType = type;
        coupon.discountValue = value;
        coupon.timesUsed = 0;
        coupon.active = true;
        return coupon;
    }

    public Coupon withMinimumOrder(long minimumOrderCents) {
        this.minimumOrderCents = minimumOrderCents;
        return this;
    }

    public Coupon withMaximumDiscount(long maximumDiscountCents) {
        this.maximumDiscountCents = maximumDiscountCents;
        return this;
    }

    public Coupon withUsageLimits(Integer usageLimit, Integer perCustomerLimit) {
        this.usageLimit = usageLimit;
        this.perCustomerLimit = perCustomerLimit;
        return this;
    }

    public Coupon withValidity(LocalDateTime startsAt, LocalDateTime expiresAt) {
        this.startsAt = startsAt;
        this.expiresAt = expiresAt;
        return this;
    }

    public static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_COUPON, "쿠폰 코드는 필수입니다");
        }
        return code.trim().toUpperCase();
    }

    /**
     * 장바구니 적용 가능 여부 검증
     *
     * @param customerUsageCount 해당 고객의 기존 사용 횟수 (비회원이면 0)
     */
    public void validateApplicable(long subtotalCents, long customerUsageCount, LocalDateTime now) {
        if (!active) {
            throw new BusinessException(ErrorCode.INVALID_COUPON, "유효하지 않은 쿠폰입니다. code: " + code);
        }
        if (startsAt != null && startsAt.isAfter(now)) {
            throw new BusinessException(ErrorCode.COUPON_NOT_STARTED);
        }
        if (expiresAt != null && expiresAt.isBefore(now)) {
            throw new BusinessException(ErrorCode.EXPIRED_COUPON);
        }
        if (usageLimit != null && timesUsed >= usageLimit) {
            throw new BusinessException(ErrorCode.COUPON_USAGE_LIMIT_REACHED);
        }
        if (perCustomerLimit != null && customerUsageCount >= perCustomerLimit) {
            throw new BusinessException(
                ErrorCode.COUPON_USAGE_LIMIT_REACHED,
                "고객별 쿠폰 사용 한도에 도달했습니다. code: " + code
            );
        }
        if (minimumOrderCents != null && subtotalCents < minimumOrderCents) {
            throw new BusinessException(
                ErrorCode.COUPON_MINIMUM_NOT_MET,
                String.format("최소 주문 금액 %d센트 이상이어야 합니다. 현재: %d센트", minimumOrderCents, subtotalCents)
            );
        }
    }

    /**
     * 할인 금액 계산 (센트). 최대 할인액과 소계를 넘지 않는다.
     */
    public long calculateDiscount(long subtotalCents) {
        long discount = switch (discountType) {
            case PERCENTAGE -> BigDecimal.valueOf(subtotalCents)
                .multiply(BigDecimal.valueOf(discountValue))
                .divide(BigDecimal.valueOf(100), 0, RoundingMode.HALF_UP)
                .longValueExact();
            case FIXED_AMOUNT -> discountValue;
        };

        if (maximumDiscountCents != null) {
            discount = Math.min(discount, maximumDiscountCents);
        }
        return Math.min(discount, subtotalCents);
    }

    public void increaseUsage() {
        this.timesUsed++;
    }
}
