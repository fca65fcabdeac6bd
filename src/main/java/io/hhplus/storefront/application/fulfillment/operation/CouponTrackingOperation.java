package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.domain.coupon.Coupon;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import io.hhplus.storefront.domain.coupon.CouponUsage;
import io.hhplus.storefront.domain.coupon.CouponUsageRepository;
import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 쿠폰 사용 집계
 *
 * 쿠폰 행을 잠근 뒤 (쿠폰, 주문) 사용 기록이 없을 때만 사용 횟수를 올린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CouponTrackingOperation implements SideEffectOperation<OrderOperationPayload> {

    private final OrderRepository orderRepository;
    private final CouponRepository couponRepository;
    private final CouponUsageRepository couponUsageRepository;

    @Override
    public OperationType type() {
        return OperationType.COUPON_TRACKING;
    }

    @Override
    public Class<OrderOperationPayload> payloadType() {
        return OrderOperationPayload.class;
    }

    @Override
    @Transactional
    public void execute(Long tenantId, OrderOperationPayload payload) {
        Order order = orderRepository.findByIdOrThrow(payload.orderId(), tenantId);
        if (order.getCouponCode() == null) {
            return;
        }

        Optional<Coupon> found = couponRepository.findByCodeForUpdate(tenantId, order.getCouponCode());
        if (found.isEmpty()) {
            // 주문 이후 쿠폰이 삭제된 경우. 재시도해도 결과가 같다
            log.warn("집계할 쿠폰이 없음: orderId={}, couponCode={}", order.getId(), order.getCouponCode());
            return;
        }
        Coupon coupon = found.get();

        if (couponUsageRepository.existsByCouponIdAndOrderId(coupon.getId(), order.getId())) {
            log.debug("이미 집계된 쿠폰 사용: couponId={}, orderId={}", coupon.getId(), order.getId());
            return;
        }

        coupon.increaseUsage();
        couponRepository.save(coupon);
        couponUsageRepository.save(CouponUsage.of(tenantId, coupon.getId(), order.getCustomerId(), order.getId()));

        log.info("쿠폰 사용 집계: couponCode={}, orderId={}, timesUsed={}",
            coupon.getCode(), order.getId(), coupon.getTimesUsed());
    }
}
