package io.hhplus.storefront.domain.order;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;

import java.util.Collection;
import java.util.Optional;

public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findByIdAndTenantId(Long id, Long tenantId);

    Optional<Order> findByIdForUpdate(Long id, Long tenantId);

    Optional<Order> findByTenantIdAndOrderNumber(Long tenantId, String orderNumber);

    Optional<Order> findByPaymentIntentIdForUpdate(String paymentIntentId);

    /**
     * 미결제 노출액: 취소되지 않았고 결제 상태가 PENDING/FAILED인 주문의 총액 합계
     */
    long sumUnpaidExposure(Long tenantId, Collection<Long> customerIds);

    default Order findByIdOrThrow(Long id, Long tenantId) {
        return findByIdAndTenantId(id, tenantId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다. orderId: " + id));
    }
}
