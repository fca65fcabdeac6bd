package io.hhplus.storefront.application.order;

import io.hhplus.storefront.application.checkout.CheckoutOrchestrator;
import io.hhplus.storefront.application.checkout.CheckoutTransactionService;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.application.usecase.UseCase;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.order.OrderStatus;
import lombok.RequiredArgsConstructor;

/**
 * 관리자 주문 상태 변경
 *
 * - PENDING → CONFIRMED 는 결제 웹훅으로만 일어난다.
 * - PENDING → CANCELLED 는 예약 해제가 필요하므로 체크아웃 취소 흐름을 탄다.
 * - 나머지는 상태 전이표만 검증한다.
 */
@UseCase
@RequiredArgsConstructor
public class OrderAdminService {

    private final CheckoutTransactionService checkoutTransactionService;
    private final CheckoutOrchestrator checkoutOrchestrator;
    private final OrderTransitionService orderTransitionService;

    public OrderResponse transitionStatus(Long tenantId, Long orderId, OrderStatus target) {
        OrderResponse current = checkoutTransactionService.loadOrder(tenantId, orderId);

        if (current.status() == OrderStatus.PENDING) {
            if (target == OrderStatus.CONFIRMED) {
                throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS, "결제 확정은 결제 완료 이벤트로만 처리됩니다");
            }
            if (target == OrderStatus.CANCELLED) {
                return checkoutOrchestrator.cancelCheckout(tenantId, orderId);
            }
        }
        return orderTransitionService.transition(tenantId, orderId, target);
    }
}
