package io.hhplus.storefront.application.fulfillment.listener;

import io.hhplus.storefront.application.fulfillment.FulfillmentSideEffectCoordinator;
import io.hhplus.storefront.domain.order.OrderConfirmedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 결제 확정 커밋 이후 후속 처리를 시작한다.
 *
 * AFTER_COMMIT: 확정 트랜잭션이 롤백되면 실행되지 않는다.
 * Async: 웹훅 응답을 후속 처리가 막지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderConfirmedEventListener {

    private final FulfillmentSideEffectCoordinator coordinator;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderConfirmed(OrderConfirmedEvent event) {
        try {
            coordinator.fulfill(event.getTenantId(), event.getOrderId(), event.getOrderNumber());
        } catch (Exception e) {
            // 개별 처리 실패는 코디네이터가 원장에 남긴다. 여기 도달하면 원장 기록 자체가 실패한 것
            log.error("후속 처리 조율 실패 (수동 확인 필요): orderId={}, orderNumber={}",
                event.getOrderId(), event.getOrderNumber(), e);
        }
    }
}
