package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.application.inventory.StockLedger;
import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderItem;
import io.hhplus.storefront.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 예약 재고 확정 차감
 *
 * 주문번호를 재고 이동 참조로 쓰므로 이미 차감된 품목은 건너뛴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StockDeductionOperation implements SideEffectOperation<OrderOperationPayload> {

    private final OrderRepository orderRepository;
    private final StockLedger stockLedger;

    @Override
    public OperationType type() {
        return OperationType.STOCK_DEDUCTION;
    }

    @Override
    public Class<OrderOperationPayload> payloadType() {
        return OrderOperationPayload.class;
    }

    @Override
    @Transactional
    public void execute(Long tenantId, OrderOperationPayload payload) {
        Order order = orderRepository.findByIdOrThrow(payload.orderId(), tenantId);

        int committed = 0;
        for (OrderItem item : order.itemsInLockOrder()) {
            if (stockLedger.commitReservation(tenantId, item.getProductId(), item.getQuantity(), order.getOrderNumber())) {
                committed++;
            }
        }

        log.info("재고 확정 차감 완료: orderNumber={}, items={}, committed={}",
            order.getOrderNumber(), order.getItems().size(), committed);
    }
}
