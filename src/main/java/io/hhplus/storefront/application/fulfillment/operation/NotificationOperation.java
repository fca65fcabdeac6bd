package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.infrastructure.kafka.message.OrderNotificationMessage;
import io.hhplus.storefront.infrastructure.kafka.producer.NotificationProducer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 확정 고객 알림
 */
@Component
@RequiredArgsConstructor
public class NotificationOperation implements SideEffectOperation<OrderOperationPayload> {

    static final String ORDER_CONFIRMED_TEMPLATE = "order-confirmed";

    private final OrderRepository orderRepository;
    private final NotificationProducer notificationProducer;

    @Override
    public OperationType type() {
        return OperationType.NOTIFICATION;
    }

    @Override
    public Class<OrderOperationPayload> payloadType() {
        return OrderOperationPayload.class;
    }

    @Override
    @Transactional(readOnly = true)
    public void execute(Long tenantId, OrderOperationPayload payload) {
        Order order = orderRepository.findByIdOrThrow(payload.orderId(), tenantId);
        notificationProducer.send(new OrderNotificationMessage(
            tenantId,
            order.getId(),
            order.getOrderNumber(),
            ORDER_CONFIRMED_TEMPLATE,
            order.getEmail(),
            order.getPhone()
        ));
    }
}
