package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.infrastructure.kafka.message.OrderConfirmedMessage;
import io.hhplus.storefront.infrastructure.kafka.producer.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * order-confirmed 이벤트 발행
 */
@Component
@RequiredArgsConstructor
public class OrderEventPublishOperation implements SideEffectOperation<OrderOperationPayload> {

    private final OrderRepository orderRepository;
    private final OrderEventProducer orderEventProducer;

    @Override
    public OperationType type() {
        return OperationType.ORDER_EVENT_PUBLISH;
    }

    @Override
    public Class<OrderOperationPayload> payloadType() {
        return OrderOperationPayload.class;
    }

    @Override
    @Transactional(readOnly = true)
    public void execute(Long tenantId, OrderOperationPayload payload) {
        orderEventProducer.publishOrderConfirmed(
            OrderConfirmedMessage.from(orderRepository.findByIdOrThrow(payload.orderId(), tenantId))
        );
    }
}
