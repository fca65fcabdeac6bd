package io.hhplus.storefront.application.fulfillment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.application.fulfillment.operation.CouponTrackingOperation;
import io.hhplus.storefront.application.fulfillment.operation.NotificationOperation;
import io.hhplus.storefront.application.fulfillment.operation.OrderEventPublishOperation;
import io.hhplus.storefront.application.fulfillment.operation.OrderOperationPayload;
import io.hhplus.storefront.application.fulfillment.operation.SideEffectOperation;
import io.hhplus.storefront.application.fulfillment.operation.StockDeductionOperation;
import io.hhplus.storefront.application.fulfillment.operation.WebhookDeliveryOperation;
import io.hhplus.storefront.application.fulfillment.operation.WebhookDeliveryPayload;
import io.hhplus.storefront.application.operation.FailedOperationService;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.domain.webhook.WebhookEndpoint;
import io.hhplus.storefront.domain.webhook.WebhookEndpointRepository;
import io.hhplus.storefront.infrastructure.kafka.message.OrderConfirmedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 결제 확정 후속 처리 조율
 *
 * 실행 순서:
 * 1. 재고 확정 차감
 * 2. 쿠폰 사용 집계
 * 3. 고객 알림
 * 4. order-confirmed Kafka 이벤트
 * 5. 테넌트 웹훅 (order.confirmed 구독 엔드포인트별)
 *
 * 각 처리는 서로 독립적이다. 하나가 실패해도 나머지는 계속 실행하고,
 * 실패한 처리만 재시도 원장에 남긴다. 이미 캡처된 결제는 되돌리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FulfillmentSideEffectCoordinator {

    public static final String ORDER_CONFIRMED_EVENT = "order.confirmed";
    static final String REFERENCE_ORDER = "ORDER";

    private final StockDeductionOperation stockDeductionOperation;
    private final CouponTrackingOperation couponTrackingOperation;
    private final NotificationOperation notificationOperation;
    private final OrderEventPublishOperation orderEventPublishOperation;
    private final WebhookDeliveryOperation webhookDeliveryOperation;
    private final FailedOperationService failedOperationService;
    private final OrderRepository orderRepository;
    private final WebhookEndpointRepository webhookEndpointRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void fulfill(Long tenantId, Long orderId, String orderNumber) {
        log.info("주문 확정 후속 처리 시작: orderId={}, orderNumber={}", orderId, orderNumber);
        OrderOperationPayload payload = new OrderOperationPayload(orderId, orderNumber);

        int failures = 0;
        failures += runOrRecord(stockDeductionOperation, tenantId, orderId, payload);
        failures += runOrRecord(couponTrackingOperation, tenantId, orderId, payload);
        failures += runOrRecord(notificationOperation, tenantId, orderId, payload);
        failures += runOrRecord(orderEventPublishOperation, tenantId, orderId, payload);

        // 본문을 만들 주문을 읽지 못하면 전송 대상도 알 수 없다. 예외는 리스너가 남긴다
        OrderConfirmedMessage message = OrderConfirmedMessage.from(orderRepository.findByIdOrThrow(orderId, tenantId));
        failures += deliverWebhooks(tenantId, orderId, message);

        log.info("주문 확정 후속 처리 종료: orderId={}, failures={}", orderId, failures);
    }

    private int deliverWebhooks(Long tenantId, Long orderId, OrderConfirmedMessage message) {
        int failures = 0;
        for (WebhookEndpoint endpoint : webhookEndpointRepository.findAllByTenantIdAndActiveTrue(tenantId)) {
            if (!endpoint.subscribes(ORDER_CONFIRMED_EVENT)) {
                continue;
            }
            WebhookDeliveryPayload payload = new WebhookDeliveryPayload(
                endpoint.getId(), ORDER_CONFIRMED_EVENT, webhookBody(message)
            );
            failures += runOrRecord(webhookDeliveryOperation, tenantId, orderId, payload);
        }
        return failures;
    }

    /**
     * @return 실패해서 원장에 기록했으면 1
     */
    private <P> int runOrRecord(SideEffectOperation<P> operation, Long tenantId, Long orderId, P payload) {
        try {
            operation.execute(tenantId, payload);
            return 0;
        } catch (Exception e) {
            log.error("후속 처리 실패, 재시도 원장 기록: type={}, orderId={}, error={}",
                operation.type(), orderId, e.getMessage(), e);
            failedOperationService.record(tenantId, operation.type(), REFERENCE_ORDER, orderId, payload, e.getMessage());
            return 1;
        }
    }

    private String webhookBody(OrderConfirmedMessage message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", ORDER_CONFIRMED_EVENT);
        body.put("payload", message);
        body.put("timestamp", clock.instant().toString());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("웹훅 본문 직렬화 실패: orderId=" + message.orderId(), e);
        }
    }
}
