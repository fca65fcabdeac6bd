package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.domain.webhook.WebhookEndpoint;
import io.hhplus.storefront.domain.webhook.WebhookEndpointRepository;
import io.hhplus.storefront.infrastructure.webhook.OutboundWebhookClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 테넌트 웹훅 전송
 *
 * 비활성화되었거나 삭제된 엔드포인트는 성공으로 간주하고 건너뛴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookDeliveryOperation implements SideEffectOperation<WebhookDeliveryPayload> {

    private final WebhookEndpointRepository webhookEndpointRepository;
    private final OutboundWebhookClient outboundWebhookClient;
    private final Clock clock;

    @Override
    public OperationType type() {
        return OperationType.WEBHOOK_DELIVERY;
    }

    @Override
    public Class<WebhookDeliveryPayload> payloadType() {
        return WebhookDeliveryPayload.class;
    }

    @Override
    public void execute(Long tenantId, WebhookDeliveryPayload payload) {
        WebhookEndpoint endpoint = webhookEndpointRepository.findById(payload.endpointId()).orElse(null);
        if (endpoint == null || !endpoint.isActive() || !endpoint.getTenantId().equals(tenantId)) {
            log.info("웹훅 엔드포인트 비활성 또는 없음, 전송 생략: endpointId={}", payload.endpointId());
            return;
        }

        outboundWebhookClient.deliver(
            endpoint.getUrl(),
            endpoint.getSecret(),
            payload.event(),
            payload.body(),
            clock.instant().getEpochSecond()
        );
    }
}
