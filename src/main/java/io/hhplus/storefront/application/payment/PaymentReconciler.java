package io.hhplus.storefront.application.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.application.payment.dto.GatewayEvent;
import io.hhplus.storefront.application.payment.dto.ReconcileOutcome;
import io.hhplus.storefront.application.payment.dto.WebhookAckResponse;
import io.hhplus.storefront.application.usecase.UseCase;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import io.hhplus.storefront.infrastructure.webhook.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * 결제 웹훅 수신 UseCase
 *
 * 1. 원문 기준 서명 검증 (실패 시 400)
 * 2. 이벤트 파싱
 * 3. 정산 (이벤트 ID 단위로 정확히 한 번)
 *
 * 서명이 검증된 이벤트는 처리 결과와 관계없이 수신 확인을 돌려준다.
 * 게이트웨이 재전송은 DUPLICATE로 흡수된다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class PaymentReconciler {

    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentReconciliationService reconciliationService;
    private final ObjectMapper objectMapper;
    private final MetricsCollector metricsCollector;

    public WebhookAckResponse handleWebhook(String rawBody, String signatureHeader) {
        signatureVerifier.verify(rawBody, signatureHeader);
        GatewayEvent event = parse(rawBody);
        ReconcileOutcome outcome = reconcile(event);
        metricsCollector.recordPaymentEvent(event.type(), outcome.name());
        return WebhookAckResponse.of(event.id(), outcome);
    }

    ReconcileOutcome reconcile(GatewayEvent event) {
        try {
            ReconcileOutcome outcome = reconciliationService.reconcile(event);
            log.info("웹훅 정산 완료: eventId={}, type={}, outcome={}", event.id(), event.type(), outcome);
            return outcome;
        } catch (DataIntegrityViolationException e) {
            // 동시에 들어온 같은 이벤트. 먼저 커밋한 쪽이 처리했다
            log.info("중복 웹훅 이벤트: eventId={}", event.id());
            return ReconcileOutcome.DUPLICATE;
        }
    }

    private GatewayEvent parse(String rawBody) {
        GatewayEvent event;
        try {
            event = objectMapper.readValue(rawBody, GatewayEvent.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "웹훅 본문을 해석할 수 없습니다: " + e.getOriginalMessage());
        }
        if (event == null || event.id() == null || event.id().isBlank() || event.type() == null) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "웹훅 이벤트 ID 또는 타입이 없습니다");
        }
        return event;
    }
}
