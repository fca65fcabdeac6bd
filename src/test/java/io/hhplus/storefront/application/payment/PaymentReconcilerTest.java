package io.hhplus.storefront.application.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.application.payment.dto.GatewayEvent;
import io.hhplus.storefront.application.payment.dto.ReconcileOutcome;
import io.hhplus.storefront.application.payment.dto.WebhookAckResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import io.hhplus.storefront.infrastructure.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentReconcilerTest {

    private static final String BODY = """
        {"id":"evt_1","type":"payment_intent.succeeded",
         "data":{"paymentIntentId":"pi_1","amount":5000,"currency":"usd","metadata":{"orderId":"42","tenantId":"1"}},
         "livemode":false}
        """;

    @Mock
    private WebhookSignatureVerifier signatureVerifier;

    @Mock
    private PaymentReconciliationService reconciliationService;

    @Mock
    private MetricsCollector metricsCollector;

    private PaymentReconciler paymentReconciler;

    @BeforeEach
    void setUp() {
        paymentReconciler = new PaymentReconciler(
            signatureVerifier, reconciliationService, new ObjectMapper(), metricsCollector
        );
    }

    @Test
    @DisplayName("정상 이벤트 - 정산 결과를 그대로 응답한다")
    void handleWebhook_성공() {
        // Given
        given(reconciliationService.reconcile(any(GatewayEvent.class))).willReturn(ReconcileOutcome.APPLIED);

        // When
        WebhookAckResponse response = paymentReconciler.handleWebhook(BODY, "t=1,v1=abc");

        // Then
        assertThat(response.received()).isTrue();
        assertThat(response.eventId()).isEqualTo("evt_1");
        assertThat(response.outcome()).isEqualTo(ReconcileOutcome.APPLIED);
        verify(metricsCollector).recordPaymentEvent("payment_intent.succeeded", "APPLIED");
    }

    @Test
    @DisplayName("동시 처리로 이벤트 ID 유니크 제약 위반 - DUPLICATE로 응답한다")
    void handleWebhook_동시중복_DUPLICATE() {
        // Given
        given(reconciliationService.reconcile(any(GatewayEvent.class)))
            .willThrow(new DataIntegrityViolationException("Duplicate entry 'evt_1'"));

        // When
        WebhookAckResponse response = paymentReconciler.handleWebhook(BODY, "t=1,v1=abc");

        // Then
        assertThat(response.outcome()).isEqualTo(ReconcileOutcome.DUPLICATE);
    }

    @Test
    @DisplayName("서명 검증 실패 - 본문을 해석하지 않는다")
    void handleWebhook_서명실패_예외발생() {
        // Given
        willThrow(new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE))
            .given(signatureVerifier).verify(BODY, "t=1,v1=bad");

        // When & Then
        assertThatThrownBy(() -> paymentReconciler.handleWebhook(BODY, "t=1,v1=bad"))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        verifyNoInteractions(reconciliationService);
    }

    @Test
    @DisplayName("JSON이 아닌 본문 - INVALID_WEBHOOK_PAYLOAD")
    void handleWebhook_잘못된본문_예외발생() {
        assertThatThrownBy(() -> paymentReconciler.handleWebhook("not-json", "t=1,v1=abc"))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_WEBHOOK_PAYLOAD);
    }

    @Test
    @DisplayName("이벤트 ID가 없는 본문 - INVALID_WEBHOOK_PAYLOAD")
    void handleWebhook_이벤트ID없음_예외발생() {
        assertThatThrownBy(() -> paymentReconciler.handleWebhook("{\"type\":\"charge.refunded\"}", "t=1,v1=abc"))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INVALID_WEBHOOK_PAYLOAD);
        verifyNoInteractions(reconciliationService);
    }
}
