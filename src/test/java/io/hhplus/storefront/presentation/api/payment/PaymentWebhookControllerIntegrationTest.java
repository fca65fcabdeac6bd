package io.hhplus.storefront.presentation.api.payment;

import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.infrastructure.webhook.WebhookSignatureVerifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@Import(TestContainersConfig.class)
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PaymentWebhookControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WebhookSignatureVerifier signatureVerifier;

    @Test
    @DisplayName("서명 없는 웹훅 - 400 PAY003")
    void receive_서명없음_400() throws Exception {
        mockMvc.perform(post("/api/payments/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"evt_x\",\"type\":\"payment_intent.succeeded\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("PAY003"));
    }

    @Test
    @DisplayName("처리 대상이 아닌 이벤트 - 200 IGNORED")
    void receive_관심없는이벤트_IGNORED() throws Exception {
        // Given
        String eventId = "evt_" + UUID.randomUUID();
        String body = "{\"id\":\"" + eventId + "\",\"type\":\"customer.created\",\"data\":{}}";
        String signature = signatureVerifier.sign(body, Instant.now().getEpochSecond());

        // When & Then
        mockMvc.perform(post("/api/payments/webhook")
                .header(PaymentWebhookController.SIGNATURE_HEADER, signature)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.received").value(true))
            .andExpect(jsonPath("$.eventId").value(eventId))
            .andExpect(jsonPath("$.outcome").value("IGNORED"));
    }

    @Test
    @DisplayName("주문을 찾을 수 없는 결제 성공 이벤트 - 200 ORDER_NOT_FOUND")
    void receive_주문없음_ORDER_NOT_FOUND() throws Exception {
        // Given
        String body = "{\"id\":\"evt_" + UUID.randomUUID() + "\",\"type\":\"payment_intent.succeeded\","
            + "\"data\":{\"paymentIntentId\":\"pi_unknown\",\"amount\":1000,\"currency\":\"usd\"}}";
        String signature = signatureVerifier.sign(body, Instant.now().getEpochSecond());

        // When & Then
        mockMvc.perform(post("/api/payments/webhook")
                .header(PaymentWebhookController.SIGNATURE_HEADER, signature)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("ORDER_NOT_FOUND"));
    }
}
