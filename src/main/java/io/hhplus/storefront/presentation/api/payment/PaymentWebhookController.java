package io.hhplus.storefront.presentation.api.payment;

import io.hhplus.storefront.application.payment.PaymentReconciler;
import io.hhplus.storefront.application.payment.dto.WebhookAckResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 결제 게이트웨이 웹훅 수신
 *
 * 서명은 원문 바이트 기준이므로 본문을 String 그대로 받는다.
 * 서명 오류는 400, 검증된 이벤트는 중복 여부와 관계없이 200.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
public class PaymentWebhookController {

    public static final String SIGNATURE_HEADER = "Gateway-Signature";

    private final PaymentReconciler paymentReconciler;

    @PostMapping("/webhook")
    public ResponseEntity<WebhookAckResponse> receive(
        @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
        @RequestBody String rawBody
    ) {
        return ResponseEntity.ok(paymentReconciler.handleWebhook(rawBody, signature));
    }
}
