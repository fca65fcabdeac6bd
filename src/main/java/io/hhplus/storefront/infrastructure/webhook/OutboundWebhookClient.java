package io.hhplus.storefront.infrastructure.webhook;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 테넌트 웹훅 전송 클라이언트
 *
 * 헤더:
 * - X-Webhook-Signature: sha256=<hex hmac(secret, body)>
 * - X-Webhook-Event
 * - X-Webhook-Timestamp
 *
 * 2xx가 아니거나 I/O 오류면 WEBHOOK_DELIVERY_FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboundWebhookClient {

    private final RestClient webhookRestClient;

    public void deliver(String url, String secret, String event, String body, long timestampSeconds) {
        String signature = "sha256=" + HmacSigner.signHex(secret, body);
        try {
            ResponseEntity<Void> response = webhookRestClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", signature)
                .header("X-Webhook-Event", event)
                .header("X-Webhook-Timestamp", String.valueOf(timestampSeconds))
                .body(body)
                .retrieve()
                .toBodilessEntity();

            log.info("웹훅 전송 완료: url={}, event={}, status={}", url, event, response.getStatusCode().value());
        } catch (RestClientException e) {
            throw new BusinessException(
                ErrorCode.WEBHOOK_DELIVERY_FAILED,
                "웹훅 전송 실패: url=" + url + ", reason=" + e.getMessage(),
                e
            );
        }
    }
}
