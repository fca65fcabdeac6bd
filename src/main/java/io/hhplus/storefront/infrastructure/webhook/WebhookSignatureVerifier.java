package io.hhplus.storefront.infrastructure.webhook;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.config.StorefrontProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * 게이트웨이 웹훅 서명 검증
 *
 * 헤더 형식: {@code t=<unix seconds>,v1=<hex hmac>}
 * 서명 대상: {@code t + "." + rawBody}
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private final String secret;
    private final Duration tolerance;
    private final Clock clock;

    public WebhookSignatureVerifier(StorefrontProperties properties, Clock clock) {
        this.secret = properties.getPayment().getWebhookSecret();
        this.tolerance = properties.getPayment().getSignatureTolerance();
        this.clock = clock;
    }

    public void verify(String rawBody, String signatureHeader) {
        if (secret == null || secret.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "웹훅 시크릿이 설정되지 않았습니다");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "서명 헤더가 없습니다");
        }

        String timestamp = null;
        String signature = null;
        for (String part : signatureHeader.split(",")) {
            String[] pair = part.trim().split("=", 2);
            if (pair.length != 2) {
                continue;
            }
            if ("t".equals(pair[0])) {
                timestamp = pair[1];
            } else if ("v1".equals(pair[0])) {
                signature = pair[1];
            }
        }

        if (timestamp == null || signature == null) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "서명 헤더 형식이 올바르지 않습니다");
        }

        long signedAt;
        try {
            signedAt = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "서명 타임스탬프가 올바르지 않습니다", e);
        }

        long nowSeconds = clock.instant().getEpochSecond();
        if (Math.abs(nowSeconds - signedAt) > tolerance.getSeconds()) {
            log.warn("웹훅 서명 타임스탬프 허용 범위 초과: signedAt={}, now={}", signedAt, nowSeconds);
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, "서명 타임스탬프가 허용 범위를 벗어났습니다");
        }

        String expected = HmacSigner.signHex(secret, timestamp + "." + rawBody);
        if (!HmacSigner.matches(expected, signature)) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
    }

    /**
     * 테스트/모의 게이트웨이용 서명 헤더 생성
     */
    public String sign(String rawBody, long timestampSeconds) {
        String signature = HmacSigner.signHex(secret, timestampSeconds + "." + rawBody);
        return "t=" + timestampSeconds + ",v1=" + signature;
    }
}
