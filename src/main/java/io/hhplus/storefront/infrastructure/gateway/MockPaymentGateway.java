package io.hhplus.storefront.infrastructure.gateway;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 개발/테스트용 게이트웨이
 *
 * 멱등 키에서 결정적으로 ID를 만든다. 같은 키로 두 번 호출하면 같은 인텐트가 돌아온다.
 * 결제 결과는 웹훅 엔드포인트로 직접 이벤트를 보내 시뮬레이션한다.
 */
@Slf4j
@Component
@Profile("!prod")
public class MockPaymentGateway implements PaymentGateway {

    private final Map<String, PaymentIntent> intentsByKey = new ConcurrentHashMap<>();
    private final Map<String, PaymentIntent> intentsById = new ConcurrentHashMap<>();
    private final Map<String, RefundResult> refundsByKey = new ConcurrentHashMap<>();

    @Override
    public PaymentIntent createPaymentIntent(long amountCents, String currency, Map<String, String> metadata,
                                             String idempotencyKey) {
        if (amountCents <= 0) {
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, "결제 금액은 0보다 커야 합니다");
        }
        PaymentIntent intent = intentsByKey.computeIfAbsent(idempotencyKey, key -> {
            String id = "pi_" + deterministicId(key);
            return new PaymentIntent(id, id + "_secret", amountCents, currency.toLowerCase(), "requires_payment_method");
        });
        intentsById.putIfAbsent(intent.id(), intent);
        log.debug("[MockGateway] payment intent: key={}, id={}", idempotencyKey, intent.id());
        return intent;
    }

    @Override
    public PaymentIntent retrievePaymentIntent(String paymentIntentId) {
        PaymentIntent intent = intentsById.get(paymentIntentId);
        if (intent == null) {
            throw new BusinessException(ErrorCode.PAYMENT_GATEWAY_ERROR, "No such payment_intent: " + paymentIntentId);
        }
        return intent;
    }

    @Override
    public PaymentIntent cancelPaymentIntent(String paymentIntentId) {
        PaymentIntent intent = retrievePaymentIntent(paymentIntentId);
        PaymentIntent cancelled = new PaymentIntent(
            intent.id(), intent.clientSecret(), intent.amountCents(), intent.currency(), "canceled"
        );
        intentsById.put(paymentIntentId, cancelled);
        return cancelled;
    }

    @Override
    public RefundResult createRefund(String paymentIntentId, Long amountCents, String reason, String idempotencyKey) {
        PaymentIntent intent = retrievePaymentIntent(paymentIntentId);
        return refundsByKey.computeIfAbsent(idempotencyKey, key -> new RefundResult(
            "re_" + deterministicId(key),
            paymentIntentId,
            amountCents != null ? amountCents : intent.amountCents(),
            "pending"
        ));
    }

    private String deterministicId(String key) {
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString().replace("-", "");
    }
}
