package io.hhplus.storefront.infrastructure.gateway;

import java.util.Map;

/**
 * 외부 결제 게이트웨이 포트
 *
 * 모든 생성성 호출은 멱등 키를 받는다. 같은 키로 다시 호출하면 게이트웨이는
 * 새 객체를 만들지 않고 기존 결과를 돌려줘야 한다.
 * 호출 실패는 ErrorCode.PAYMENT_GATEWAY_ERROR BusinessException으로 알린다.
 */
public interface PaymentGateway {

    PaymentIntent createPaymentIntent(long amountCents, String currency, Map<String, String> metadata, String idempotencyKey);

    PaymentIntent retrievePaymentIntent(String paymentIntentId);

    PaymentIntent cancelPaymentIntent(String paymentIntentId);

    /**
     * @param amountCents null이면 전액 환불
     */
    RefundResult createRefund(String paymentIntentId, Long amountCents, String reason, String idempotencyKey);
}
