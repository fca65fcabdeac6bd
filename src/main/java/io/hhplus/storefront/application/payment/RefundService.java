package io.hhplus.storefront.application.payment;

import io.hhplus.storefront.application.payment.dto.CreateRefundRequest;
import io.hhplus.storefront.application.payment.dto.PaymentResponse;
import io.hhplus.storefront.application.payment.dto.RefundResponse;
import io.hhplus.storefront.application.usecase.UseCase;
import io.hhplus.storefront.infrastructure.gateway.PaymentGateway;
import io.hhplus.storefront.infrastructure.gateway.RefundResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 환불 요청 UseCase
 *
 * 게이트웨이에 환불을 요청만 한다. 주문/결제 상태는 charge.refunded 웹훅이 반영한다.
 * 멱등 키: refund_{tenantId}_{orderId}_{amount|full}_{순번}
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class RefundService {

    private final RefundRequestRegistrar refundRequestRegistrar;
    private final PaymentGateway paymentGateway;

    public RefundResponse createRefund(Long tenantId, Long orderId, CreateRefundRequest request) {
        RefundRequestRegistrar.Registration registration =
            refundRequestRegistrar.register(tenantId, orderId, request.amountCents());

        String key = idempotencyKey(tenantId, orderId, request.amountCents(), registration.sequence());
        RefundResult result = paymentGateway.createRefund(
            registration.paymentIntentId(), request.amountCents(), request.reason(), key
        );

        log.info("환불 요청 접수: orderId={}, refundId={}, amount={}", orderId, result.id(), result.amountCents());
        return new RefundResponse(orderId, result.id(), result.amountCents(), result.status(), key);
    }

    public List<PaymentResponse> getOrderPayments(Long tenantId, Long orderId) {
        return refundRequestRegistrar.findPayments(tenantId, orderId);
    }

    static String idempotencyKey(Long tenantId, Long orderId, Long amountCents, int sequence) {
        return "refund_" + tenantId + "_" + orderId + "_"
            + (amountCents == null ? "full" : amountCents.toString()) + "_" + sequence;
    }
}
