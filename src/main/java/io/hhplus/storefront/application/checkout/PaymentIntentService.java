package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.infrastructure.gateway.PaymentGateway;
import io.hhplus.storefront.infrastructure.gateway.PaymentIntent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * 결제 인텐트 관리
 *
 * 멱등 키 pi_{tenantId}_{orderId}를 쓰므로 생성 호출을 몇 번 반복해도 게이트웨이에는 인텐트가 하나만 생긴다.
 * 게이트웨이 호출은 DB 트랜잭션 밖에서 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentIntentService {

    private final PaymentGateway paymentGateway;
    private final OrderRepository orderRepository;

    public static String idempotencyKey(Long tenantId, Long orderId) {
        return "pi_" + tenantId + "_" + orderId;
    }

    /**
     * 일시적 게이트웨이 오류는 짧게 재시도한다. 최종 실패 시 예외를 그대로 던진다.
     */
    @Retryable(
        retryFor = BusinessException.class,
        maxAttempts = 3,
        backoff = @Backoff(delay = 200, multiplier = 2)
    )
    public PaymentIntent requestIntent(OrderResponse order) {
        log.info("결제 인텐트 요청: orderId={}, amount={}", order.orderId(), order.grandTotalCents());
        return paymentGateway.createPaymentIntent(
            order.grandTotalCents(),
            order.currency(),
            Map.of(
                "tenantId", String.valueOf(order.tenantId()),
                "orderId", String.valueOf(order.orderId()),
                "orderNumber", order.orderNumber()
            ),
            idempotencyKey(order.tenantId(), order.orderId())
        );
    }

    /**
     * 인텐트 ID를 주문에 기록한다. 이미 기록되어 있으면 기존 값을 유지한다.
     */
    @Transactional
    public String attachIntent(Long tenantId, Long orderId, String paymentIntentId) {
        Order order = orderRepository.findByIdForUpdate(orderId, tenantId)
            .orElseThrow(() -> new IllegalStateException("주문이 사라졌습니다. orderId: " + orderId));
        if (!order.hasPaymentIntent()) {
            order.attachPaymentIntent(paymentIntentId);
            orderRepository.save(order);
        }
        return order.getPaymentIntentId();
    }

    /**
     * 클라이언트 시크릿 조회. 실패하면 null (조회 응답을 막지 않는다).
     */
    public String findClientSecret(String paymentIntentId) {
        try {
            return paymentGateway.retrievePaymentIntent(paymentIntentId).clientSecret();
        } catch (BusinessException e) {
            log.warn("결제 인텐트 조회 실패: paymentIntentId={}, reason={}", paymentIntentId, e.getMessage());
            return null;
        }
    }

    /**
     * 취소된 주문의 인텐트를 정리한다. 실패는 기록만 한다 (주문 취소는 이미 커밋됨).
     */
    public void cancelIntentQuietly(String paymentIntentId) {
        try {
            paymentGateway.cancelPaymentIntent(paymentIntentId);
            log.info("결제 인텐트 취소: paymentIntentId={}", paymentIntentId);
        } catch (BusinessException e) {
            log.warn("결제 인텐트 취소 실패: paymentIntentId={}, reason={}", paymentIntentId, e.getMessage());
        }
    }
}
