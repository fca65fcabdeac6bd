package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.application.checkout.dto.CheckoutResponse;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.application.usecase.UseCase;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.infrastructure.gateway.PaymentIntent;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 체크아웃 유스케이스
 *
 * 주문 생성(DB 트랜잭션)과 결제 인텐트 생성(외부 호출)을 분리한다.
 * - 주문 번호는 체크아웃 트랜잭션 밖에서 먼저 채번한다. 체크아웃이 커넥션을 두 개 잡지 않는다.
 * - 트랜잭션이 실패하면 아무것도 남지 않는다 (채번된 번호만 소모).
 * - 인텐트 생성이 실패해도(게이트웨이 예외 포함) 주문은 유지되고 paymentInitialized=false로 응답한다.
 *   이후 조회나 재시도 요청에서 같은 멱등 키로 복구한다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CheckoutOrchestrator {

    private final CheckoutTransactionService transactionService;
    private final OrderNumberGenerator orderNumberGenerator;
    private final PaymentIntentService paymentIntentService;
    private final MetricsCollector metricsCollector;

    public CheckoutResponse createCheckout(Long tenantId, CartOwner owner, CreateCheckoutRequest request) {
        long startTime = System.currentTimeMillis();

        OrderResponse order;
        try {
            String orderNumber = orderNumberGenerator.next(tenantId);
            order = transactionService.placeOrder(tenantId, owner, request, orderNumber);
            metricsCollector.recordCheckoutSuccess();
        } catch (RuntimeException e) {
            metricsCollector.recordCheckoutFailure();
            throw e;
        } finally {
            metricsCollector.recordCheckoutDuration(startTime);
        }

        return initializePayment(order);
    }

    /**
     * 주문 조회. 결제 대기 중인데 인텐트가 없으면 여기서 복구를 시도한다.
     */
    public CheckoutResponse getCheckout(Long tenantId, Long orderId) {
        return withPayment(transactionService.loadOrder(tenantId, orderId));
    }

    public CheckoutResponse getCheckoutByOrderNumber(Long tenantId, String orderNumber) {
        return withPayment(transactionService.loadOrderByNumber(tenantId, orderNumber));
    }

    /**
     * 명시적 인텐트 복구 요청
     */
    public CheckoutResponse retryPaymentIntent(Long tenantId, Long orderId) {
        OrderResponse order = transactionService.loadOrder(tenantId, orderId);
        if (!order.isAwaitingPayment()) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_STATUS,
                String.format("결제 대기 중인 주문이 아닙니다. 상태: %s, 결제 상태: %s", order.status(), order.paymentStatus())
            );
        }
        return initializePayment(order);
    }

    public OrderResponse cancelCheckout(Long tenantId, Long orderId) {
        OrderResponse cancelled = transactionService.cancel(tenantId, orderId);

        // 커밋 이후에만 외부 인텐트를 취소한다
        if (cancelled.paymentIntentId() != null) {
            paymentIntentService.cancelIntentQuietly(cancelled.paymentIntentId());
        }
        return cancelled;
    }

    private CheckoutResponse withPayment(OrderResponse order) {
        if (!order.isAwaitingPayment()) {
            return CheckoutResponse.withoutPayment(order);
        }
        if (order.paymentIntentId() == null) {
            log.info("결제 인텐트 누락 주문 복구 시도: orderId={}", order.orderId());
            return initializePayment(order);
        }
        String clientSecret = paymentIntentService.findClientSecret(order.paymentIntentId());
        return new CheckoutResponse(order, order.paymentIntentId(), clientSecret, true);
    }

    private CheckoutResponse initializePayment(OrderResponse order) {
        try {
            PaymentIntent intent = paymentIntentService.requestIntent(order);
            String intentId = paymentIntentService.attachIntent(order.tenantId(), order.orderId(), intent.id());
            OrderResponse refreshed = transactionService.loadOrder(order.tenantId(), order.orderId());
            return new CheckoutResponse(refreshed, intentId, intent.clientSecret(), true);
        } catch (BusinessException e) {
            log.warn("결제 인텐트 생성 실패, 주문은 유지됨: orderId={}, code={}, reason={}",
                order.orderId(), e.getCode(), e.getMessage());
            return new CheckoutResponse(order, null, null, false);
        } catch (RuntimeException e) {
            log.error("결제 인텐트 생성 중 예기치 않은 오류, 주문은 유지됨: orderId={}", order.orderId(), e);
            return new CheckoutResponse(order, null, null, false);
        }
    }
}
