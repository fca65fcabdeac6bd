package io.hhplus.storefront.application.payment;

import io.hhplus.storefront.application.payment.dto.GatewayEvent;
import io.hhplus.storefront.application.payment.dto.GatewayEventData;
import io.hhplus.storefront.application.payment.dto.ReconcileOutcome;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderConfirmedEvent;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.domain.order.OrderStatus;
import io.hhplus.storefront.domain.order.PaymentStatus;
import io.hhplus.storefront.domain.payment.Payment;
import io.hhplus.storefront.domain.payment.PaymentRepository;
import io.hhplus.storefront.domain.payment.ProcessedWebhookEvent;
import io.hhplus.storefront.domain.payment.ProcessedWebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 웹훅 이벤트 정산 트랜잭션
 *
 * 처리 이벤트 기록과 주문/결제 변경이 같은 트랜잭션에 묶인다.
 * 같은 이벤트 ID가 동시에 들어오면 유니크 제약으로 한쪽만 커밋되고,
 * 다른 쪽은 DataIntegrityViolationException으로 롤백된다 (호출자가 DUPLICATE로 변환).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationService {

    private final ProcessedWebhookEventRepository processedWebhookEventRepository;
    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public ReconcileOutcome reconcile(GatewayEvent event) {
        if (processedWebhookEventRepository.existsByEventId(event.id())) {
            return ReconcileOutcome.DUPLICATE;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        processedWebhookEventRepository.saveAndFlush(ProcessedWebhookEvent.of(event.id(), event.type(), now));

        return switch (event.type()) {
            case GatewayEvent.PAYMENT_SUCCEEDED -> handleSucceeded(event, now);
            case GatewayEvent.PAYMENT_FAILED -> handleFailed(event);
            case GatewayEvent.CHARGE_REFUNDED -> handleRefunded(event, now);
            default -> {
                log.debug("처리 대상이 아닌 웹훅 이벤트: eventId={}, type={}", event.id(), event.type());
                yield ReconcileOutcome.IGNORED;
            }
        };
    }

    private ReconcileOutcome handleSucceeded(GatewayEvent event, LocalDateTime now) {
        GatewayEventData data = event.data();
        Optional<Order> found = lockOrder(data);
        if (found.isEmpty()) {
            log.warn("결제 성공 이벤트의 주문을 찾을 수 없음: eventId={}, paymentIntentId={}", event.id(), data.paymentIntentId());
            return ReconcileOutcome.ORDER_NOT_FOUND;
        }
        Order order = found.get();
        long amount = data.amount() == null ? -1L : data.amount();

        if (amount != order.getGrandTotalCents()) {
            log.error("결제 금액 불일치: orderId={}, expected={}, actual={}, paymentIntentId={}",
                order.getId(), order.getGrandTotalCents(), amount, data.paymentIntentId());
            paymentRepository.save(Payment.failed(
                order.getTenantId(), order.getId(), Math.max(amount, 0L), currencyOf(data, order),
                data.paymentIntentId(), "amount_mismatch",
                String.format("expected %d, received %d", order.getGrandTotalCents(), amount)
            ));
            if (order.getStatus() == OrderStatus.PENDING) {
                order.markPaymentFailed();
                orderRepository.save(order);
            }
            return ReconcileOutcome.AMOUNT_MISMATCH;
        }

        paymentRepository.save(Payment.captured(
            order.getTenantId(), order.getId(), amount, currencyOf(data, order),
            data.paymentIntentId(), data.chargeId()
        ));

        if (order.getStatus() != OrderStatus.PENDING || order.getPaymentStatus() == PaymentStatus.CAPTURED) {
            // 취소 이후 도착한 캡처 등. 환불은 운영자가 판단한다
            log.warn("PENDING이 아닌 주문의 결제 캡처 기록: orderId={}, status={}, paymentStatus={}",
                order.getId(), order.getStatus(), order.getPaymentStatus());
            return ReconcileOutcome.RECORDED_ONLY;
        }

        order.confirm(data.paymentIntentId(), now);
        orderRepository.save(order);
        eventPublisher.publishEvent(new OrderConfirmedEvent(order.getTenantId(), order.getId(), order.getOrderNumber()));

        log.info("주문 결제 확정: orderId={}, orderNumber={}", order.getId(), order.getOrderNumber());
        return ReconcileOutcome.APPLIED;
    }

    private ReconcileOutcome handleFailed(GatewayEvent event) {
        GatewayEventData data = event.data();
        Optional<Order> found = lockOrder(data);
        if (found.isEmpty()) {
            log.warn("결제 실패 이벤트의 주문을 찾을 수 없음: eventId={}, paymentIntentId={}", event.id(), data.paymentIntentId());
            return ReconcileOutcome.ORDER_NOT_FOUND;
        }
        Order order = found.get();

        paymentRepository.save(Payment.failed(
            order.getTenantId(), order.getId(), data.amount() == null ? order.getGrandTotalCents() : data.amount(),
            currencyOf(data, order), data.paymentIntentId(), data.failureCode(), data.failureMessage()
        ));

        if (!order.isAwaitingPayment()) {
            log.warn("결제 대기 상태가 아닌 주문의 결제 실패 이벤트: orderId={}, status={}", order.getId(), order.getStatus());
            return ReconcileOutcome.RECORDED_ONLY;
        }

        order.markPaymentFailed();
        orderRepository.save(order);
        log.info("주문 결제 실패 반영: orderId={}, failureCode={}", order.getId(), data.failureCode());
        return ReconcileOutcome.APPLIED;
    }

    private ReconcileOutcome handleRefunded(GatewayEvent event, LocalDateTime now) {
        GatewayEventData data = event.data();
        Optional<Order> found = lockOrder(data);
        if (found.isEmpty()) {
            log.warn("환불 이벤트의 주문을 찾을 수 없음: eventId={}, paymentIntentId={}", event.id(), data.paymentIntentId());
            return ReconcileOutcome.ORDER_NOT_FOUND;
        }
        Order order = found.get();

        if (!order.getPaymentStatus().isRefundable()) {
            log.warn("환불 불가 상태의 주문에 환불 이벤트 수신: orderId={}, paymentStatus={}",
                order.getId(), order.getPaymentStatus());
            return ReconcileOutcome.IGNORED;
        }

        long totalRefunded = data.amountRefunded() == null ? 0L : data.amountRefunded();
        order.applyRefund(totalRefunded, now);
        orderRepository.save(order);

        boolean full = order.getPaymentStatus() == PaymentStatus.REFUNDED;
        List<Payment> payments = paymentRepository.findAllByTenantIdAndOrderIdOrderByIdAsc(order.getTenantId(), order.getId());
        payments.stream()
            .filter(Payment::isCaptured)
            .forEach(payment -> {
                payment.markRefunded(full);
                paymentRepository.save(payment);
            });

        log.info("환불 반영: orderId={}, refunded={}, full={}", order.getId(), totalRefunded, full);
        return ReconcileOutcome.APPLIED;
    }

    /**
     * 메타데이터의 테넌트/주문 ID를 우선 사용하고, 없으면 인텐트 ID로 찾는다.
     */
    private Optional<Order> lockOrder(GatewayEventData data) {
        if (data == null) {
            return Optional.empty();
        }
        Long tenantId = data.metadataLong("tenantId");
        Long orderId = data.metadataLong("orderId");
        if (tenantId != null && orderId != null) {
            Optional<Order> order = orderRepository.findByIdForUpdate(orderId, tenantId);
            if (order.isPresent()) {
                return order;
            }
        }
        if (data.paymentIntentId() == null) {
            return Optional.empty();
        }
        return orderRepository.findByPaymentIntentIdForUpdate(data.paymentIntentId());
    }

    private String currencyOf(GatewayEventData data, Order order) {
        return data.currency() != null ? data.currency().toUpperCase() : order.getCurrency();
    }
}
