package io.hhplus.storefront.application.payment;

import io.hhplus.storefront.application.payment.dto.PaymentResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.domain.payment.PaymentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RefundRequestRegistrar {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;

    public record Registration(String paymentIntentId, int sequence) {
    }

    /**
     * 주문 잠금 후 환불 가능 여부 검증, 요청 순번 계산.
     * 순번은 환불 웹훅이 반영될 때만 올라가므로 타임아웃 후 재시도는 같은 멱등 키를 만든다.
     */
    @Transactional
    public Registration register(Long tenantId, Long orderId, Long amountCents) {
        Order order = orderRepository.findByIdForUpdate(orderId, tenantId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다. orderId: " + orderId));
        int sequence = order.nextRefundSequence(amountCents);
        return new Registration(order.getPaymentIntentId(), sequence);
    }

    @Transactional(readOnly = true)
    public List<PaymentResponse> findPayments(Long tenantId, Long orderId) {
        orderRepository.findByIdOrThrow(orderId, tenantId);
        return paymentRepository.findAllByTenantIdAndOrderIdOrderByIdAsc(tenantId, orderId).stream()
            .map(PaymentResponse::from)
            .toList();
    }
}
