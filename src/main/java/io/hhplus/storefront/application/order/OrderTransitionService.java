package io.hhplus.storefront.application.order;

import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.domain.order.OrderStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderTransitionService {

    private final OrderRepository orderRepository;
    private final Clock clock;

    /**
     * 주문 행을 잠그고 상태 전이표에 따라 상태를 바꾼다.
     */
    @Transactional
    public OrderResponse transition(Long tenantId, Long orderId, OrderStatus target) {
        Order order = orderRepository.findByIdForUpdate(orderId, tenantId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다. orderId: " + orderId));

        OrderStatus previous = order.getStatus();
        order.transitionTo(target, LocalDateTime.now(clock));
        orderRepository.save(order);

        log.info("주문 상태 변경: orderId={}, {} -> {}", orderId, previous, target);
        return OrderResponse.from(order);
    }
}
