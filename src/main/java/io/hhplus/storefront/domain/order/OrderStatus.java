package io.hhplus.storefront.domain.order;

import java.util.EnumSet;
import java.util.Set;

/**
 * 주문 상태
 *
 * CANCELLED, REFUNDED는 종료 상태이다.
 */
public enum OrderStatus {
    /**
     * 결제 대기 (체크아웃 완료, 결제 전)
     */
    PENDING,

    /**
     * 결제 확정
     */
    CONFIRMED,

    PROCESSING,

    SHIPPED,

    DELIVERED,

    CANCELLED,

    REFUNDED;

    public Set<OrderStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> EnumSet.of(PROCESSING, SHIPPED, CANCELLED);
            case PROCESSING -> EnumSet.of(SHIPPED, CANCELLED);
            case SHIPPED -> EnumSet.of(DELIVERED, CANCELLED);
            case DELIVERED -> EnumSet.of(REFUNDED, CANCELLED);
            case CANCELLED, REFUNDED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == REFUNDED;
    }
}
