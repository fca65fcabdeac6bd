package io.hhplus.storefront.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    @DisplayName("PENDING은 결제 확정 또는 취소로만 이동한다")
    void pending_허용전이() {
        assertThat(OrderStatus.PENDING.allowedTransitions())
            .containsExactlyInAnyOrder(OrderStatus.CONFIRMED, OrderStatus.CANCELLED);
    }

    @Test
    @DisplayName("배송 흐름은 앞으로만 진행한다")
    void 배송흐름_역방향불가() {
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PROCESSING)).isTrue();
        assertThat(OrderStatus.PROCESSING.canTransitionTo(OrderStatus.SHIPPED)).isTrue();
        assertThat(OrderStatus.SHIPPED.canTransitionTo(OrderStatus.DELIVERED)).isTrue();

        assertThat(OrderStatus.SHIPPED.canTransitionTo(OrderStatus.PROCESSING)).isFalse();
        assertThat(OrderStatus.DELIVERED.canTransitionTo(OrderStatus.SHIPPED)).isFalse();
        assertThat(OrderStatus.CONFIRMED.canTransitionTo(OrderStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("REFUNDED는 DELIVERED에서만 진입한다")
    void refunded_진입조건() {
        for (OrderStatus status : OrderStatus.values()) {
            assertThat(status.canTransitionTo(OrderStatus.REFUNDED))
                .as("%s → REFUNDED", status)
                .isEqualTo(status == OrderStatus.DELIVERED);
        }
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"CANCELLED", "REFUNDED"})
    @DisplayName("종료 상태에서는 어디로도 이동할 수 없다")
    void 종료상태_전이없음(OrderStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(terminal.allowedTransitions()).isEmpty();
    }
}
