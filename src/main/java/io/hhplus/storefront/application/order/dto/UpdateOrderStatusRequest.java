package io.hhplus.storefront.application.order.dto;

import io.hhplus.storefront.domain.order.OrderStatus;
import jakarta.validation.constraints.NotNull;

public record UpdateOrderStatusRequest(
    @NotNull(message = "변경할 상태는 필수입니다")
    OrderStatus status
) {
}
