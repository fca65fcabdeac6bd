package io.hhplus.storefront.application.cart.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record AddCartItemRequest(
    @NotNull(message = "상품 ID는 필수입니다")
    Long productId,

    @Min(value = 1, message = "수량은 1 이상이어야 합니다")
    @Max(value = 999, message = "수량은 999 이하여야 합니다")
    int quantity
) {
}
