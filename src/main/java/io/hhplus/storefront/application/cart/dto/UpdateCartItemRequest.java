package io.hhplus.storefront.application.cart.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * quantity 0은 라인 삭제를 뜻한다.
 */
public record UpdateCartItemRequest(
    @Min(value = 0, message = "수량은 0 이상이어야 합니다")
    @Max(value = 999, message = "수량은 999 이하여야 합니다")
    int quantity
) {
}
