package io.hhplus.storefront.application.cart.dto;

import jakarta.validation.constraints.NotBlank;

public record ApplyCouponRequest(
    @NotBlank(message = "쿠폰 코드는 필수입니다")
    String code
) {
}
