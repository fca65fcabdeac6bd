package io.hhplus.storefront.application.checkout.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateCheckoutRequest(
    @NotNull(message = "장바구니 ID는 필수입니다")
    Long cartId,

    @NotBlank(message = "이메일은 필수입니다")
    @Email
    String email,

    String phone,

    @NotNull(message = "배송지는 필수입니다")
    @Valid
    AddressRequest shippingAddress,

    @Valid
    AddressRequest billingAddress,

    @Size(max = 1000)
    String customerNotes
) {
}
