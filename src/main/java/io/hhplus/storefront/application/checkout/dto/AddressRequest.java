package io.hhplus.storefront.application.checkout.dto;

import io.hhplus.storefront.domain.order.Address;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AddressRequest(
    @NotBlank String name,
    @NotBlank String line1,
    String line2,
    @NotBlank String city,
    String region,
    @NotBlank String postalCode,
    @NotBlank @Size(min = 2, max = 2) String country
) {
    public Address toAddress() {
        return new Address(name, line1, line2, city, region, postalCode, country);
    }
}
