package io.hhplus.storefront.config;

import io.hhplus.storefront.domain.cart.CartPricingPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PricingConfig {

    @Bean
    public CartPricingPolicy cartPricingPolicy(StorefrontProperties properties) {
        StorefrontProperties.Pricing pricing = properties.getPricing();
        return new CartPricingPolicy(
            pricing.getTaxRate(),
            pricing.getFlatShippingCents(),
            pricing.getFreeShippingThresholdCents()
        );
    }
}
