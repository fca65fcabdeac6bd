package io.hhplus.storefront.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
public class WebhookClientConfig {

    @Bean
    public RestClient webhookRestClient(RestClient.Builder builder, StorefrontProperties properties) {
        Duration timeout = properties.getWebhook().getTimeout();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);

        return builder
            .requestFactory(requestFactory)
            .defaultHeader("User-Agent", "storefront-webhooks/1.0")
            .build();
    }
}
