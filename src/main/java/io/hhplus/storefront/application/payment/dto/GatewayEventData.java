package io.hhplus.storefront.application.payment.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayEventData(
    String paymentIntentId,
    String chargeId,
    Long amount,
    Long amountRefunded,
    String currency,
    Map<String, String> metadata,
    String failureCode,
    String failureMessage
) {
    public Long metadataLong(String key) {
        if (metadata == null || metadata.get(key) == null) {
            return null;
        }
        try {
            return Long.valueOf(metadata.get(key));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
