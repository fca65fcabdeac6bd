package io.hhplus.storefront.application.payment.dto;

public record WebhookAckResponse(
    boolean received,
    String eventId,
    ReconcileOutcome outcome
) {
    public static WebhookAckResponse of(String eventId, ReconcileOutcome outcome) {
        return new WebhookAckResponse(true, eventId, outcome);
    }
}
