package io.hhplus.storefront.domain.payment;

public interface ProcessedWebhookEventRepository {

    /**
     * 즉시 flush하여 중복 시 DataIntegrityViolationException을 발생시킨다.
     */
    ProcessedWebhookEvent saveAndFlush(ProcessedWebhookEvent event);

    boolean existsByEventId(String eventId);
}
