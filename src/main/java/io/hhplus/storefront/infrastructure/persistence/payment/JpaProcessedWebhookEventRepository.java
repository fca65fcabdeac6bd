package io.hhplus.storefront.infrastructure.persistence.payment;

import io.hhplus.storefront.domain.payment.ProcessedWebhookEvent;
import io.hhplus.storefront.domain.payment.ProcessedWebhookEventRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public interface JpaProcessedWebhookEventRepository
    extends JpaRepository<ProcessedWebhookEvent, Long>, ProcessedWebhookEventRepository {

    @Override
    ProcessedWebhookEvent saveAndFlush(ProcessedWebhookEvent event);

    @Override
    boolean existsByEventId(String eventId);
}
