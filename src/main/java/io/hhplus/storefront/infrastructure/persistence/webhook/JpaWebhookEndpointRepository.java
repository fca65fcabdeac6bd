package io.hhplus.storefront.infrastructure.persistence.webhook;

import io.hhplus.storefront.domain.webhook.WebhookEndpoint;
import io.hhplus.storefront.domain.webhook.WebhookEndpointRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaWebhookEndpointRepository extends JpaRepository<WebhookEndpoint, Long>, WebhookEndpointRepository {

    @Override
    WebhookEndpoint save(WebhookEndpoint endpoint);

    @Override
    Optional<WebhookEndpoint> findById(Long id);

    @Override
    List<WebhookEndpoint> findAllByTenantIdAndActiveTrue(Long tenantId);
}
