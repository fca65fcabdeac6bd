package io.hhplus.storefront.domain.webhook;

import java.util.List;
import java.util.Optional;

public interface WebhookEndpointRepository {

    WebhookEndpoint save(WebhookEndpoint endpoint);

    Optional<WebhookEndpoint> findById(Long id);

    List<WebhookEndpoint> findAllByTenantIdAndActiveTrue(Long tenantId);
}
