package io.hhplus.storefront.domain.inventory;

import java.util.List;

public interface StockMovementRepository {

    StockMovement save(StockMovement movement);

    boolean existsByTenantIdAndReferenceAndProductId(Long tenantId, String reference, Long productId);

    List<StockMovement> findAllByTenantIdAndReference(Long tenantId, String reference);
}
