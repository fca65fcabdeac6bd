package io.hhplus.storefront.infrastructure.persistence.inventory;

import io.hhplus.storefront.domain.inventory.StockMovement;
import io.hhplus.storefront.domain.inventory.StockMovementRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public interface JpaStockMovementRepository extends JpaRepository<StockMovement, Long>, StockMovementRepository {

    @Override
    StockMovement save(StockMovement movement);

    @Override
    boolean existsByTenantIdAndReferenceAndProductId(Long tenantId, String reference, Long productId);

    @Override
    List<StockMovement> findAllByTenantIdAndReference(Long tenantId, String reference);
}
