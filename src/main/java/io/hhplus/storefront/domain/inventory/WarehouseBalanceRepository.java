package io.hhplus.storefront.domain.inventory;

import java.util.List;
import java.util.Optional;

public interface WarehouseBalanceRepository {

    /**
     * 상품의 모든 창고 잔량을 FIFO(생성 순) 순서로 잠그고 조회한다.
     */
    List<WarehouseBalance> findAllForUpdate(Long tenantId, Long productId);

    Optional<WarehouseBalance> findOneForUpdate(Long tenantId, Long productId, Long warehouseId);

    List<WarehouseBalance> findAllByTenantIdAndProductId(Long tenantId, Long productId);

    WarehouseBalance save(WarehouseBalance balance);
}
