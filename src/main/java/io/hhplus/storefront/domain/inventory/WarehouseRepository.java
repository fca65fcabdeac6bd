package io.hhplus.storefront.domain.inventory;

import java.util.Optional;

public interface WarehouseRepository {

    Optional<Warehouse> findById(Long id);

    Warehouse save(Warehouse warehouse);
}
