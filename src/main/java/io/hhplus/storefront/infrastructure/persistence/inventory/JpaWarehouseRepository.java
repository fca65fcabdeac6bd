package io.hhplus.storefront.infrastructure.persistence.inventory;

import io.hhplus.storefront.domain.inventory.Warehouse;
import io.hhplus.storefront.domain.inventory.WarehouseRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaWarehouseRepository extends JpaRepository<Warehouse, Long>, WarehouseRepository {

    @Override
    Optional<Warehouse> findById(Long id);

    @Override
    Warehouse save(Warehouse warehouse);
}
