package io.hhplus.storefront.infrastructure.persistence.inventory;

import io.hhplus.storefront.domain.inventory.WarehouseBalance;
import io.hhplus.storefront.domain.inventory.WarehouseBalanceRepository;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaWarehouseBalanceRepository extends JpaRepository<WarehouseBalance, Long>, WarehouseBalanceRepository {

    /**
     * Pessimistic Write Lock (SELECT FOR UPDATE)
     * - 상품 단위 상호 배제: 같은 상품의 잔량 행을 모두 잠근다
     * - 잠금 대기 3초 초과 시 PessimisticLockingFailureException
     */
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT b FROM WarehouseBalance b " +
           "WHERE b.tenantId = :tenantId AND b.productId = :productId " +
           "ORDER BY b.createdAt ASC, b.id ASC")
    List<WarehouseBalance> findAllForUpdate(@Param("tenantId") Long tenantId, @Param("productId") Long productId);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT b FROM WarehouseBalance b " +
           "WHERE b.tenantId = :tenantId AND b.productId = :productId AND b.warehouseId = :warehouseId")
    Optional<WarehouseBalance> findOneForUpdate(
        @Param("tenantId") Long tenantId,
        @Param("productId") Long productId,
        @Param("warehouseId") Long warehouseId
    );

    @Override
    List<WarehouseBalance> findAllByTenantIdAndProductId(Long tenantId, Long productId);

    @Override
    WarehouseBalance save(WarehouseBalance balance);
}
