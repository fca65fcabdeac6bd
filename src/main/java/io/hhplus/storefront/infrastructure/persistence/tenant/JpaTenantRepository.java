package io.hhplus.storefront.infrastructure.persistence.tenant;

import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.domain.tenant.TenantRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@Primary
public interface JpaTenantRepository extends JpaRepository<Tenant, Long>, TenantRepository {

    @Override
    Optional<Tenant> findById(Long id);

    @Override
    Tenant save(Tenant tenant);

    /**
     * UPDATE 자체가 행 잠금을 잡으므로 같은 테넌트의 동시 채번은 직렬화된다.
     */
    @Override
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Tenant t SET t.orderSequence = t.orderSequence + 1 WHERE t.id = :tenantId")
    int incrementOrderSequence(@Param("tenantId") Long tenantId);

    @Override
    @Query("SELECT t.orderSequence FROM Tenant t WHERE t.id = :tenantId")
    Optional<Long> findOrderSequence(@Param("tenantId") Long tenantId);
}
