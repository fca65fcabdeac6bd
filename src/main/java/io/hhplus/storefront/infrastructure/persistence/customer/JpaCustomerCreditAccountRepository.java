package io.hhplus.storefront.infrastructure.persistence.customer;

import io.hhplus.storefront.domain.customer.CustomerCreditAccount;
import io.hhplus.storefront.domain.customer.CustomerCreditAccountRepository;
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
public interface JpaCustomerCreditAccountRepository
    extends JpaRepository<CustomerCreditAccount, Long>, CustomerCreditAccountRepository {

    @Override
    Optional<CustomerCreditAccount> findByTenantIdAndCustomerId(Long tenantId, Long customerId);

    /**
     * Pessimistic Write Lock (SELECT FOR UPDATE)
     * - 청구 계정 단위로 한도 검사 + 주문 저장을 직렬화한다
     */
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT a FROM CustomerCreditAccount a " +
           "WHERE a.tenantId = :tenantId AND a.billingAccountId = :billingAccountId " +
           "ORDER BY a.id ASC")
    List<CustomerCreditAccount> findAllByBillingAccountForUpdate(
        @Param("tenantId") Long tenantId,
        @Param("billingAccountId") Long billingAccountId
    );

    @Override
    CustomerCreditAccount save(CustomerCreditAccount account);
}
