package io.hhplus.storefront.domain.customer;

import java.util.List;
import java.util.Optional;

public interface CustomerCreditAccountRepository {

    Optional<CustomerCreditAccount> findByTenantIdAndCustomerId(Long tenantId, Long customerId);

    /**
     * 같은 청구 계정에 묶인 신용 계정 행을 모두 잠근다 (ID 오름차순)
     */
    List<CustomerCreditAccount> findAllByBillingAccountForUpdate(Long tenantId, Long billingAccountId);

    CustomerCreditAccount save(CustomerCreditAccount account);
}
