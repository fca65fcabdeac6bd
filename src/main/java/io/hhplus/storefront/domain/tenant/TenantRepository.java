package io.hhplus.storefront.domain.tenant;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;

import java.util.Optional;

public interface TenantRepository {

    Optional<Tenant> findById(Long id);

    Tenant save(Tenant tenant);

    /**
     * 주문 번호 카운터를 1 증가시킨다.
     *
     * @return 갱신된 행 수 (테넌트가 없으면 0)
     */
    int incrementOrderSequence(Long tenantId);

    Optional<Long> findOrderSequence(Long tenantId);

    default Tenant findByIdOrThrow(Long id) {
        return findById(id).orElseThrow(() -> new BusinessException(
            ErrorCode.TENANT_NOT_FOUND,
            "상점을 찾을 수 없습니다. tenantId: " + id
        ));
    }
}
