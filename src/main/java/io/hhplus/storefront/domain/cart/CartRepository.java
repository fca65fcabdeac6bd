package io.hhplus.storefront.domain.cart;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface CartRepository {

    Optional<Cart> findByIdAndTenantId(Long id, Long tenantId);

    /**
     * 장바구니 행을 배타 잠금으로 조회한다 (SELECT ... FOR UPDATE).
     */
    Optional<Cart> findByIdForUpdate(Long id);

    /**
     * 잠금 전에 엔티티를 영속성 컨텍스트에 올리지 않도록 ID만 조회한다.
     */
    Optional<Long> findActiveIdByCustomer(Long tenantId, Long customerId, LocalDateTime now);

    Optional<Long> findActiveIdBySession(Long tenantId, String sessionToken, LocalDateTime now);

    /**
     * 만료 여부와 무관하게 소유자의 ACTIVE 장바구니 ID (소유자당 최대 하나)
     */
    Optional<Long> findIdByActiveOwnerKey(Long tenantId, String activeOwnerKey);

    List<Long> findExpiredActiveCartIds(LocalDateTime now, int limit);

    List<Long> findAbandonedCartIdsBefore(LocalDateTime threshold, int limit);

    Cart save(Cart cart);

    Cart saveAndFlush(Cart cart);

    void delete(Cart cart);
}
