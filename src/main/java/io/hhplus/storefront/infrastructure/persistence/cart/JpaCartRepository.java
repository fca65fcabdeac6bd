package io.hhplus.storefront.infrastructure.persistence.cart;

import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartRepository;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaCartRepository extends JpaRepository<Cart, Long>, CartRepository {

    @Override
    Optional<Cart> findByIdAndTenantId(Long id, Long tenantId);

    /**
     * 장바구니 변경/체크아웃/만료 처리를 직렬화하는 잠금
     */
    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT c FROM Cart c WHERE c.id = :id")
    Optional<Cart> findByIdForUpdate(@Param("id") Long id);

    @Override
    @Query("SELECT c.id FROM Cart c " +
           "WHERE c.tenantId = :tenantId AND c.customerId = :customerId " +
           "AND c.status = io.hhplus.storefront.domain.cart.CartStatus.ACTIVE AND c.expiresAt > :now")
    Optional<Long> findActiveIdByCustomer(
        @Param("tenantId") Long tenantId,
        @Param("customerId") Long customerId,
        @Param("now") LocalDateTime now
    );

    @Override
    @Query("SELECT c.id FROM Cart c " +
           "WHERE c.tenantId = :tenantId AND c.sessionToken = :sessionToken AND c.customerId IS NULL " +
           "AND c.status = io.hhplus.storefront.domain.cart.CartStatus.ACTIVE AND c.expiresAt > :now")
    Optional<Long> findActiveIdBySession(
        @Param("tenantId") Long tenantId,
        @Param("sessionToken") String sessionToken,
        @Param("now") LocalDateTime now
    );

    @Query("SELECT c.id FROM Cart c " +
           "WHERE c.status = io.hhplus.storefront.domain.cart.CartStatus.ACTIVE AND c.expiresAt < :now " +
           "ORDER BY c.expiresAt ASC")
    List<Long> findExpiredActiveCartIds(@Param("now") LocalDateTime now, Pageable pageable);

    @Query("SELECT c.id FROM Cart c " +
           "WHERE c.status = io.hhplus.storefront.domain.cart.CartStatus.ABANDONED AND c.abandonedAt < :threshold " +
           "ORDER BY c.abandonedAt ASC")
    List<Long> findAbandonedCartIdsBefore(@Param("threshold") LocalDateTime threshold, Pageable pageable);

    @Override
    default List<Long> findExpiredActiveCartIds(LocalDateTime now, int limit) {
        return findExpiredActiveCartIds(now, PageRequest.of(0, limit));
    }

    @Override
    default List<Long> findAbandonedCartIdsBefore(LocalDateTime threshold, int limit) {
        return findAbandonedCartIdsBefore(threshold, PageRequest.of(0, limit));
    }

    @Override
    @Query("SELECT c.id FROM Cart c WHERE c.tenantId = :tenantId AND c.activeOwnerKey = :activeOwnerKey")
    Optional<Long> findIdByActiveOwnerKey(
        @Param("tenantId") Long tenantId,
        @Param("activeOwnerKey") String activeOwnerKey
    );

    @Override
    Cart save(Cart cart);

    @Override
    Cart saveAndFlush(Cart cart);

    @Override
    void delete(Cart cart);
}
