package io.hhplus.storefront.infrastructure.persistence.order;

import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderRepository;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;

@Repository
@Primary
public interface JpaOrderRepository extends JpaRepository<Order, Long>, OrderRepository {

    @Override
    Order save(Order order);

    @Override
    Optional<Order> findByIdAndTenantId(Long id, Long tenantId);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT o FROM Order o WHERE o.id = :id AND o.tenantId = :tenantId")
    Optional<Order> findByIdForUpdate(@Param("id") Long id, @Param("tenantId") Long tenantId);

    @Override
    Optional<Order> findByTenantIdAndOrderNumber(Long tenantId, String orderNumber);

    @Override
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT o FROM Order o WHERE o.paymentIntentId = :paymentIntentId")
    Optional<Order> findByPaymentIntentIdForUpdate(@Param("paymentIntentId") String paymentIntentId);

    @Override
    @Query("SELECT COALESCE(SUM(o.grandTotalCents), 0) FROM Order o " +
           "WHERE o.tenantId = :tenantId AND o.customerId IN :customerIds " +
           "AND o.status <> io.hhplus.storefront.domain.order.OrderStatus.CANCELLED " +
           "AND o.paymentStatus IN (io.hhplus.storefront.domain.order.PaymentStatus.PENDING, " +
           "io.hhplus.storefront.domain.order.PaymentStatus.FAILED)")
    long sumUnpaidExposure(@Param("tenantId") Long tenantId, @Param("customerIds") Collection<Long> customerIds);
}
