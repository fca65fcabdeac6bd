package io.hhplus.storefront.infrastructure.persistence.payment;

import io.hhplus.storefront.domain.payment.Payment;
import io.hhplus.storefront.domain.payment.PaymentRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@Primary
public interface JpaPaymentRepository extends JpaRepository<Payment, Long>, PaymentRepository {

    @Override
    Payment save(Payment payment);

    @Override
    List<Payment> findAllByTenantIdAndOrderIdOrderByIdAsc(Long tenantId, Long orderId);

    @Override
    List<Payment> findAllByPaymentIntentId(String paymentIntentId);
}
