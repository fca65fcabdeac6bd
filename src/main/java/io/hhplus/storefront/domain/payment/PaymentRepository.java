package io.hhplus.storefront.domain.payment;

import java.util.List;

public interface PaymentRepository {

    Payment save(Payment payment);

    List<Payment> findAllByTenantIdAndOrderIdOrderByIdAsc(Long tenantId, Long orderId);

    List<Payment> findAllByPaymentIntentId(String paymentIntentId);
}
