package io.hhplus.storefront.domain.payment;

import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 기록
 *
 * 게이트웨이 웹훅으로 확인된 결과만 기록한다.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payment_order", columnList = "tenant_id, order_id"),
        @Index(name = "idx_payment_intent", columnList = "payment_intent_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "amount_cents", nullable = false)
    private long amountCents;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentRecordStatus status;

    @Column(name = "payment_intent_id", length = 100)
    private String paymentIntentId;

    @Column(name = "charge_id", length = 100)
    private String chargeId;

    @Column(name = "error_code", length = 50)
    private String errorCode;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    public static Payment captured(Long tenantId, Long orderId, long amountCents, String currency,
                                   String paymentIntentId, String chargeId) {
        Payment payment = base(tenantId, orderId, amountCents, currency, paymentIntentId);
        payment.status = PaymentRecordStatus.CAPTURED;
        payment.chargeId = chargeId;
        return payment;
    }

    public static Payment failed(Long tenantId, Long orderId, long amountCents, String currency,
                                 String paymentIntentId, String errorCode, String errorMessage) {
        Payment payment = base(tenantId, orderId, amountCents, currency, paymentIntentId);
        payment.status = PaymentRecordStatus.FAILED;
        payment.errorCode = errorCode;
        payment.errorMessage = errorMessage;
        return payment;
    }

    private static Payment base(Long tenantId, Long orderId, long amountCents, String currency, String paymentIntentId) {
        Payment payment = new Payment();
        payment.tenantId = tenantId;
        payment.orderId = orderId;
        payment.amountCents = amountCents;
        payment.currency = currency;
        payment.paymentIntentId = paymentIntentId;
        return payment;
    }

    public void markRefunded(boolean full) {
        this.status = full ? PaymentRecordStatus.REFUNDED : PaymentRecordStatus.PARTIALLY_REFUNDED;
    }

    public boolean isCaptured() {
        return status == PaymentRecordStatus.CAPTURED || status == PaymentRecordStatus.PARTIALLY_REFUNDED;
    }
}
