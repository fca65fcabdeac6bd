package io.hhplus.storefront.domain.order;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.cart.CartTotals;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Entity
@Table(
    name = "orders",
    uniqueConstraints = @UniqueConstraint(name = "uk_order_tenant_number", columnNames = {"tenant_id", "order_number"}),
    indexes = {
        @Index(name = "idx_order_cart", columnList = "cart_id"),
        @Index(name = "idx_order_customer_payment", columnList = "tenant_id, customer_id, payment_status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "order_number", nullable = false, length = 30)
    private String orderNumber;  // e.g. "ORD-202601-00042"

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(nullable = false, length = 200)
    private String email;

    @Column(length = 40)
    private String phone;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "name", column = @Column(name = "shipping_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "shipping_line1", length = 200)),
        @AttributeOverride(name = "line2", column = @Column(name = "shipping_line2", length = 200)),
        @AttributeOverride(name = "city", column = @Column(name = "shipping_city", length = 100)),
        @AttributeOverride(name = "region", column = @Column(name = "shipping_region", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "shipping_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "shipping_country", length = 2))
    })
    private Address shippingAddress;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "name", column = @Column(name = "billing_name", length = 100)),
        @AttributeOverride(name = "line1", column = @Column(name = "billing_line1", length = 200)),
        @AttributeOverride(name = "line2", column = @Column(name = "billing_line2", length = 200)),
        @AttributeOverride(name = "city", column = @Column(name = "billing_city", length = 100)),
        @AttributeOverride(name = "region", column = @Column(name = "billing_region", length = 100)),
        @AttributeOverride(name = "postalCode", column = @Column(name = "billing_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "billing_country", length = 2))
    })
    private Address billingAddress;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<OrderItem> items = new ArrayList<>();

    @Column(name = "coupon_code", length = 50)
    private String couponCode;

    @Column(name = "subtotal_cents", nullable = false)
    private long subtotalCents;

    @Column(name = "discount_cents", nullable = false)
    private long discountCents;

    @Column(name = "shipping_cents", nullable = false)
    private long shippingCents;

    @Column(name = "tax_cents", nullable = false)
    private long taxCents;

    @Column(name = "grand_total_cents", nullable = false)
    private long grandTotalCents;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_intent_id", length = 100)
    private String paymentIntentId;

    @Column(name = "refunded_cents", nullable = false)
    private long refundedCents;

    @Column(name = "applied_refund_count", nullable = false)
    private int appliedRefundCount;

    @Column(name = "customer_notes", length = 1000)
    private String customerNotes;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "refunded_at")
    private LocalDateTime refundedAt;

    public static Order place(
        Long tenantId,
        String orderNumber,
        Long cartId,
        Long customerId,
        String email,
        String phone,
        Address shippingAddress,
        Address billingAddress,
        String couponCode,
        CartTotals totals,
        String currency,
        String customerNotes
    ) {
        if (email == null || email.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "이메일은 필수입니다");
        }

        Order order = new Order();
        order.tenantId = tenantId;
        order.orderNumber = orderNumber;
        order.cartId = cartId;
        order.customerId = customerId;
        order.email = email;
        order.phone = phone;
        order.shippingAddress = shippingAddress;
        order.billingAddress = billingAddress != null ? billingAddress : shippingAddress;
        order.couponCode = couponCode;
        order.subtotalCents = totals.subtotal();
        order.discountCents = totals.discount();
        order.shippingCents = totals.shipping();
        order.taxCents = totals.tax();
        order.grandTotalCents = totals.grandTotal();
        order.currency = currency;
        order.customerNotes = customerNotes;
        order.status = OrderStatus.PENDING;
        order.paymentStatus = PaymentStatus.PENDING;
        order.refundedCents = 0L;
        order.appliedRefundCount = 0;
        return order;
    }

    public void addItem(Long productId, String sku, String name, int quantity, long unitPriceCents) {
        items.add(OrderItem.snapshot(this, productId, sku, name, quantity, unitPriceCents));
    }

    /**
     * 상품 ID 오름차순 (재고 잠금 순서)
     */
    public List<OrderItem> itemsInLockOrder() {
        return items.stream()
            .sorted(Comparator.comparing(OrderItem::getProductId))
            .toList();
    }

    // ====================================
    // State transitions
    // ====================================

    public void transitionTo(OrderStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new BusinessException(
                ErrorCode.INVALID_ORDER_STATUS,
                String.format("주문 상태를 %s에서 %s(으)로 변경할 수 없습니다", status, target)
            );
        }
        this.status = target;
        switch (target) {
            case CONFIRMED -> this.confirmedAt = now;
            case CANCELLED -> this.cancelledAt = now;
            case REFUNDED -> this.refundedAt = now;
            default -> { }
        }
    }

    /**
     * 결제 확정
     */
    public void confirm(String paymentIntentId, LocalDateTime now) {
        transitionTo(OrderStatus.CONFIRMED, now);
        this.paymentStatus = PaymentStatus.CAPTURED;
        if (paymentIntentId != null) {
            this.paymentIntentId = paymentIntentId;
        }
    }

    /**
     * 결제 수단 거절 또는 금액 불일치. 주문은 PENDING으로 남아 재결제가 가능하다.
     */
    public void markPaymentFailed() {
        this.paymentStatus = PaymentStatus.FAILED;
    }

    /**
     * 체크아웃 취소 (결제가 캡처되지 않은 PENDING 주문만)
     */
    public void cancelCheckout(LocalDateTime now) {
        if (status != OrderStatus.PENDING || !paymentStatus.isUnpaid()) {
            throw new BusinessException(
                ErrorCode.ORDER_NOT_CANCELLABLE,
                String.format("결제 대기 중인 주문만 취소할 수 있습니다. 상태: %s, 결제 상태: %s", status, paymentStatus)
            );
        }
        transitionTo(OrderStatus.CANCELLED, now);
    }

    /**
     * 환불 누적 반영
     *
     * @param totalRefundedCents 게이트웨이가 보고한 누적 환불액
     */
    public void applyRefund(long totalRefundedCents, LocalDateTime now) {
        this.refundedCents = Math.min(totalRefundedCents, grandTotalCents);
        this.appliedRefundCount++;
        if (refundedCents < grandTotalCents) {
            this.paymentStatus = PaymentStatus.PARTIALLY_REFUNDED;
            return;
        }

        this.paymentStatus = PaymentStatus.REFUNDED;
        if (status == OrderStatus.DELIVERED) {
            transitionTo(OrderStatus.REFUNDED, now);
        } else if (!status.isTerminal()) {
            this.status = OrderStatus.CANCELLED;
            this.cancelledAt = now;
        }
    }

    /**
     * 환불 요청 가능 여부를 검증하고 다음 환불 순번을 돌려준다.
     * 순번은 웹훅으로 반영된 환불 건수 + 1 이므로, 반영 전 재요청은 같은 순번을 받는다.
     *
     * @param amountCents null이면 남은 금액 전액
     * @return 이번 요청 순번 (1부터)
     */
    public int nextRefundSequence(Long amountCents) {
        if (!paymentStatus.isRefundable() || paymentIntentId == null) {
            throw new BusinessException(
                ErrorCode.PAYMENT_NOT_REFUNDABLE,
                String.format("환불할 수 없는 결제 상태입니다. orderId: %d, 결제 상태: %s", id, paymentStatus)
            );
        }
        long refundable = grandTotalCents - refundedCents;
        if (amountCents != null && (amountCents <= 0 || amountCents > refundable)) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("환불 금액은 1 이상 %d 이하여야 합니다. 요청: %d", refundable, amountCents)
            );
        }
        return appliedRefundCount + 1;
    }

    public void attachPaymentIntent(String paymentIntentId) {
        this.paymentIntentId = paymentIntentId;
    }

    public boolean hasPaymentIntent() {
        return paymentIntentId != null;
    }

    public boolean isAwaitingPayment() {
        return status == OrderStatus.PENDING && paymentStatus.isUnpaid();
    }
}
