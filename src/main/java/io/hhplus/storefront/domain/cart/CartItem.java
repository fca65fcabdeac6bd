package io.hhplus.storefront.domain.cart;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 상품
 *
 * reservedQuantity는 이 라인이 StockLedger에 실제로 잡고 있는 예약 수량이다.
 * 보통 quantity와 같고, 주문 취소로 장바구니가 다시 열린 직후에는 0이다.
 */
@Entity
@Table(
    name = "cart_items",
    uniqueConstraints = @UniqueConstraint(name = "uk_cart_product", columnNames = {"cart_id", "product_id"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CartItem extends BaseTimeEntity {

    public static final int MAX_QUANTITY = 999;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "cart_id", nullable = false)
    private Cart cart;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "reserved_quantity", nullable = false)
    private int reservedQuantity;

    @Column(name = "unit_price_cents", nullable = false)
    private long unitPriceCents;

    static CartItem create(Cart cart, Long productId, int quantity, long unitPriceCents) {
        validateQuantity(quantity);
        CartItem item = new CartItem();
        item.cart = cart;
        item.productId = productId;
        item.quantity = quantity;
        item.reservedQuantity = 0;
        item.unitPriceCents = unitPriceCents;
        return item;
    }

    public void changeQuantity(int quantity) {
        validateQuantity(quantity);
        this.quantity = quantity;
    }

    /**
     * 예약 수량을 delta 만큼 조정한다 (음수면 해제).
     */
    public void adjustReservation(int delta) {
        int next = this.reservedQuantity + delta;
        if (next < 0) {
            throw new IllegalStateException("예약 수량은 음수가 될 수 없습니다. cartItemId: " + id);
        }
        this.reservedQuantity = next;
    }

    public void clearReservation() {
        this.reservedQuantity = 0;
    }

    /**
     * 수량 대비 부족한 예약 수량
     */
    public int missingReservation() {
        return Math.max(0, quantity - reservedQuantity);
    }

    public long lineTotalCents() {
        return unitPriceCents * quantity;
    }

    private static void validateQuantity(int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        if (quantity > MAX_QUANTITY) {
            throw new BusinessException(
                ErrorCode.INVALID_QUANTITY,
                String.format("라인 수량은 %d 이하여야 합니다. 요청: %d", MAX_QUANTITY, quantity)
            );
        }
    }
}
