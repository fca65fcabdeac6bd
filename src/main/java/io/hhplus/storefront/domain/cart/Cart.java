package io.hhplus.storefront.domain.cart;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 장바구니
 *
 * 상태 전이:
 * - ACTIVE → CONVERTED: 체크아웃 성공 (정확히 한 번)
 * - CONVERTED → ACTIVE: 결제 전 주문 취소로 다시 열림
 * - ACTIVE → ABANDONED: 만료 후 리퍼가 예약 해제
 *
 * 소유자(회원 또는 세션)당 ACTIVE 장바구니는 하나뿐이다. ACTIVE일 때만 activeOwnerKey를 채우고
 * (tenant_id, active_owner_key) 유니크 제약으로 동시 생성을 막는다.
 *
 * 금액은 모두 센트 단위이며 CartPricingPolicy가 계산한 값을 그대로 보관한다.
 */
@Entity
@Table(
    name = "carts",
    uniqueConstraints = @UniqueConstraint(name = "uk_cart_active_owner", columnNames = {"tenant_id", "active_owner_key"}),
    indexes = {
        @Index(name = "idx_cart_customer", columnList = "tenant_id, customer_id, status"),
        @Index(name = "idx_cart_session", columnList = "tenant_id, session_token, status"),
        @Index(name = "idx_cart_status_expires", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Cart extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "session_token", length = 64)
    private String sessionToken;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CartStatus status;

    @Column(name = "active_owner_key", length = 80)
    private String activeOwnerKey;

    @OneToMany(mappedBy = "cart", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    private List<CartItem> items = new ArrayList<>();

    @Column(name = "coupon_code", length = 50)
    private String couponCode;

    @Column(name = "subtotal", nullable = false)
    private long subtotal;

    @Column(name = "discount_amount", nullable = false)
    private long discountAmount;

    @Column(name = "shipping_total", nullable = false)
    private long shippingTotal;

    @Column(name = "tax_total", nullable = false)
    private long taxTotal;

    @Column(name = "grand_total", nullable = false)
    private long grandTotal;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "last_activity_at", nullable = false)
    private LocalDateTime lastActivityAt;

    @Column(name = "abandoned_at")
    private LocalDateTime abandonedAt;

    public static Cart create(Long tenantId, CartOwner owner, LocalDateTime now, Duration ttl) {
        if (tenantId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "테넌트 ID는 필수입니다");
        }
        Cart cart = new Cart();
        cart.tenantId = tenantId;
        cart.customerId = owner.customerId();
        cart.sessionToken = owner.isAuthenticated() ? null : owner.sessionToken();
        cart.status = CartStatus.ACTIVE;
        cart.activeOwnerKey = cart.ownerKey();
        cart.lastActivityAt = now;
        cart.expiresAt = now.plus(ttl);
        return cart;
    }

    // ====================================
    // 상품 라인
    // ====================================

    public Optional<CartItem> findItemByProductId(Long productId) {
        return items.stream()
            .filter(item -> item.getProductId().equals(productId))
            .findFirst();
    }

    public CartItem findItemOrThrow(Long cartItemId) {
        return items.stream()
            .filter(item -> Objects.equals(item.getId(), cartItemId))
            .findFirst()
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_ITEM_NOT_FOUND,
                "장바구니 상품을 찾을 수 없습니다. cartItemId: " + cartItemId
            ));
    }

    public CartItem addItem(Long productId, int quantity, long unitPriceCents) {
        CartItem item = CartItem.create(this, productId, quantity, unitPriceCents);
        this.items.add(item);
        return item;
    }

    public void removeItem(CartItem item) {
        this.items.remove(item);
    }

    public void clearItems() {
        this.items.clear();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 잠금 순서를 고정하기 위해 상품 ID 오름차순으로 정렬한 라인 목록
     */
    public List<CartItem> itemsInLockOrder() {
        return items.stream()
            .sorted(Comparator.comparing(CartItem::getProductId))
            .toList();
    }

    // ====================================
    // 금액 / 쿠폰
    // ====================================

    public void applyTotals(CartTotals totals) {
        this.subtotal = totals.subtotal();
        this.discountAmount = totals.discount();
        this.shippingTotal = totals.shipping();
        this.taxTotal = totals.tax();
        this.grandTotal = totals.grandTotal();
    }

    public void attachCoupon(String couponCode) {
        this.couponCode = couponCode;
    }

    public void detachCoupon() {
        this.couponCode = null;
    }

    // ====================================
    // 상태 전이
    // ====================================

    public void touch(LocalDateTime now, Duration ttl) {
        this.lastActivityAt = now;
        this.expiresAt = now.plus(ttl);
    }

    public void convert() {
        validateMutable();
        this.status = CartStatus.CONVERTED;
        this.activeOwnerKey = null;
    }

    /**
     * 결제 전 주문 취소 시 장바구니를 다시 연다.
     * 주문 쪽에서 예약을 이미 해제했으므로 라인 예약 수량은 0으로 되돌린다.
     */
    public void reopen(LocalDateTime now, Duration ttl) {
        if (this.status != CartStatus.CONVERTED) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("주문 전환된 장바구니만 다시 열 수 있습니다. 현재 상태: %s", this.status)
            );
        }
        this.status = CartStatus.ACTIVE;
        this.activeOwnerKey = ownerKey();
        this.items.forEach(CartItem::clearReservation);
        touch(now, ttl);
    }

    public void abandon(LocalDateTime now) {
        if (this.status != CartStatus.ACTIVE) {
            throw new BusinessException(
                ErrorCode.INVALID_INPUT,
                String.format("활성 장바구니만 만료 처리할 수 있습니다. 현재 상태: %s", this.status)
            );
        }
        this.status = CartStatus.ABANDONED;
        this.activeOwnerKey = null;
        this.abandonedAt = now;
        this.items.forEach(CartItem::clearReservation);
    }

    public void assignTo(Long customerId) {
        this.customerId = customerId;
        this.sessionToken = null;
        if (isActive()) {
            this.activeOwnerKey = ownerKey();
        }
    }

    public String ownerKey() {
        return customerId != null
            ? ownerKey(CartOwner.customer(customerId))
            : ownerKey(CartOwner.anonymous(sessionToken));
    }

    public static String ownerKey(CartOwner owner) {
        return owner.isAuthenticated() ? "C:" + owner.customerId() : "S:" + owner.sessionToken();
    }

    public boolean isActive() {
        return this.status == CartStatus.ACTIVE;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt.isBefore(now);
    }

    public void validateMutable() {
        if (this.status == CartStatus.CONVERTED) {
            throw new BusinessException(
                ErrorCode.CART_ALREADY_CONVERTED,
                "이미 주문으로 전환된 장바구니입니다. cartId: " + id
            );
        }
        if (this.status != CartStatus.ACTIVE) {
            throw new BusinessException(
                ErrorCode.CART_NOT_FOUND,
                String.format("사용할 수 없는 장바구니입니다. cartId: %d, 상태: %s", id, status)
            );
        }
    }

    /**
     * 회원 장바구니는 같은 회원만, 비회원 장바구니는 같은 세션 토큰만 사용할 수 있다.
     */
    public void validateOwner(CartOwner owner) {
        boolean matches = this.customerId != null
            ? this.customerId.equals(owner.customerId())
            : this.sessionToken != null && this.sessionToken.equals(owner.sessionToken());

        if (!matches) {
            throw new BusinessException(
                ErrorCode.CART_OWNERSHIP_MISMATCH,
                "장바구니 소유자가 일치하지 않습니다. cartId: " + id
            );
        }
    }
}
