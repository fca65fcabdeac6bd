package io.hhplus.storefront.application.cart;

import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.application.inventory.StockLedger;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.config.StorefrontProperties;
import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartItem;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.cart.CartRepository;
import io.hhplus.storefront.domain.coupon.Coupon;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import io.hhplus.storefront.domain.coupon.CouponUsageRepository;
import io.hhplus.storefront.domain.inventory.WarehouseBalance;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.product.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 장바구니 + 재고 예약 관리
 *
 * 장바구니에 담는 순간 재고를 예약한다. 각 라인의 reservedQuantity는 그 라인이 실제로 잡고 있는
 * 예약 수량이며, 모든 변경은 수량 차이(delta)만큼만 원장을 조정한다.
 *
 * 잠금 순서: 장바구니 행 → 상품 잔량 행 (상품 ID 오름차순).
 * 체크아웃과 만료 처리도 같은 순서를 따른다.
 */
@Slf4j
@Service
public class CartReservationManager {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final CouponRepository couponRepository;
    private final CouponUsageRepository couponUsageRepository;
    private final StockLedger stockLedger;
    private final CartPricingService pricingService;
    private final Clock clock;
    private final Duration cartTtl;

    public CartReservationManager(
        CartRepository cartRepository,
        ProductRepository productRepository,
        CouponRepository couponRepository,
        CouponUsageRepository couponUsageRepository,
        StockLedger stockLedger,
        CartPricingService pricingService,
        Clock clock,
        StorefrontProperties properties
    ) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.couponRepository = couponRepository;
        this.couponUsageRepository = couponUsageRepository;
        this.stockLedger = stockLedger;
        this.pricingService = pricingService;
        this.clock = clock;
        this.cartTtl = properties.getCart().getTtl();
    }

    /**
     * 활성 장바구니를 찾거나 새로 만든다.
     * 비회원이 세션 토큰 없이 요청하면 새 토큰을 발급한다.
     *
     * 같은 소유자의 동시 생성은 활성 소유자 유니크 제약에 걸리고, 새 트랜잭션으로 한 번 더 조회해 먼저 만든 장바구니를 돌려준다.
     */
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 2, backoff = @Backoff(delay = 50))
    @Transactional
    public CartResponse getOrCreateCart(Long tenantId, Long customerId, String sessionToken) {
        LocalDateTime now = now();
        CartOwner owner = customerId != null
            ? CartOwner.customer(customerId)
            : CartOwner.anonymous(sessionToken == null || sessionToken.isBlank() ? UUID.randomUUID().toString() : sessionToken);

        Cart cart = activeCartId(tenantId, owner, now)
            .flatMap(cartId -> cartRepository.findByIdAndTenantId(cartId, tenantId))
            .orElseGet(() -> cartRepository.saveAndFlush(Cart.create(tenantId, owner, now, cartTtl)));
        return CartResponse.from(cart);
    }

    @Transactional(readOnly = true)
    public CartResponse getCart(Long tenantId, Long cartId, CartOwner owner) {
        Cart cart = cartRepository.findByIdAndTenantId(cartId, tenantId)
            .orElseThrow(() -> cartNotFound(cartId));
        cart.validateOwner(owner);
        return CartResponse.from(cart);
    }

    /**
     * 상품 담기. 이미 있는 상품이면 수량을 합친다.
     */
    @Transactional
    public CartResponse addItem(Long tenantId, Long cartId, CartOwner owner, Long productId, int quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);
        Product product = productRepository.findPublishedOrThrow(tenantId, productId);

        CartItem item = cart.findItemByProductId(productId).orElse(null);
        long requested = item == null ? quantity : (long) item.getQuantity() + quantity;
        if (requested > CartItem.MAX_QUANTITY) {
            throw new BusinessException(
                ErrorCode.INVALID_QUANTITY,
                String.format("라인 수량은 %d 이하여야 합니다. 합계: %d", CartItem.MAX_QUANTITY, requested)
            );
        }
        int targetQuantity = (int) requested;
        int delta = targetQuantity - (item == null ? 0 : item.getReservedQuantity());

        if (delta > 0) {
            stockLedger.reserve(tenantId, productId, delta);
        } else if (delta < 0) {
            stockLedger.release(tenantId, productId, -delta);
        }

        if (item == null) {
            item = cart.addItem(productId, targetQuantity, product.getPriceCents());
        } else {
            item.changeQuantity(targetQuantity);
        }
        item.adjustReservation(delta);

        log.info("장바구니 상품 담기: cartId={}, productId={}, quantity={}", cartId, productId, targetQuantity);
        return saveRepriced(cart, now);
    }

    /**
     * 라인 수량 변경. 0이면 라인을 삭제한다.
     */
    @Transactional
    public CartResponse updateItem(Long tenantId, Long cartId, CartOwner owner, Long cartItemId, int quantity) {
        if (quantity < 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        if (quantity == 0) {
            return removeItem(tenantId, cartId, owner, cartItemId);
        }

        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);
        CartItem item = cart.findItemOrThrow(cartItemId);

        int delta = quantity - item.getReservedQuantity();
        if (delta > 0) {
            stockLedger.reserve(tenantId, item.getProductId(), delta);
        } else if (delta < 0) {
            stockLedger.release(tenantId, item.getProductId(), -delta);
        }

        item.changeQuantity(quantity);
        item.adjustReservation(delta);

        return saveRepriced(cart, now);
    }

    @Transactional
    public CartResponse removeItem(Long tenantId, Long cartId, CartOwner owner, Long cartItemId) {
        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);
        CartItem item = cart.findItemOrThrow(cartItemId);

        stockLedger.release(tenantId, item.getProductId(), item.getReservedQuantity());
        cart.removeItem(item);

        return saveRepriced(cart, now);
    }

    /**
     * 쿠폰 적용
     *
     * 쿠폰 행을 잠근 상태에서 기간, 전체 한도, 고객별 한도, 최소 주문 금액을 검증한다.
     * 사용 횟수는 결제 확정 후에만 증가한다.
     */
    @Transactional
    public CartResponse applyCoupon(Long tenantId, Long cartId, CartOwner owner, String code) {
        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);

        Coupon coupon = couponRepository.findByCodeForUpdate(tenantId, Coupon.normalize(code))
            .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_COUPON, "존재하지 않는 쿠폰입니다. code: " + code));

        long customerUsage = cart.getCustomerId() == null
            ? 0L
            : couponUsageRepository.countByCouponIdAndCustomerId(coupon.getId(), cart.getCustomerId());

        pricingService.reprice(cart);
        coupon.validateApplicable(cart.getSubtotal(), customerUsage, now);

        cart.attachCoupon(coupon.getCode());
        log.info("쿠폰 적용: cartId={}, code={}", cartId, coupon.getCode());
        return saveRepriced(cart, now);
    }

    @Transactional
    public CartResponse removeCoupon(Long tenantId, Long cartId, CartOwner owner) {
        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);
        cart.detachCoupon();
        return saveRepriced(cart, now);
    }

    /**
     * 로그인 시 비회원 장바구니 병합
     *
     * - 회원 장바구니가 없으면 비회원 장바구니의 소유자를 회원으로 바꾼다.
     * - 있으면 라인을 회원 장바구니로 옮기고 (같은 상품은 수량 합산) 비회원 장바구니를 삭제한다.
     *
     * 예약은 라인과 함께 이동하므로 재고 원장은 바뀌지 않는다.
     */
    @Retryable(retryFor = DataIntegrityViolationException.class, maxAttempts = 2, backoff = @Backoff(delay = 50))
    @Transactional
    public CartResponse mergeCarts(Long tenantId, Long customerId, String sessionToken) {
        if (customerId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "병합하려면 회원 ID가 필요합니다");
        }
        LocalDateTime now = now();

        Long anonymousId = sessionToken == null
            ? null
            : activeCartId(tenantId, CartOwner.anonymous(sessionToken), now).orElse(null);
        if (anonymousId == null) {
            return getOrCreateCart(tenantId, customerId, null);
        }

        Long customerCartId = activeCartId(tenantId, CartOwner.customer(customerId), now).orElse(null);
        if (customerCartId == null) {
            Cart locked = lockCart(anonymousId);
            locked.validateMutable();
            locked.assignTo(customerId);
            cartRepository.saveAndFlush(locked);
            log.info("비회원 장바구니 소유자 변경: cartId={}, customerId={}", anonymousId, customerId);
            return saveRepriced(locked, now);
        }

        // 두 장바구니를 ID 오름차순으로 잠근다
        Cart source;
        Cart target;
        if (anonymousId < customerCartId) {
            source = lockCart(anonymousId);
            target = lockCart(customerCartId);
        } else {
            target = lockCart(customerCartId);
            source = lockCart(anonymousId);
        }
        source.validateMutable();
        target.validateMutable();

        for (CartItem line : List.copyOf(source.getItems())) {
            CartItem existing = target.findItemByProductId(line.getProductId()).orElse(null);
            if (existing == null) {
                existing = target.addItem(line.getProductId(), line.getQuantity(), line.getUnitPriceCents());
            } else {
                existing.changeQuantity(existing.getQuantity() + line.getQuantity());
            }
            existing.adjustReservation(line.getReservedQuantity());
        }

        if (target.getCouponCode() == null && source.getCouponCode() != null) {
            target.attachCoupon(source.getCouponCode());
        }

        cartRepository.delete(source);
        log.info("장바구니 병합: from={}, to={}, customerId={}", anonymousId, customerCartId, customerId);
        return saveRepriced(target, now);
    }

    /**
     * 모든 라인의 예약을 해제하고 라인과 쿠폰을 비운다.
     */
    @Transactional
    public CartResponse clearCart(Long tenantId, Long cartId, CartOwner owner) {
        LocalDateTime now = now();
        Cart cart = lockMutableCart(tenantId, cartId, owner, now);

        releaseLineReservations(cart);
        cart.clearItems();
        cart.detachCoupon();

        return saveRepriced(cart, now);
    }

    /**
     * 라인별 예약을 상품 ID 오름차순 잠금으로 해제한다. 라인의 예약 수량은 0이 된다.
     */
    public void releaseLineReservations(Cart cart) {
        List<CartItem> lines = cart.itemsInLockOrder();
        Map<Long, List<WarehouseBalance>> locked = stockLedger.lockItems(
            cart.getTenantId(),
            lines.stream().map(CartItem::getProductId).toList()
        );
        for (CartItem line : lines) {
            if (line.getReservedQuantity() > 0) {
                stockLedger.releaseFrom(locked.get(line.getProductId()), line.getProductId(), line.getReservedQuantity());
            }
            line.clearReservation();
        }
    }

    /**
     * 만료되지 않은 활성 장바구니 ID.
     * 만료된 채 리퍼를 기다리는 활성 장바구니가 있으면 여기서 예약을 풀고 ABANDONED로 바꿔 새 장바구니를 만들 수 있게 한다.
     * 엔티티를 잠금 전에 올리지 않도록 ID만 돌려준다.
     */
    private Optional<Long> activeCartId(Long tenantId, CartOwner owner, LocalDateTime now) {
        Optional<Long> live = owner.isAuthenticated()
            ? cartRepository.findActiveIdByCustomer(tenantId, owner.customerId(), now)
            : cartRepository.findActiveIdBySession(tenantId, owner.sessionToken(), now);
        if (live.isPresent()) {
            return live;
        }

        cartRepository.findIdByActiveOwnerKey(tenantId, Cart.ownerKey(owner)).ifPresent(staleId -> {
            Cart stale = lockCart(staleId);
            if (stale.isActive() && stale.isExpired(now)) {
                releaseLineReservations(stale);
                stale.abandon(now);
                cartRepository.saveAndFlush(stale);
                log.info("만료된 활성 장바구니 정리: cartId={}, owner={}", staleId, Cart.ownerKey(owner));
            }
        });
        return Optional.empty();
    }

    private Cart lockMutableCart(Long tenantId, Long cartId, CartOwner owner, LocalDateTime now) {
        Cart cart = lockCart(cartId);
        if (!cart.getTenantId().equals(tenantId)) {
            throw cartNotFound(cartId);
        }
        cart.validateOwner(owner);
        cart.validateMutable();
        if (cart.isExpired(now)) {
            throw new BusinessException(ErrorCode.CART_NOT_FOUND, "만료된 장바구니입니다. cartId: " + cartId);
        }
        return cart;
    }

    private Cart lockCart(Long cartId) {
        return cartRepository.findByIdForUpdate(cartId).orElseThrow(() -> cartNotFound(cartId));
    }

    private CartResponse saveRepriced(Cart cart, LocalDateTime now) {
        pricingService.reprice(cart);
        cart.touch(now, cartTtl);
        return CartResponse.from(cartRepository.saveAndFlush(cart));
    }

    private BusinessException cartNotFound(Long cartId) {
        return new BusinessException(ErrorCode.CART_NOT_FOUND, "장바구니를 찾을 수 없습니다. cartId: " + cartId);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
