package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.application.cart.CartPricingService;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.application.inventory.StockLedger;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.config.StorefrontProperties;
import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartItem;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.cart.CartRepository;
import io.hhplus.storefront.domain.cart.CartStatus;
import io.hhplus.storefront.domain.cart.CartTotals;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import io.hhplus.storefront.domain.coupon.CouponUsageRepository;
import io.hhplus.storefront.domain.inventory.WarehouseBalance;
import io.hhplus.storefront.domain.order.Order;
import io.hhplus.storefront.domain.order.OrderItem;
import io.hhplus.storefront.domain.order.OrderRepository;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.product.ProductRepository;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.domain.tenant.TenantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 체크아웃 트랜잭션 구간
 *
 * 주문 생성과 취소는 각각 하나의 DB 트랜잭션으로 실행된다. 외부 결제 호출은 여기서 하지 않는다.
 * 잠금 순서: 장바구니 행 → 상품 잔량 행(상품 ID 오름차순). 취소는 주문 행을 먼저 잡는다.
 */
@Slf4j
@Service
public class CheckoutTransactionService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final OrderRepository orderRepository;
    private final TenantRepository tenantRepository;
    private final CouponRepository couponRepository;
    private final CouponUsageRepository couponUsageRepository;
    private final StockLedger stockLedger;
    private final CartPricingService pricingService;
    private final CreditLimitPolicy creditLimitPolicy;
    private final Clock clock;
    private final Duration cartTtl;

    public CheckoutTransactionService(
        CartRepository cartRepository,
        ProductRepository productRepository,
        OrderRepository orderRepository,
        TenantRepository tenantRepository,
        CouponRepository couponRepository,
        CouponUsageRepository couponUsageRepository,
        StockLedger stockLedger,
        CartPricingService pricingService,
        CreditLimitPolicy creditLimitPolicy,
        Clock clock,
        StorefrontProperties properties
    ) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.orderRepository = orderRepository;
        this.tenantRepository = tenantRepository;
        this.couponRepository = couponRepository;
        this.couponUsageRepository = couponUsageRepository;
        this.stockLedger = stockLedger;
        this.pricingService = pricingService;
        this.creditLimitPolicy = creditLimitPolicy;
        this.clock = clock;
        this.cartTtl = properties.getCart().getTtl();
    }

    /**
     * 장바구니를 주문으로 전환한다.
     *
     * 1. 장바구니 행 잠금, 소유자/상태/만료 검증
     * 2. 빈 장바구니 거절, 금액 재계산, 쿠폰 재검증
     * 3. 신용 한도 검사 (B2B)
     * 4. 상품 잠금 후 각 라인의 예약을 수량만큼 채움 (부족하면 INSUFFICIENT_STOCK)
     * 5. 주문 + 항목 스냅샷 저장 (주문 번호는 호출자가 미리 채번)
     * 6. 장바구니 CONVERTED
     */
    @Transactional(timeoutString = "${storefront.checkout.timeout-seconds:30}")
    public OrderResponse placeOrder(Long tenantId, CartOwner owner, CreateCheckoutRequest request, String orderNumber) {
        LocalDateTime now = LocalDateTime.now(clock);

        Cart cart = cartRepository.findByIdForUpdate(request.cartId())
            .filter(found -> found.getTenantId().equals(tenantId))
            .orElseThrow(() -> new BusinessException(
                ErrorCode.CART_NOT_FOUND, "장바구니를 찾을 수 없습니다. cartId: " + request.cartId()
            ));
        cart.validateOwner(owner);
        if (cart.getStatus() == CartStatus.CONVERTED) {
            throw new BusinessException(
                ErrorCode.CART_ALREADY_CONVERTED,
                "이미 주문으로 전환된 장바구니입니다. cartId: " + cart.getId()
            );
        }
        cart.validateMutable();
        if (cart.isExpired(now)) {
            throw new BusinessException(ErrorCode.CART_NOT_FOUND, "만료된 장바구니입니다. cartId: " + cart.getId());
        }
        if (cart.isEmpty()) {
            throw new BusinessException(ErrorCode.CART_EMPTY);
        }

        CartTotals totals = pricingService.reprice(cart);
        revalidateCoupon(cart, now);

        creditLimitPolicy.check(tenantId, cart.getCustomerId(), totals.grandTotal());

        List<CartItem> lines = cart.itemsInLockOrder();
        Map<Long, List<WarehouseBalance>> locked = stockLedger.lockItems(
            tenantId, lines.stream().map(CartItem::getProductId).toList()
        );
        for (CartItem line : lines) {
            int missing = line.missingReservation();
            if (missing > 0) {
                stockLedger.reserveFrom(locked.get(line.getProductId()), line.getProductId(), missing);
                line.adjustReservation(missing);
            }
        }

        Map<Long, Product> products = loadProducts(tenantId, lines);
        Tenant tenant = tenantRepository.findByIdOrThrow(tenantId);

        Order order = Order.place(
            tenantId,
            orderNumber,
            cart.getId(),
            cart.getCustomerId(),
            request.email(),
            request.phone(),
            request.shippingAddress().toAddress(),
            request.billingAddress() != null ? request.billingAddress().toAddress() : null,
            cart.getCouponCode(),
            totals,
            tenant.getCurrency(),
            request.customerNotes()
        );
        for (CartItem line : lines) {
            Product product = products.get(line.getProductId());
            order.addItem(product.getId(), product.getSku(), product.getName(), line.getQuantity(), line.getUnitPriceCents());
        }

        Order saved = orderRepository.save(order);
        cart.convert();
        cartRepository.save(cart);

        log.info("주문 생성: orderId={}, orderNumber={}, cartId={}, total={}",
            saved.getId(), orderNumber, cart.getId(), totals.grandTotal());
        return OrderResponse.from(saved);
    }

    /**
     * 결제 전 체크아웃 취소
     *
     * 주문의 예약을 해제하고 장바구니를 다시 연다 (라인 예약 수량은 0).
     *
     * @return 취소된 주문 (결제 인텐트 취소는 호출자가 커밋 이후 처리)
     */
    @Transactional(timeoutString = "${storefront.checkout.timeout-seconds:30}")
    public OrderResponse cancel(Long tenantId, Long orderId) {
        LocalDateTime now = LocalDateTime.now(clock);

        Order order = orderRepository.findByIdForUpdate(orderId, tenantId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다. orderId: " + orderId));
        order.cancelCheckout(now);

        List<OrderItem> items = order.itemsInLockOrder();
        Map<Long, List<WarehouseBalance>> locked = stockLedger.lockItems(
            tenantId, items.stream().map(OrderItem::getProductId).toList()
        );
        for (OrderItem item : items) {
            stockLedger.releaseFrom(locked.get(item.getProductId()), item.getProductId(), item.getQuantity());
        }

        cartRepository.findByIdForUpdate(order.getCartId())
            .filter(cart -> cart.getStatus() == CartStatus.CONVERTED)
            .ifPresent(cart -> reopenCart(cart, now));

        log.info("체크아웃 취소: orderId={}, orderNumber={}", orderId, order.getOrderNumber());
        return OrderResponse.from(order);
    }

    /**
     * 소유자가 그 사이 새 장바구니를 만들었다면 활성 장바구니가 둘이 되므로 다시 열지 않는다.
     */
    private void reopenCart(Cart cart, LocalDateTime now) {
        if (cartRepository.findIdByActiveOwnerKey(cart.getTenantId(), cart.ownerKey()).isPresent()) {
            log.info("소유자의 활성 장바구니가 이미 있어 재오픈 생략: cartId={}", cart.getId());
            return;
        }
        cart.reopen(now, cartTtl);
        cartRepository.save(cart);
    }

    @Transactional(readOnly = true)
    public OrderResponse loadOrder(Long tenantId, Long orderId) {
        return OrderResponse.from(orderRepository.findByIdOrThrow(orderId, tenantId));
    }

    @Transactional(readOnly = true)
    public OrderResponse loadOrderByNumber(Long tenantId, String orderNumber) {
        return orderRepository.findByTenantIdAndOrderNumber(tenantId, orderNumber)
            .map(OrderResponse::from)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.ORDER_NOT_FOUND, "주문을 찾을 수 없습니다. orderNumber: " + orderNumber
            ));
    }

    private void revalidateCoupon(Cart cart, LocalDateTime now) {
        if (cart.getCouponCode() == null) {
            return;
        }
        couponRepository.findByTenantIdAndCode(cart.getTenantId(), cart.getCouponCode())
            .ifPresent(coupon -> {
                long customerUsage = cart.getCustomerId() == null
                    ? 0L
                    : couponUsageRepository.countByCouponIdAndCustomerId(coupon.getId(), cart.getCustomerId());
                coupon.validateApplicable(cart.getSubtotal(), customerUsage, now);
            });
    }

    private Map<Long, Product> loadProducts(Long tenantId, List<CartItem> lines) {
        Map<Long, Product> products = productRepository
            .findAllByIdIn(lines.stream().map(CartItem::getProductId).toList())
            .stream()
            .filter(product -> product.getTenantId().equals(tenantId) && product.isPublished())
            .collect(Collectors.toMap(Product::getId, Function.identity()));

        for (CartItem line : lines) {
            if (!products.containsKey(line.getProductId())) {
                throw new BusinessException(
                    ErrorCode.PRODUCT_NOT_FOUND,
                    "판매 중이 아닌 상품이 포함되어 있습니다. productId: " + line.getProductId()
                );
            }
        }
        return products;
    }
}
