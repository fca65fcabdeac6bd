package io.hhplus.storefront.application.cart;

import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.application.checkout.CheckoutOrchestrator;
import io.hhplus.storefront.application.checkout.dto.AddressRequest;
import io.hhplus.storefront.application.checkout.dto.CheckoutResponse;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.cart.CartStatus;
import io.hhplus.storefront.domain.order.OrderStatus;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.fixture.StoreFixture;
import io.hhplus.storefront.infrastructure.batch.CartExpiryReaper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * 장바구니 예약 생명주기 통합 테스트
 * <p>
 * 담기/수량 변경/비우기, 체크아웃 취소 후 재오픈, 만료 리퍼의 예약 해제를 실제 DB로 검증한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestContainersConfig.class, StoreFixture.class})
class CartLifecycleIntegrationTest {

    @Autowired
    private CartReservationManager cartReservationManager;

    @Autowired
    private CheckoutOrchestrator checkoutOrchestrator;

    @Autowired
    private CartExpiryReaper cartExpiryReaper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;
    private Product product;
    private final CartOwner owner = CartOwner.customer(1L);

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
        product = storeFixture.stockedProduct(tenant.getId(), 2_500L, 10);
    }

    private long reserved() {
        return storeFixture.reservedQty(tenant.getId(), product.getId());
    }

    @Test
    @DisplayName("담기 → 수량 변경 → 비우기 - 예약 수량이 라인 수량을 그대로 따른다")
    void 담기_수량변경_비우기() {
        // Given
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);

        // When & Then
        CartResponse added = cartReservationManager.addItem(tenant.getId(), cart.cartId(), owner, product.getId(), 3);
        assertThat(reserved()).isEqualTo(3);

        Long cartItemId = added.items().get(0).cartItemId();
        cartReservationManager.updateItem(tenant.getId(), cart.cartId(), owner, cartItemId, 5);
        assertThat(reserved()).isEqualTo(5);

        cartReservationManager.updateItem(tenant.getId(), cart.cartId(), owner, cartItemId, 2);
        assertThat(reserved()).isEqualTo(2);

        cartReservationManager.clearCart(tenant.getId(), cart.cartId(), owner);
        assertThat(reserved()).isZero();
        assertThat(storeFixture.actualQty(tenant.getId(), product.getId())).isEqualTo(10);
    }

    @Test
    @DisplayName("다른 회원의 장바구니는 조회할 수 없다")
    void 소유자불일치_예외발생() {
        // Given
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);

        // When & Then
        assertThatThrownBy(() -> cartReservationManager.getCart(tenant.getId(), cart.cartId(), CartOwner.customer(2L)))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CART_OWNERSHIP_MISMATCH);
    }

    @Test
    @DisplayName("결제 전 체크아웃 취소 - 예약이 풀리고 장바구니가 다시 열린다")
    void 체크아웃취소_장바구니재오픈() {
        // Given
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);
        cartReservationManager.addItem(tenant.getId(), cart.cartId(), owner, product.getId(), 4);
        CheckoutResponse checkout = checkoutOrchestrator.createCheckout(
            tenant.getId(),
            owner,
            new CreateCheckoutRequest(
                cart.cartId(), "buyer@example.com", null,
                new AddressRequest("김항해", "1 Main St", null, "Austin", "TX", "78701", "US"),
                null, null
            )
        );
        assertThat(reserved()).isEqualTo(4);

        // When
        OrderResponse cancelled = checkoutOrchestrator.cancelCheckout(tenant.getId(), checkout.order().orderId());

        // Then
        assertThat(cancelled.status()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(reserved()).isZero();
        CartResponse reopened = cartReservationManager.getCart(tenant.getId(), cart.cartId(), owner);
        assertThat(reopened.status()).isEqualTo(CartStatus.ACTIVE);
        assertThat(reopened.items()).hasSize(1);
    }

    @Test
    @DisplayName("만료된 장바구니 - 리퍼가 예약을 해제하고 ABANDONED로 바꾼다")
    void 만료장바구니_리퍼_예약해제() {
        // Given
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);
        cartReservationManager.addItem(tenant.getId(), cart.cartId(), owner, product.getId(), 3);
        jdbcTemplate.update(
            "UPDATE carts SET expires_at = ? WHERE id = ?",
            LocalDateTime.now().minusHours(1), cart.cartId()
        );

        // When
        cartExpiryReaper.releaseExpiredCarts();

        // Then
        assertThat(reserved()).isZero();
        Integer abandoned = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM carts WHERE id = ? AND status = 'ABANDONED'", Integer.class, cart.cartId()
        );
        assertThat(abandoned).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 회원의 동시 장바구니 조회 - 활성 장바구니는 하나만 생긴다")
    void 동시생성_활성장바구니_하나() throws InterruptedException {
        // Given
        int threads = 5;
        Long customerId = 77L;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        Set<Long> cartIds = ConcurrentHashMap.newKeySet();

        // When
        for (int i = 0; i < threads; i++) {
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    cartIds.add(cartReservationManager.getOrCreateCart(tenant.getId(), customerId, null).cartId());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        done.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(cartIds).hasSize(1);
        Integer active = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM carts WHERE tenant_id = ? AND customer_id = ? AND status = 'ACTIVE'",
            Integer.class, tenant.getId(), customerId
        );
        assertThat(active).isEqualTo(1);
    }
}
