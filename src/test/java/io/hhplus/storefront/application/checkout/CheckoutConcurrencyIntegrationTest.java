package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.application.cart.CartReservationManager;
import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.application.checkout.dto.AddressRequest;
import io.hhplus.storefront.application.checkout.dto.CheckoutResponse;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.customer.CustomerCreditAccount;
import io.hhplus.storefront.domain.customer.CustomerCreditAccountRepository;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.fixture.StoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 체크아웃 동시성 테스트
 * <p>
 * 시나리오:
 * - 같은 장바구니로 동시에 두 번 체크아웃 → 한 건만 주문이 된다
 * - 재고 10개 상품을 20명이 동시에 담기 → 10명만 예약 성공, 재고는 음수가 되지 않는다
 * - 여러 장바구니 동시 체크아웃 → 주문 번호가 중복 없이 1부터 연속으로 발급된다
 * - 같은 청구 계정의 고객들이 동시에 체크아웃 → 신용 한도 안에서만 주문이 된다
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestContainersConfig.class, StoreFixture.class})
class CheckoutConcurrencyIntegrationTest {

    @Autowired
    private CheckoutOrchestrator checkoutOrchestrator;

    @Autowired
    private CartReservationManager cartReservationManager;

    @Autowired
    private CustomerCreditAccountRepository creditAccountRepository;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
    }

    private CreateCheckoutRequest checkoutRequest(Long cartId) {
        return new CreateCheckoutRequest(
            cartId,
            "buyer@example.com",
            null,
            new AddressRequest("김항해", "1 Main St", null, "Austin", "TX", "78701", "US"),
            null,
            null
        );
    }

    @Test
    @DisplayName("같은 장바구니 동시 체크아웃 - 한 건만 성공, 나머지는 CART_ALREADY_CONVERTED")
    void 같은장바구니_동시체크아웃() throws InterruptedException {
        // Given
        Product product = storeFixture.stockedProduct(tenant.getId(), 2_500L, 10);
        CartOwner owner = CartOwner.customer(1L);
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);
        cartReservationManager.addItem(tenant.getId(), cart.cartId(), owner, product.getId(), 2);

        int threads = 2;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger convertedCount = new AtomicInteger();

        // When
        for (int i = 0; i < threads; i++) {
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    checkoutOrchestrator.createCheckout(tenant.getId(), owner, checkoutRequest(cart.cartId()));
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode() == ErrorCode.CART_ALREADY_CONVERTED) {
                        convertedCount.incrementAndGet();
                    }
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
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(convertedCount.get()).isEqualTo(1);
        assertThat(storeFixture.reservedQty(tenant.getId(), product.getId())).isEqualTo(2);
        assertThat(storeFixture.actualQty(tenant.getId(), product.getId())).isEqualTo(10);
    }

    @Test
    @DisplayName("재고 10개 상품을 20명이 동시에 담기 - 10명만 예약, 초과 예약 없음")
    void 동시담기_초과예약없음() throws InterruptedException {
        // Given
        Product product = storeFixture.stockedProduct(tenant.getId(), 1_000L, 10);
        int customers = 20;
        List<CartResponse> carts = new ArrayList<>();
        for (long customerId = 1; customerId <= customers; customerId++) {
            carts.add(cartReservationManager.getOrCreateCart(tenant.getId(), customerId, null));
        }

        ExecutorService executorService = Executors.newFixedThreadPool(customers);
        CountDownLatch latch = new CountDownLatch(customers);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger stockErrorCount = new AtomicInteger();

        // When
        for (CartResponse cart : carts) {
            executorService.submit(() -> {
                try {
                    cartReservationManager.addItem(
                        tenant.getId(), cart.cartId(), CartOwner.customer(cart.customerId()), product.getId(), 1
                    );
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode() == ErrorCode.INSUFFICIENT_STOCK) {
                        stockErrorCount.incrementAndGet();
                    }
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(30, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(successCount.get()).isEqualTo(10);
        assertThat(stockErrorCount.get()).isEqualTo(10);
        assertThat(storeFixture.reservedQty(tenant.getId(), product.getId())).isEqualTo(10);
        assertThat(storeFixture.actualQty(tenant.getId(), product.getId())).isEqualTo(10);
    }

    @Test
    @DisplayName("여러 장바구니 동시 체크아웃 - 주문 번호는 중복 없이 연속 발급")
    void 동시체크아웃_주문번호연속() throws InterruptedException {
        // Given
        Product product = storeFixture.stockedProduct(tenant.getId(), 1_000L, 100);
        int customers = 10;
        List<CartResponse> carts = new ArrayList<>();
        for (long customerId = 1; customerId <= customers; customerId++) {
            CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), customerId, null);
            cartReservationManager.addItem(tenant.getId(), cart.cartId(), CartOwner.customer(customerId), product.getId(), 1);
            carts.add(cart);
        }

        ExecutorService executorService = Executors.newFixedThreadPool(customers);
        CountDownLatch latch = new CountDownLatch(customers);
        Queue<String> orderNumbers = new ConcurrentLinkedQueue<>();

        // When
        for (CartResponse cart : carts) {
            executorService.submit(() -> {
                try {
                    CheckoutResponse response = checkoutOrchestrator.createCheckout(
                        tenant.getId(), CartOwner.customer(cart.customerId()), checkoutRequest(cart.cartId())
                    );
                    orderNumbers.add(response.order().orderNumber());
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await(60, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(orderNumbers).hasSize(customers).doesNotHaveDuplicates();
        assertThat(orderNumbers)
            .map(number -> Integer.parseInt(number.substring(number.lastIndexOf('-') + 1)))
            .containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    @DisplayName("같은 청구 계정 고객 5명 동시 체크아웃 - 한도 안의 한 건만 성공")
    void 신용한도_동시체크아웃_한건만() throws InterruptedException {
        // Given
        Product product = storeFixture.stockedProduct(tenant.getId(), 1_000L, 100);
        int customers = 5;
        List<CartResponse> carts = new ArrayList<>();
        for (long customerId = 1; customerId <= customers; customerId++) {
            CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), customerId, null);
            carts.add(cartReservationManager.addItem(
                tenant.getId(), cart.cartId(), CartOwner.customer(customerId), product.getId(), 1
            ));
        }
        long orderTotal = carts.get(0).grandTotalCents();
        long limit = orderTotal + orderTotal / 2;
        for (long customerId = 1; customerId <= customers; customerId++) {
            creditAccountRepository.save(CustomerCreditAccount.of(tenant.getId(), customerId, 900L, limit));
        }

        ExecutorService executorService = Executors.newFixedThreadPool(customers);
        CountDownLatch ready = new CountDownLatch(customers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(customers);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger limitErrorCount = new AtomicInteger();

        // When
        for (CartResponse cart : carts) {
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    checkoutOrchestrator.createCheckout(
                        tenant.getId(), CartOwner.customer(cart.customerId()), checkoutRequest(cart.cartId())
                    );
                    successCount.incrementAndGet();
                } catch (BusinessException e) {
                    if (e.getErrorCode() == ErrorCode.CREDIT_LIMIT_EXCEEDED) {
                        limitErrorCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        ready.await();
        start.countDown();
        done.await(60, TimeUnit.SECONDS);
        executorService.shutdown();

        // Then
        assertThat(successCount.get()).isEqualTo(1);
        assertThat(limitErrorCount.get()).isEqualTo(customers - 1);
    }
}
