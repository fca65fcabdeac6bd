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
import io.hhplus.storefront.domain.cart.CartStatus;
import io.hhplus.storefront.domain.customer.CustomerCreditAccount;
import io.hhplus.storefront.domain.customer.CustomerCreditAccountRepository;
import io.hhplus.storefront.domain.order.OrderStatus;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * B2B 신용 한도 통합 테스트
 * <p>
 * 같은 청구 계정에 묶인 고객들의 미결제 주문이 한도를 함께 소진하는지 검증한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestContainersConfig.class, StoreFixture.class})
class CreditLimitIntegrationTest {

    private static final Long BILLING_ACCOUNT_ID = 500L;

    @Autowired
    private CheckoutOrchestrator checkoutOrchestrator;

    @Autowired
    private CartReservationManager cartReservationManager;

    @Autowired
    private CustomerCreditAccountRepository creditAccountRepository;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;
    private Product product;

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
        product = storeFixture.stockedProduct(tenant.getId(), 1_000L, 50);
    }

    private CartResponse cartWithOneItem(Long customerId) {
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), customerId, null);
        return cartReservationManager.addItem(tenant.getId(), cart.cartId(), CartOwner.customer(customerId), product.getId(), 1);
    }

    private CheckoutResponse checkout(Long customerId, Long cartId) {
        return checkoutOrchestrator.createCheckout(
            tenant.getId(),
            CartOwner.customer(customerId),
            new CreateCheckoutRequest(
                cartId, "buyer@example.com", null,
                new AddressRequest("김항해", "1 Main St", null, "Austin", "TX", "78701", "US"),
                null, null
            )
        );
    }

    @Test
    @DisplayName("연결된 고객의 미결제 주문이 한도를 소진하면 체크아웃을 거절하고, 취소되면 다시 허용한다")
    void 청구계정_미결제노출_한도초과() {
        // Given
        CartResponse firstCart = cartWithOneItem(1L);
        CartResponse secondCart = cartWithOneItem(2L);
        long orderTotal = firstCart.grandTotalCents();
        long limit = orderTotal + orderTotal / 2;
        creditAccountRepository.save(CustomerCreditAccount.of(tenant.getId(), 1L, BILLING_ACCOUNT_ID, limit));
        creditAccountRepository.save(CustomerCreditAccount.of(tenant.getId(), 2L, BILLING_ACCOUNT_ID, limit));

        CheckoutResponse secondOrder = checkout(2L, secondCart.cartId());

        // When & Then
        assertThatThrownBy(() -> checkout(1L, firstCart.cartId()))
            .isInstanceOf(BusinessException.class)
            .hasFieldOrPropertyWithValue("errorCode", ErrorCode.CREDIT_LIMIT_EXCEEDED);

        // 거절된 체크아웃은 장바구니와 예약을 그대로 둔다
        CartResponse untouched = cartReservationManager.getCart(tenant.getId(), firstCart.cartId(), CartOwner.customer(1L));
        assertThat(untouched.status()).isEqualTo(CartStatus.ACTIVE);
        assertThat(untouched.items().get(0).reservedQuantity()).isEqualTo(1);

        // When
        checkoutOrchestrator.cancelCheckout(tenant.getId(), secondOrder.order().orderId());
        CheckoutResponse firstOrder = checkout(1L, firstCart.cartId());

        // Then
        assertThat(firstOrder.order().status()).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("한도가 0인 신용 계정은 검사하지 않는다")
    void 한도없음_검사생략() {
        // Given
        CartResponse cart = cartWithOneItem(3L);
        creditAccountRepository.save(CustomerCreditAccount.of(tenant.getId(), 3L, BILLING_ACCOUNT_ID, 0L));

        // When
        CheckoutResponse order = checkout(3L, cart.cartId());

        // Then
        assertThat(order.order().status()).isEqualTo(OrderStatus.PENDING);
    }
}
