package io.hhplus.storefront.application.fulfillment.operation;

import io.hhplus.storefront.application.cart.CartReservationManager;
import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.application.checkout.CheckoutOrchestrator;
import io.hhplus.storefront.application.checkout.dto.AddressRequest;
import io.hhplus.storefront.application.checkout.dto.CheckoutResponse;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.coupon.Coupon;
import io.hhplus.storefront.domain.coupon.CouponRepository;
import io.hhplus.storefront.domain.coupon.CouponUsageRepository;
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

/**
 * 쿠폰 사용 집계 재실행 통합 테스트
 * <p>
 * 최초 실행과 재시도 스케줄러의 재실행이 겹쳐도 사용 횟수가 한 번만 오르는지 실제 DB로 검증한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestContainersConfig.class, StoreFixture.class})
class CouponTrackingOperationIntegrationTest {

    @Autowired
    private CouponTrackingOperation couponTrackingOperation;

    @Autowired
    private CouponRepository couponRepository;

    @Autowired
    private CouponUsageRepository couponUsageRepository;

    @Autowired
    private CartReservationManager cartReservationManager;

    @Autowired
    private CheckoutOrchestrator checkoutOrchestrator;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;
    private Coupon coupon;
    private CheckoutResponse checkout;

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
        Product product = storeFixture.stockedProduct(tenant.getId(), 2_500L, 10);
        coupon = couponRepository.save(Coupon.fixedAmount(tenant.getId(), "WELCOME", 500L));

        CartOwner owner = CartOwner.customer(1L);
        CartResponse cart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);
        cartReservationManager.addItem(tenant.getId(), cart.cartId(), owner, product.getId(), 2);
        cartReservationManager.applyCoupon(tenant.getId(), cart.cartId(), owner, "WELCOME");
        checkout = checkoutOrchestrator.createCheckout(
            tenant.getId(),
            owner,
            new CreateCheckoutRequest(
                cart.cartId(), "buyer@example.com", null,
                new AddressRequest("김항해", "1 Main St", null, "Austin", "TX", "78701", "US"),
                null, null
            )
        );
    }

    @Test
    @DisplayName("같은 주문으로 두 번 실행해도 사용 횟수는 한 번만 오른다")
    void execute_두번실행_한번집계() {
        // Given
        OrderOperationPayload payload = new OrderOperationPayload(
            checkout.order().orderId(), checkout.order().orderNumber()
        );

        // When
        couponTrackingOperation.execute(tenant.getId(), payload);
        couponTrackingOperation.execute(tenant.getId(), payload);

        // Then
        Coupon reloaded = couponRepository.findByTenantIdAndCode(tenant.getId(), "WELCOME").orElseThrow();
        assertThat(reloaded.getTimesUsed()).isEqualTo(1);
        assertThat(couponUsageRepository.existsByCouponIdAndOrderId(coupon.getId(), checkout.order().orderId())).isTrue();
        assertThat(couponUsageRepository.countByCouponIdAndCustomerId(coupon.getId(), 1L)).isEqualTo(1L);
    }
}
