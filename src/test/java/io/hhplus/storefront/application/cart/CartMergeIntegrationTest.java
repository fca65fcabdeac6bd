package io.hhplus.storefront.application.cart;

import io.hhplus.storefront.application.cart.dto.CartItemResponse;
import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.domain.cart.CartOwner;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.fixture.StoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 로그인 시 장바구니 병합 통합 테스트
 * <p>
 * 라인 병합, 수량 합산, 예약 이동, 소유자 변경을 실제 DB로 검증한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestContainersConfig.class, StoreFixture.class})
class CartMergeIntegrationTest {

    @Autowired
    private CartReservationManager cartReservationManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;
    private Product shirt;
    private Product mug;
    private String sessionToken;

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
        shirt = storeFixture.stockedProduct(tenant.getId(), 2_500L, 20);
        mug = storeFixture.stockedProduct(tenant.getId(), 1_200L, 20);
        sessionToken = "sess-" + UUID.randomUUID();
    }

    private CartResponse guestCart() {
        return cartReservationManager.getOrCreateCart(tenant.getId(), null, sessionToken);
    }

    private int cartRows(Long cartId) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM carts WHERE id = ?", Integer.class, cartId);
    }

    private CartItemResponse line(CartResponse cart, Long productId) {
        return cart.items().stream()
            .filter(item -> item.productId().equals(productId))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("회원 장바구니가 있으면 같은 상품은 수량을 합치고 예약도 함께 옮긴다")
    void 병합_같은상품_수량합산_예약이동() {
        // Given
        CartOwner member = CartOwner.customer(1L);
        CartOwner guest = CartOwner.anonymous(sessionToken);
        CartResponse memberCart = cartReservationManager.getOrCreateCart(tenant.getId(), 1L, null);
        cartReservationManager.addItem(tenant.getId(), memberCart.cartId(), member, shirt.getId(), 2);
        CartResponse guestCart = guestCart();
        cartReservationManager.addItem(tenant.getId(), guestCart.cartId(), guest, shirt.getId(), 3);
        cartReservationManager.addItem(tenant.getId(), guestCart.cartId(), guest, mug.getId(), 1);

        // When
        CartResponse merged = cartReservationManager.mergeCarts(tenant.getId(), 1L, sessionToken);

        // Then
        assertThat(merged.cartId()).isEqualTo(memberCart.cartId());
        assertThat(merged.items()).hasSize(2);
        assertThat(line(merged, shirt.getId()).quantity()).isEqualTo(5);
        assertThat(line(merged, shirt.getId()).reservedQuantity()).isEqualTo(5);
        assertThat(line(merged, mug.getId()).quantity()).isEqualTo(1);
        assertThat(line(merged, mug.getId()).reservedQuantity()).isEqualTo(1);
        assertThat(merged.subtotalCents()).isEqualTo(5 * 2_500L + 1_200L);

        // 예약은 라인과 함께 이동했으므로 창고 예약 수량은 그대로다
        assertThat(storeFixture.reservedQty(tenant.getId(), shirt.getId())).isEqualTo(5);
        assertThat(storeFixture.reservedQty(tenant.getId(), mug.getId())).isEqualTo(1);
        assertThat(cartRows(guestCart.cartId())).isZero();
    }

    @Test
    @DisplayName("회원 장바구니가 없으면 비회원 장바구니의 소유자를 회원으로 바꾼다")
    void 병합_회원장바구니없음_소유자변경() {
        // Given
        CartResponse guestCart = guestCart();
        cartReservationManager.addItem(tenant.getId(), guestCart.cartId(), CartOwner.anonymous(sessionToken), shirt.getId(), 2);

        // When
        CartResponse merged = cartReservationManager.mergeCarts(tenant.getId(), 7L, sessionToken);

        // Then
        assertThat(merged.cartId()).isEqualTo(guestCart.cartId());
        assertThat(merged.customerId()).isEqualTo(7L);
        assertThat(line(merged, shirt.getId()).reservedQuantity()).isEqualTo(2);
        assertThat(storeFixture.reservedQty(tenant.getId(), shirt.getId())).isEqualTo(2);

        // 이후 회원 조회는 같은 장바구니를 돌려준다
        CartResponse memberCart = cartReservationManager.getOrCreateCart(tenant.getId(), 7L, null);
        assertThat(memberCart.cartId()).isEqualTo(guestCart.cartId());
    }

    @Test
    @DisplayName("병합할 비회원 장바구니가 없으면 회원 장바구니를 돌려준다")
    void 병합_비회원장바구니없음_회원장바구니() {
        // Given
        CartResponse memberCart = cartReservationManager.getOrCreateCart(tenant.getId(), 3L, null);

        // When
        CartResponse merged = cartReservationManager.mergeCarts(tenant.getId(), 3L, "sess-unknown-" + UUID.randomUUID());

        // Then
        assertThat(merged.cartId()).isEqualTo(memberCart.cartId());
        assertThat(merged.items()).isEmpty();
    }
}
