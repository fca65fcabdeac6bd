package io.hhplus.storefront.presentation.api.cart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.config.TestContainersConfig;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.fixture.StoreFixture;
import io.hhplus.storefront.presentation.common.RequestHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@Import({TestContainersConfig.class, StoreFixture.class})
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CartControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StoreFixture storeFixture;

    private Tenant tenant;
    private Product product;

    @BeforeEach
    void setUp() {
        tenant = storeFixture.tenant();
        product = storeFixture.stockedProduct(tenant.getId(), 2_500L, 5);
    }

    private Long createCart(Long customerId) throws Exception {
        String body = mockMvc.perform(post("/api/carts")
                .header(RequestHeaders.TENANT_ID, tenant.getId())
                .header(RequestHeaders.CUSTOMER_ID, customerId))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.get("cartId").asLong();
    }

    // ====================================
    // 장바구니 생성 (POST /api/carts)
    // ====================================

    @Test
    @DisplayName("비회원 장바구니 생성 - 세션 토큰을 발급한다")
    void createCart_비회원_세션발급() throws Exception {
        mockMvc.perform(post("/api/carts")
                .header(RequestHeaders.TENANT_ID, tenant.getId()))
            .andDo(print())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.sessionToken").isNotEmpty())
            .andExpect(jsonPath("$.customerId").value(nullValue()));
    }

    @Test
    @DisplayName("테넌트 헤더 누락 - 400")
    void createCart_테넌트헤더누락_400() throws Exception {
        mockMvc.perform(post("/api/carts"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"));
    }

    // ====================================
    // 상품 담기 (POST /api/carts/{cartId}/items)
    // ====================================

    @Test
    @DisplayName("상품 담기 성공 - 201, 금액 재계산")
    void addItem_성공() throws Exception {
        // Given
        Long cartId = createCart(1L);
        String requestBody = String.format("""
            {
              "productId": %d,
              "quantity": 2
            }
            """, product.getId());

        // When & Then
        mockMvc.perform(post("/api/carts/{cartId}/items", cartId)
                .header(RequestHeaders.TENANT_ID, tenant.getId())
                .header(RequestHeaders.CUSTOMER_ID, 1L)
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody))
            .andDo(print())
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.items", hasSize(1)))
            .andExpect(jsonPath("$.items[0].quantity").value(2))
            .andExpect(jsonPath("$.items[0].reservedQuantity").value(2))
            .andExpect(jsonPath("$.subtotalCents").value(5_000));
    }

    @Test
    @DisplayName("재고 초과 담기 - 409 INSUFFICIENT_STOCK")
    void addItem_재고부족_409() throws Exception {
        // Given
        Long cartId = createCart(1L);
        String requestBody = String.format("""
            {
              "productId": %d,
              "quantity": 6
            }
            """, product.getId());

        // When & Then
        mockMvc.perform(post("/api/carts/{cartId}/items", cartId)
                .header(RequestHeaders.TENANT_ID, tenant.getId())
                .header(RequestHeaders.CUSTOMER_ID, 1L)
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.code").value("S002"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("수량 0 담기 - 400 검증 실패")
    void addItem_수량0_400() throws Exception {
        // Given
        Long cartId = createCart(1L);
        String requestBody = String.format("""
            {
              "productId": %d,
              "quantity": 0
            }
            """, product.getId());

        // When & Then
        mockMvc.perform(post("/api/carts/{cartId}/items", cartId)
                .header(RequestHeaders.TENANT_ID, tenant.getId())
                .header(RequestHeaders.CUSTOMER_ID, 1L)
                .contentType(MediaType.APPLICATION_JSON)
                .content(requestBody))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("COMMON002"));
    }

    @Test
    @DisplayName("존재하지 않는 장바구니 조회 - 404")
    void getCart_없음_404() throws Exception {
        mockMvc.perform(get("/api/carts/{cartId}", 999_999_999L)
                .header(RequestHeaders.TENANT_ID, tenant.getId())
                .header(RequestHeaders.CUSTOMER_ID, 1L))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("CART001"));
    }
}
