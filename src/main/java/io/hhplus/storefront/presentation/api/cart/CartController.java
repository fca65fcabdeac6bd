package io.hhplus.storefront.presentation.api.cart;

import io.hhplus.storefront.application.cart.CartReservationManager;
import io.hhplus.storefront.application.cart.dto.AddCartItemRequest;
import io.hhplus.storefront.application.cart.dto.ApplyCouponRequest;
import io.hhplus.storefront.application.cart.dto.CartResponse;
import io.hhplus.storefront.application.cart.dto.UpdateCartItemRequest;
import io.hhplus.storefront.presentation.common.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/carts")
@RequiredArgsConstructor
public class CartController {

    private final CartReservationManager cartReservationManager;

    /**
     * 활성 장바구니 조회 또는 생성. 비회원에게는 응답의 sessionToken으로 세션을 발급한다.
     */
    @PostMapping
    public ResponseEntity<CartResponse> getOrCreateCart(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken
    ) {
        return ResponseEntity.ok(cartReservationManager.getOrCreateCart(tenantId, customerId, sessionToken));
    }

    @GetMapping("/{cartId}")
    public ResponseEntity<CartResponse> getCart(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId
    ) {
        return ResponseEntity.ok(
            cartReservationManager.getCart(tenantId, cartId, RequestHeaders.owner(customerId, sessionToken))
        );
    }

    @PostMapping("/{cartId}/items")
    public ResponseEntity<CartResponse> addItem(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId,
        @Valid @RequestBody AddCartItemRequest request
    ) {
        CartResponse response = cartReservationManager.addItem(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken), request.productId(), request.quantity()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{cartId}/items/{cartItemId}")
    public ResponseEntity<CartResponse> updateItem(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId,
        @PathVariable Long cartItemId,
        @Valid @RequestBody UpdateCartItemRequest request
    ) {
        return ResponseEntity.ok(cartReservationManager.updateItem(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken), cartItemId, request.quantity()
        ));
    }

    @DeleteMapping("/{cartId}/items/{cartItemId}")
    public ResponseEntity<CartResponse> removeItem(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId,
        @PathVariable Long cartItemId
    ) {
        return ResponseEntity.ok(cartReservationManager.removeItem(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken), cartItemId
        ));
    }

    @PostMapping("/{cartId}/coupon")
    public ResponseEntity<CartResponse> applyCoupon(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId,
        @Valid @RequestBody ApplyCouponRequest request
    ) {
        return ResponseEntity.ok(cartReservationManager.applyCoupon(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken), request.code()
        ));
    }

    @DeleteMapping("/{cartId}/coupon")
    public ResponseEntity<CartResponse> removeCoupon(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId
    ) {
        return ResponseEntity.ok(cartReservationManager.removeCoupon(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken)
        ));
    }

    /**
     * 로그인 직후 비회원 장바구니를 회원 장바구니로 합친다.
     */
    @PostMapping("/merge")
    public ResponseEntity<CartResponse> mergeCarts(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(RequestHeaders.CUSTOMER_ID) Long customerId,
        @RequestHeader(RequestHeaders.CART_SESSION) String sessionToken
    ) {
        return ResponseEntity.ok(cartReservationManager.mergeCarts(tenantId, customerId, sessionToken));
    }

    @DeleteMapping("/{cartId}/items")
    public ResponseEntity<CartResponse> clearCart(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @PathVariable Long cartId
    ) {
        return ResponseEntity.ok(cartReservationManager.clearCart(
            tenantId, cartId, RequestHeaders.owner(customerId, sessionToken)
        ));
    }
}
