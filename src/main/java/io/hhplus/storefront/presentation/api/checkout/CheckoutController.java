package io.hhplus.storefront.presentation.api.checkout;

import io.hhplus.storefront.application.checkout.CheckoutOrchestrator;
import io.hhplus.storefront.application.checkout.dto.CheckoutResponse;
import io.hhplus.storefront.application.checkout.dto.CreateCheckoutRequest;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.presentation.common.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/api/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final CheckoutOrchestrator checkoutOrchestrator;

    /**
     * 체크아웃 생성
     *
     * 주문은 커밋되었지만 결제 인텐트 생성에 실패한 경우에도 201을 돌려준다
     * (paymentInitialized=false, 이후 retry-payment로 복구).
     */
    @PostMapping
    public ResponseEntity<CheckoutResponse> createCheckout(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @RequestHeader(value = RequestHeaders.CUSTOMER_ID, required = false) Long customerId,
        @RequestHeader(value = RequestHeaders.CART_SESSION, required = false) String sessionToken,
        @Valid @RequestBody CreateCheckoutRequest request
    ) {
        CheckoutResponse response = checkoutOrchestrator.createCheckout(
            tenantId, RequestHeaders.owner(customerId, sessionToken), request
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<CheckoutResponse> getCheckout(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId
    ) {
        return ResponseEntity.ok(checkoutOrchestrator.getCheckout(tenantId, orderId));
    }

    @GetMapping("/by-number/{orderNumber}")
    public ResponseEntity<CheckoutResponse> getCheckoutByOrderNumber(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable String orderNumber
    ) {
        return ResponseEntity.ok(checkoutOrchestrator.getCheckoutByOrderNumber(tenantId, orderNumber));
    }

    @PostMapping("/{orderId}/retry-payment")
    public ResponseEntity<CheckoutResponse> retryPaymentIntent(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId
    ) {
        return ResponseEntity.ok(checkoutOrchestrator.retryPaymentIntent(tenantId, orderId));
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelCheckout(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId
    ) {
        return ResponseEntity.ok(checkoutOrchestrator.cancelCheckout(tenantId, orderId));
    }
}
