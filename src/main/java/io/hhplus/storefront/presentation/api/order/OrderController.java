package io.hhplus.storefront.presentation.api.order;

import io.hhplus.storefront.application.order.OrderAdminService;
import io.hhplus.storefront.application.order.dto.OrderResponse;
import io.hhplus.storefront.application.order.dto.UpdateOrderStatusRequest;
import io.hhplus.storefront.application.payment.RefundService;
import io.hhplus.storefront.application.payment.dto.CreateRefundRequest;
import io.hhplus.storefront.application.payment.dto.PaymentResponse;
import io.hhplus.storefront.application.payment.dto.RefundResponse;
import io.hhplus.storefront.presentation.common.RequestHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 운영자용 주문 API
 */
@Validated
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderAdminService orderAdminService;
    private final RefundService refundService;

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId,
        @Valid @RequestBody UpdateOrderStatusRequest request
    ) {
        return ResponseEntity.ok(orderAdminService.transitionStatus(tenantId, orderId, request.status()));
    }

    /**
     * 환불 요청. 실제 주문 상태 변경은 게이트웨이 환불 웹훅이 도착한 뒤에 일어나므로 202를 돌려준다.
     */
    @PostMapping("/{orderId}/refunds")
    public ResponseEntity<RefundResponse> createRefund(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId,
        @Valid @RequestBody CreateRefundRequest request
    ) {
        RefundResponse response = refundService.createRefund(tenantId, orderId, request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/{orderId}/payments")
    public ResponseEntity<List<PaymentResponse>> getPayments(
        @RequestHeader(RequestHeaders.TENANT_ID) Long tenantId,
        @PathVariable Long orderId
    ) {
        return ResponseEntity.ok(refundService.getOrderPayments(tenantId, orderId));
    }
}
