package io.hhplus.storefront.presentation.common;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.cart.CartOwner;

/**
 * 인증 계층 앞단에서 넘겨주는 식별 헤더
 */
public final class RequestHeaders {

    public static final String TENANT_ID = "X-Tenant-Id";
    public static final String CUSTOMER_ID = "X-Customer-Id";
    public static final String CART_SESSION = "X-Cart-Session";

    private RequestHeaders() {
    }

    public static CartOwner owner(Long customerId, String sessionToken) {
        if (customerId != null) {
            return CartOwner.customer(customerId);
        }
        if (sessionToken == null || sessionToken.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "X-Customer-Id 또는 X-Cart-Session 헤더가 필요합니다");
        }
        return CartOwner.anonymous(sessionToken);
    }
}
