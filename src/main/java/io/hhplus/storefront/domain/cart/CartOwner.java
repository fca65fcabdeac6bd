package io.hhplus.storefront.domain.cart;

/**
 * 장바구니 요청자
 *
 * 로그인 고객은 customerId, 비회원은 sessionToken으로 식별한다.
 */
public record CartOwner(Long customerId, String sessionToken) {

    public static CartOwner customer(Long customerId) {
        return new CartOwner(customerId, null);
    }

    public static CartOwner anonymous(String sessionToken) {
        return new CartOwner(null, sessionToken);
    }

    public boolean isAuthenticated() {
        return customerId != null;
    }
}
