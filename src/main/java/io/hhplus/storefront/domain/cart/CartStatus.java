package io.hhplus.storefront.domain.cart;

public enum CartStatus {
    ACTIVE,     // 변경 가능
    CONVERTED,  // 주문 전환 완료 (주문 취소 시에만 ACTIVE로 복귀)
    ABANDONED   // 만료되어 예약 해제됨
}
