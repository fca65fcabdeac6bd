package io.hhplus.storefront.application.payment.dto;

/**
 * 웹훅 정산 결과. 서명이 검증된 이벤트는 결과와 관계없이 200으로 응답한다.
 */
public enum ReconcileOutcome {
    APPLIED,
    DUPLICATE,
    IGNORED,
    AMOUNT_MISMATCH,
    RECORDED_ONLY,   // 결제는 기록했지만 주문 상태는 바꾸지 않음 (이미 PENDING이 아닌 주문)
    ORDER_NOT_FOUND
}
