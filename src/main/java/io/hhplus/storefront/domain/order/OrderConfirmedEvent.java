package io.hhplus.storefront.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 확정 이벤트
 *
 * 발행 시점: 결제 확정(웹훅 정산) 트랜잭션 커밋 직후
 *
 * 처리:
 * - 재고 확정 차감
 * - 쿠폰 사용 집계
 * - 고객 알림, 테넌트 웹훅
 *
 * 각 후속 처리는 독립적으로 실행되며 실패는 FailedOperation으로 기록된다.
 */
@Getter
@AllArgsConstructor
public class OrderConfirmedEvent {
    private final Long tenantId;
    private final Long orderId;
    private final String orderNumber;
}
