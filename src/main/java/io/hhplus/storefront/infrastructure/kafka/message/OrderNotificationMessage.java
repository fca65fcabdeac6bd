package io.hhplus.storefront.infrastructure.kafka.message;

/**
 * 고객 알림 요청 메시지
 * - Kafka Topic: order-notification
 * - 실제 메일/SMS 발송은 알림 서비스가 담당한다
 */
public record OrderNotificationMessage(
    Long tenantId,
    Long orderId,
    String orderNumber,
    String template,
    String email,
    String phone
) {
}
