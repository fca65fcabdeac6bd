package io.hhplus.storefront.domain.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 처리된 게이트웨이 이벤트
 *
 * event_id 유니크 제약으로 같은 이벤트의 두 번째 insert는 실패한다.
 * 정산 트랜잭션 안에서 가장 먼저 insert하여 재전송/동시 전송을 한 번만 반영한다.
 */
@Entity
@Table(
    name = "processed_webhook_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_processed_event_id", columnNames = "event_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedWebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 100)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "processed_at", nullable = false)
    private LocalDateTime processedAt;

    public static ProcessedWebhookEvent of(String eventId, String eventType, LocalDateTime processedAt) {
        ProcessedWebhookEvent event = new ProcessedWebhookEvent();
        event.eventId = eventId;
        event.eventType = eventType;
        event.processedAt = processedAt;
        return event;
    }
}
