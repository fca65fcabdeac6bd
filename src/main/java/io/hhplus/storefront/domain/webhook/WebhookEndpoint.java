package io.hhplus.storefront.domain.webhook;

import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * 테넌트가 등록한 외부 웹훅 수신 주소
 */
@Entity
@Table(name = "webhook_endpoints", indexes = @Index(name = "idx_webhook_tenant", columnList = "tenant_id, active"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WebhookEndpoint extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 500)
    private String url;

    @Column(nullable = false, length = 200)
    private String secret;

    /**
     * 구독 이벤트 목록 (콤마 구분, 예: "order.confirmed,order.cancelled")
     */
    @Column(nullable = false, length = 500)
    private String events;

    @Column(nullable = false)
    private boolean active;

    public static WebhookEndpoint register(Long tenantId, String url, String secret, String events) {
        WebhookEndpoint endpoint = new WebhookEndpoint();
        endpoint.tenantId = tenantId;
        endpoint.url = url;
        endpoint.secret = secret;
        endpoint.events = events;
        endpoint.active = true;
        return endpoint;
    }

    public boolean subscribes(String event) {
        return active && Arrays.stream(events.split(","))
            .map(String::trim)
            .anyMatch(event::equals);
    }

    public void deactivate() {
        this.active = false;
    }
}
