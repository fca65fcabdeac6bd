package io.hhplus.storefront.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * 스토어프론트 전역 설정
 *
 * 애플리케이션 기동 시 한 번 바인딩되어 각 컴포넌트에 주입된다.
 * 비즈니스 로직에서 환경 변수를 직접 읽지 않는다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    private Pricing pricing = new Pricing();
    private CartSettings cart = new CartSettings();
    private Checkout checkout = new Checkout();
    private Retry retry = new Retry();
    private Payment payment = new Payment();
    private Webhook webhook = new Webhook();

    @Getter
    @Setter
    public static class Pricing {
        private BigDecimal taxRate = new BigDecimal("0.0825");
        private long flatShippingCents = 999L;
        private long freeShippingThresholdCents = 10_000L;
        private String currency = "USD";
    }

    @Getter
    @Setter
    public static class CartSettings {
        private Duration ttl = Duration.ofDays(7);
        private Duration abandonedRetention = Duration.ofDays(30);
        private int reaperBatchSize = 100;
        private Duration reaperInterval = Duration.ofMinutes(10);
        private Duration reaperInitialDelay = Duration.ofMinutes(1);
        private String purgeCron = "0 0 3 * * *";
    }

    @Getter
    @Setter
    public static class Checkout {
        private int timeoutSeconds = 30;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 5;
        private List<Duration> backoff = List.of(
            Duration.ofMinutes(5),
            Duration.ofMinutes(15),
            Duration.ofHours(1),
            Duration.ofHours(4),
            Duration.ofHours(12)
        );
        private int batchSize = 50;
        private Duration pollInterval = Duration.ofMinutes(5);
        private Duration initialDelay = Duration.ofMinutes(1);
        private String cleanupCron = "0 0 1 * * *";
        private Duration succeededRetention = Duration.ofDays(7);
        private Duration staleAfter = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Payment {
        private String webhookSecret = "";
        private Duration signatureTolerance = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Webhook {
        private Duration timeout = Duration.ofSeconds(30);
    }
}
