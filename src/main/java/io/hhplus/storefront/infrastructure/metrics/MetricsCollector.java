package io.hhplus.storefront.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 주요 비즈니스 메트릭을 수집하는 컴포넌트
 *
 * 수집 메트릭:
 * - checkout_total: 체크아웃 성공/실패 카운터
 * - checkout_duration_seconds: 체크아웃 처리 시간 (P50, P95, P99)
 * - stock_errors_total: 재고 부족 에러 카운터
 * - payment_events_total: 웹훅 정산 결과별 카운터
 * - failed_operations_total: 후속 처리 실패 기록/재시도 결과 카운터
 * - carts_abandoned_total: 만료 처리된 장바구니 수
 */
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter checkoutSuccessCounter;
    private final Counter checkoutFailureCounter;
    private final Timer checkoutDurationTimer;

    private final Counter stockErrorCounter;

    private final Counter failedOperationRecordedCounter;
    private final Counter failedOperationRecoveredCounter;
    private final Counter failedOperationPermanentCounter;

    private final Counter cartsAbandonedCounter;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.checkoutSuccessCounter = Counter.builder("checkout_total")
                .tag("status", "success")
                .description("Total number of successful checkouts")
                .register(meterRegistry);

        this.checkoutFailureCounter = Counter.builder("checkout_total")
                .tag("status", "failure")
                .description("Total number of failed checkouts")
                .register(meterRegistry);

        this.checkoutDurationTimer = Timer.builder("checkout_duration_seconds")
                .description("Checkout processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.stockErrorCounter = Counter.builder("stock_errors_total")
                .description("Total number of stock shortage errors")
                .register(meterRegistry);

        this.failedOperationRecordedCounter = Counter.builder("failed_operations_total")
                .tag("status", "recorded")
                .description("Side effects recorded for retry")
                .register(meterRegistry);

        this.failedOperationRecoveredCounter = Counter.builder("failed_operations_total")
                .tag("status", "recovered")
                .description("Side effects that succeeded on retry")
                .register(meterRegistry);

        this.failedOperationPermanentCounter = Counter.builder("failed_operations_total")
                .tag("status", "permanent")
                .description("Side effects that exhausted all retry attempts")
                .register(meterRegistry);

        this.cartsAbandonedCounter = Counter.builder("carts_abandoned_total")
                .description("Expired carts whose reservations were released")
                .register(meterRegistry);
    }

    // ============================================================
    // 체크아웃
    // ============================================================

    public void recordCheckoutSuccess() {
        checkoutSuccessCounter.increment();
    }

    public void recordCheckoutFailure() {
        checkoutFailureCounter.increment();
    }

    public void recordCheckoutDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        checkoutDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    // ============================================================
    // 재고
    // ============================================================

    public void recordStockError() {
        stockErrorCounter.increment();
    }

    // ============================================================
    // 결제 웹훅
    // ============================================================

    /**
     * @param outcome APPLIED, DUPLICATE, IGNORED, AMOUNT_MISMATCH ...
     */
    public void recordPaymentEvent(String eventType, String outcome) {
        Counter.builder("payment_events_total")
                .tag("type", eventType)
                .tag("outcome", outcome)
                .description("Payment gateway events by outcome")
                .register(meterRegistry)
                .increment();
    }

    // ============================================================
    // 후속 처리 재시도
    // ============================================================

    public void recordFailedOperation() {
        failedOperationRecordedCounter.increment();
    }

    public void recordOperationRecovered() {
        failedOperationRecoveredCounter.increment();
    }

    public void recordOperationPermanentlyFailed() {
        failedOperationPermanentCounter.increment();
    }

    // ============================================================
    // 장바구니 만료
    // ============================================================

    public void recordCartsAbandoned(int count) {
        cartsAbandonedCounter.increment(count);
    }
}
