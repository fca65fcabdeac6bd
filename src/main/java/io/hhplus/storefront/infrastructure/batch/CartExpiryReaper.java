package io.hhplus.storefront.infrastructure.batch;

import io.hhplus.storefront.application.cart.CartExpiryService;
import io.hhplus.storefront.infrastructure.lock.NamedLock;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 만료 장바구니 리퍼
 *
 * - 10분마다: 만료된 ACTIVE 장바구니의 예약 해제 후 ABANDONED 처리
 * - 매일 03:00: 보관 기간이 지난 ABANDONED 장바구니 삭제
 *
 * 두 작업 모두 대상이 없어질 때까지 배치 크기만큼 반복한다.
 * 한 장바구니의 실패는 로그만 남기고 나머지를 계속 처리한다. 다음 주기에 다시 대상이 된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CartExpiryReaper {

    private final CartExpiryService cartExpiryService;
    private final MetricsCollector metricsCollector;

    @Scheduled(
        fixedDelayString = "${storefront.cart.reaper-interval:PT10M}",
        initialDelayString = "${storefront.cart.reaper-initial-delay:PT1M}"
    )
    @NamedLock(key = "'storefront:cart-reaper'")
    public void releaseExpiredCarts() {
        int expired = drain(cartExpiryService::findExpiredCartIds, cartExpiryService::expire, "장바구니 만료 처리");
        if (expired > 0) {
            metricsCollector.recordCartsAbandoned(expired);
        }
        log.info("만료 장바구니 정리 완료: expired={}", expired);
    }

    @Scheduled(cron = "${storefront.cart.purge-cron:0 0 3 * * *}")
    @NamedLock(key = "'storefront:cart-purge'")
    public void purgeAbandonedCarts() {
        int purged = drain(cartExpiryService::findPurgeableCartIds, cartExpiryService::purge, "방치 장바구니 삭제");
        log.info("방치 장바구니 삭제 완료: purged={}", purged);
    }

    /**
     * 빈 배치가 나올 때까지 배치 단위로 처리한다.
     * 한 배치에서 하나도 처리하지 못하면 (모두 실패) 다음 주기로 넘긴다.
     */
    private int drain(Supplier<List<Long>> nextBatch, Predicate<Long> action, String label) {
        int total = 0;
        while (true) {
            List<Long> cartIds = nextBatch.get();
            if (cartIds.isEmpty()) {
                return total;
            }

            int processed = 0;
            for (Long cartId : cartIds) {
                try {
                    if (action.test(cartId)) {
                        processed++;
                    }
                } catch (Exception e) {
                    log.error("{} 실패: cartId={}", label, cartId, e);
                }
            }
            total += processed;

            if (processed == 0) {
                log.warn("{} 진행 없음, 다음 주기로 넘김: candidates={}", label, cartIds.size());
                return total;
            }
        }
    }
}
