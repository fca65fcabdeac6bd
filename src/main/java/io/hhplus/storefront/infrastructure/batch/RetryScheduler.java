package io.hhplus.storefront.infrastructure.batch;

import io.hhplus.storefront.application.operation.FailedOperationDispatcher;
import io.hhplus.storefront.application.operation.FailedOperationService;
import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.infrastructure.lock.NamedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 실패한 후속 처리 재시도 스케줄러
 *
 * 상태 흐름: PENDING → RETRYING → SUCCEEDED | PENDING (다음 백오프) | FAILED
 * 여러 인스턴스가 떠 있어도 네임드 락으로 한 곳에서만 돈다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryScheduler {

    private final FailedOperationService failedOperationService;
    private final FailedOperationDispatcher dispatcher;

    @Scheduled(
        fixedDelayString = "${storefront.retry.poll-interval:PT5M}",
        initialDelayString = "${storefront.retry.initial-delay:PT1M}"
    )
    @NamedLock(key = "'storefront:failed-operations'")
    public void retryDueOperations() {
        failedOperationService.resetStaleRetrying();

        List<Long> dueIds = failedOperationService.findDueIds();
        if (dueIds.isEmpty()) {
            return;
        }
        log.info("후처리 재시도 시작: count={}", dueIds.size());

        int succeeded = 0;
        for (Long operationId : dueIds) {
            if (retry(operationId)) {
                succeeded++;
            }
        }
        log.info("후처리 재시도 종료: total={}, succeeded={}", dueIds.size(), succeeded);
    }

    /**
     * @return 이번 시도에서 성공했으면 true
     */
    boolean retry(Long operationId) {
        Optional<FailedOperation> claimed = failedOperationService.claim(operationId);
        if (claimed.isEmpty()) {
            return false;
        }
        FailedOperation operation = claimed.get();

        try {
            dispatcher.dispatch(operation);
        } catch (Exception e) {
            log.warn("후처리 재시도 실패: id={}, type={}, error={}",
                operation.getId(), operation.getOperationType(), e.getMessage());
            failedOperationService.markAttemptFailed(operation.getId(), e.getMessage());
            return false;
        }

        failedOperationService.markSucceeded(operation.getId());
        return true;
    }

    @Scheduled(cron = "${storefront.retry.cleanup-cron:0 0 1 * * *}")
    @NamedLock(key = "'storefront:failed-operations-cleanup'")
    public void deleteSucceededOperations() {
        int deleted = failedOperationService.deleteSucceeded();
        log.info("성공한 재시도 기록 정리: deleted={}", deleted);
    }
}
