package io.hhplus.storefront.domain.operation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 실패한 후속 처리 저장소 인터페이스
 */
public interface FailedOperationRepository {

    FailedOperation save(FailedOperation operation);

    Optional<FailedOperation> findById(Long id);

    /**
     * 재시도 대상 조회
     *
     * 조건:
     * - status = PENDING
     * - nextRetryAt <= now
     * - attemptCount < maxAttempts
     *
     * nextRetryAt 오름차순, 최대 limit건
     */
    List<FailedOperation> findDue(LocalDateTime now, int limit);

    /**
     * updatedAt이 threshold 이전인 RETRYING 기록
     */
    List<FailedOperation> findStaleRetrying(LocalDateTime threshold);

    int deleteSucceededBefore(LocalDateTime threshold);
}
