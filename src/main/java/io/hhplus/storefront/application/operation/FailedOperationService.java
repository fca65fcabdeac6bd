package io.hhplus.storefront.application.operation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.hhplus.storefront.config.StorefrontProperties;
import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.domain.operation.FailedOperationRepository;
import io.hhplus.storefront.domain.operation.OperationType;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 재시도 원장 상태 변경
 *
 * 상태 변경마다 짧은 트랜잭션으로 끊는다. 작업 실행(외부 호출 포함)은 이 트랜잭션 밖에서 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailedOperationService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final FailedOperationRepository failedOperationRepository;
    private final StorefrontProperties properties;
    private final ObjectMapper objectMapper;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * 실패한 후속 처리를 기록한다. 호출자의 트랜잭션 상태와 무관하게 커밋된다.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FailedOperation record(Long tenantId, OperationType type, String referenceType, Long referenceId,
                                  Object payload, String errorMessage) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("후처리 페이로드 직렬화 실패: type=" + type, e);
        }

        StorefrontProperties.Retry retry = properties.getRetry();
        FailedOperation saved = failedOperationRepository.save(FailedOperation.record(
            tenantId, type, referenceType, referenceId, payloadJson, truncate(errorMessage),
            retry.getMaxAttempts(), retry.getBackoff(), LocalDateTime.now(clock)
        ));

        metricsCollector.recordFailedOperation();
        log.warn("후처리 실패 기록: id={}, type={}, reference={}:{}, nextRetryAt={}",
            saved.getId(), type, referenceType, referenceId, saved.getNextRetryAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Long> findDueIds() {
        return failedOperationRepository.findDue(LocalDateTime.now(clock), properties.getRetry().getBatchSize())
            .stream()
            .map(FailedOperation::getId)
            .toList();
    }

    /**
     * 재시도 선점. 그 사이 다른 실행이 처리했으면 비어 있다.
     */
    @Transactional
    public Optional<FailedOperation> claim(Long operationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return failedOperationRepository.findById(operationId)
            .filter(operation -> operation.isDue(now))
            .map(operation -> {
                operation.startRetry(now);
                return failedOperationRepository.save(operation);
            });
    }

    @Transactional
    public void markSucceeded(Long operationId) {
        FailedOperation operation = load(operationId);
        operation.markSucceeded(LocalDateTime.now(clock));
        failedOperationRepository.save(operation);

        metricsCollector.recordOperationRecovered();
        log.info("후처리 재시도 성공: id={}, type={}, attempt={}",
            operation.getId(), operation.getOperationType(), operation.getAttemptCount());
    }

    /**
     * @return 최종 실패로 확정되었으면 true
     */
    @Transactional
    public boolean markAttemptFailed(Long operationId, String errorMessage) {
        FailedOperation operation = load(operationId);
        operation.markAttemptFailed(truncate(errorMessage), properties.getRetry().getBackoff(), LocalDateTime.now(clock));
        failedOperationRepository.save(operation);

        if (operation.isPermanentlyFailed()) {
            metricsCollector.recordOperationPermanentlyFailed();
            log.error("후처리 최종 실패 (수동 확인 필요): id={}, type={}, reference={}:{}, attempts={}, error={}",
                operation.getId(), operation.getOperationType(), operation.getReferenceType(),
                operation.getReferenceId(), operation.getAttemptCount(), errorMessage);
            return true;
        }

        log.warn("후처리 재시도 실패: id={}, type={}, attempt={}/{}, nextRetryAt={}",
            operation.getId(), operation.getOperationType(), operation.getAttemptCount(),
            operation.getMaxAttempts(), operation.getNextRetryAt());
        return false;
    }

    /**
     * 프로세스 중단으로 RETRYING에 남은 기록을 PENDING으로 되돌린다.
     */
    @Transactional
    public int resetStaleRetrying() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<FailedOperation> stale = failedOperationRepository.findStaleRetrying(
            now.minus(properties.getRetry().getStaleAfter())
        );
        stale.forEach(operation -> {
            operation.resetStale(now);
            failedOperationRepository.save(operation);
        });
        if (!stale.isEmpty()) {
            log.warn("멈춘 재시도 복구: count={}", stale.size());
        }
        return stale.size();
    }

    @Transactional
    public int deleteSucceeded() {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(properties.getRetry().getSucceededRetention());
        return failedOperationRepository.deleteSucceededBefore(threshold);
    }

    private FailedOperation load(Long operationId) {
        return failedOperationRepository.findById(operationId)
            .orElseThrow(() -> new IllegalStateException("재시도 기록이 없습니다. id: " + operationId));
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
