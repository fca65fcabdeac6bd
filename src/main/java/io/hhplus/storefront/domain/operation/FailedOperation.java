package io.hhplus.storefront.domain.operation;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 실패한 후속 처리 기록 (재시도 원장)
 *
 * 상태:
 * - PENDING: 재시도 대기
 * - RETRYING: 재시도 중
 * - SUCCEEDED: 재시도 성공
 * - FAILED: 최대 시도 횟수 초과 (수동 확인 필요)
 *
 * attemptCount는 재시도 횟수만 센다. 최초 실패는 0회로 기록된다.
 */
@Entity
@Table(name = "failed_operations", indexes = {
    @Index(name = "idx_failed_op_due", columnList = "status, next_retry_at"),
    @Index(name = "idx_failed_op_reference", columnList = "tenant_id, reference_type, reference_id")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FailedOperation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_type", nullable = false, length = 30)
    private OperationType operationType;

    /**
     * 참조 대상 (예: "ORDER")
     */
    @Column(name = "reference_type", nullable = false, length = 30)
    private String referenceType;

    @Column(name = "reference_id", nullable = false)
    private Long referenceId;

    /**
     * 재실행에 필요한 최소 페이로드 (JSON)
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private OperationStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "next_retry_at")
    private LocalDateTime nextRetryAt;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

    @Column(name = "succeeded_at")
    private LocalDateTime succeededAt;

    @Column(name = "failed_at")
    private LocalDateTime failedAt;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // ===== 생성 메서드 =====

    public static FailedOperation record(
        Long tenantId,
        OperationType operationType,
        String referenceType,
        Long referenceId,
        String payload,
        String errorMessage,
        int maxAttempts,
        List<Duration> backoff,
        LocalDateTime now
    ) {
        FailedOperation operation = new FailedOperation();
        operation.tenantId = tenantId;
        operation.operationType = operationType;
        operation.referenceType = referenceType;
        operation.referenceId = referenceId;
        operation.payload = payload;
        operation.errorMessage = errorMessage;
        operation.status = OperationStatus.PENDING;
        operation.attemptCount = 0;
        operation.maxAttempts = maxAttempts;
        operation.createdAt = now;
        operation.updatedAt = now;
        operation.nextRetryAt = now.plus(delayFor(backoff, 0));
        return operation;
    }

    // ===== 비즈니스 로직 =====

    /**
     * 재시도 시작
     */
    public void startRetry(LocalDateTime now) {
        if (this.status != OperationStatus.PENDING) {
            throw new IllegalStateException("재시도 가능한 상태가 아닙니다: " + this.status);
        }

        this.status = OperationStatus.RETRYING;
        this.attemptCount++;
        this.lastAttemptAt = now;
        this.updatedAt = now;
    }

    public void markSucceeded(LocalDateTime now) {
        this.status = OperationStatus.SUCCEEDED;
        this.succeededAt = now;
        this.nextRetryAt = null;
        this.updatedAt = now;
    }

    /**
     * 재시도 실패. 한도에 도달하면 FAILED, 아니면 다음 백오프로 PENDING.
     */
    public void markAttemptFailed(String errorMessage, List<Duration> backoff, LocalDateTime now) {
        this.errorMessage = errorMessage;
        this.updatedAt = now;

        if (this.attemptCount >= this.maxAttempts) {
            this.status = OperationStatus.FAILED;
            this.failedAt = now;
            this.nextRetryAt = null;
        } else {
            this.status = OperationStatus.PENDING;
            this.nextRetryAt = now.plus(delayFor(backoff, this.attemptCount));
        }
    }

    /**
     * 재시도 중 프로세스가 죽어 RETRYING에 머문 기록을 되돌린다.
     */
    public void resetStale(LocalDateTime now) {
        if (this.status != OperationStatus.RETRYING) {
            return;
        }
        this.status = OperationStatus.PENDING;
        this.nextRetryAt = now;
        this.updatedAt = now;
    }

    public boolean isPermanentlyFailed() {
        return this.status == OperationStatus.FAILED;
    }

    public boolean isDue(LocalDateTime now) {
        return this.status == OperationStatus.PENDING
            && this.attemptCount < this.maxAttempts
            && this.nextRetryAt != null
            && !this.nextRetryAt.isAfter(now);
    }

    static Duration delayFor(List<Duration> backoff, int attemptIndex) {
        int index = Math.min(attemptIndex, backoff.size() - 1);
        return backoff.get(index);
    }
}
