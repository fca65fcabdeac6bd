package io.hhplus.storefront.infrastructure.persistence.operation;

import io.hhplus.storefront.domain.operation.FailedOperation;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface FailedOperationJpaRepository extends JpaRepository<FailedOperation, Long> {

    @Query("SELECT f FROM FailedOperation f " +
           "WHERE f.status = io.hhplus.storefront.domain.operation.OperationStatus.PENDING " +
           "AND f.nextRetryAt <= :now " +
           "AND f.attemptCount < f.maxAttempts " +
           "ORDER BY f.nextRetryAt ASC")
    List<FailedOperation> findDue(@Param("now") LocalDateTime now, Pageable pageable);

    @Query("SELECT f FROM FailedOperation f " +
           "WHERE f.status = io.hhplus.storefront.domain.operation.OperationStatus.RETRYING " +
           "AND f.updatedAt < :threshold")
    List<FailedOperation> findStaleRetrying(@Param("threshold") LocalDateTime threshold);

    @Modifying
    @Query("DELETE FROM FailedOperation f " +
           "WHERE f.status = io.hhplus.storefront.domain.operation.OperationStatus.SUCCEEDED " +
           "AND f.succeededAt < :threshold")
    int deleteSucceededBefore(@Param("threshold") LocalDateTime threshold);
}
