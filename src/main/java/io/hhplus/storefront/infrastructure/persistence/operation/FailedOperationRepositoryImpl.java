package io.hhplus.storefront.infrastructure.persistence.operation;

import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.domain.operation.FailedOperationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class FailedOperationRepositoryImpl implements FailedOperationRepository {

    private final FailedOperationJpaRepository jpaRepository;

    @Override
    public FailedOperation save(FailedOperation operation) {
        return jpaRepository.save(operation);
    }

    @Override
    public Optional<FailedOperation> findById(Long id) {
        return jpaRepository.findById(id);
    }

    @Override
    public List<FailedOperation> findDue(LocalDateTime now, int limit) {
        return jpaRepository.findDue(now, PageRequest.of(0, limit));
    }

    @Override
    public List<FailedOperation> findStaleRetrying(LocalDateTime threshold) {
        return jpaRepository.findStaleRetrying(threshold);
    }

    @Override
    public int deleteSucceededBefore(LocalDateTime threshold) {
        return jpaRepository.deleteSucceededBefore(threshold);
    }
}
