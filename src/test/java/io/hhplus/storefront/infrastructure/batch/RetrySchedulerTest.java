package io.hhplus.storefront.infrastructure.batch;

import io.hhplus.storefront.application.operation.FailedOperationDispatcher;
import io.hhplus.storefront.application.operation.FailedOperationService;
import io.hhplus.storefront.domain.operation.FailedOperation;
import io.hhplus.storefront.domain.operation.OperationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrySchedulerTest {

    @Mock
    private FailedOperationService failedOperationService;

    @Mock
    private FailedOperationDispatcher dispatcher;

    @InjectMocks
    private RetryScheduler retryScheduler;

    private FailedOperation operation(Long id) {
        FailedOperation operation = FailedOperation.record(
            1L, OperationType.NOTIFICATION, "ORDER", 42L, "{\"orderId\":42}", "broker down",
            5, List.of(Duration.ofMinutes(5)), LocalDateTime.of(2026, 1, 15, 10, 0)
        );
        ReflectionTestUtils.setField(operation, "id", id);
        return operation;
    }

    @Test
    @DisplayName("재실행 성공 - 성공 처리")
    void retry_성공() {
        // Given
        FailedOperation operation = operation(1L);
        given(failedOperationService.claim(1L)).willReturn(Optional.of(operation));

        // When
        boolean result = retryScheduler.retry(1L);

        // Then
        assertThat(result).isTrue();
        verify(dispatcher).dispatch(operation);
        verify(failedOperationService).markSucceeded(1L);
        verify(failedOperationService, never()).markAttemptFailed(anyLong(), any());
    }

    @Test
    @DisplayName("재실행 실패 - 시도 실패로 기록하고 다음 작업으로 넘어간다")
    void retry_실패() {
        // Given
        FailedOperation operation = operation(1L);
        given(failedOperationService.claim(1L)).willReturn(Optional.of(operation));
        willThrow(new IllegalStateException("smtp down")).given(dispatcher).dispatch(operation);

        // When
        boolean result = retryScheduler.retry(1L);

        // Then
        assertThat(result).isFalse();
        verify(failedOperationService).markAttemptFailed(1L, "smtp down");
        verify(failedOperationService, never()).markSucceeded(anyLong());
    }

    @Test
    @DisplayName("다른 인스턴스가 먼저 가져간 작업은 건너뛴다")
    void retry_선점실패_건너뜀() {
        // Given
        given(failedOperationService.claim(1L)).willReturn(Optional.empty());

        // When
        boolean result = retryScheduler.retry(1L);

        // Then
        assertThat(result).isFalse();
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("한 건이 실패해도 나머지 작업은 계속 재시도한다")
    void retryDueOperations_일부실패_계속진행() {
        // Given
        FailedOperation first = operation(1L);
        FailedOperation second = operation(2L);
        given(failedOperationService.findDueIds()).willReturn(List.of(1L, 2L));
        given(failedOperationService.claim(1L)).willReturn(Optional.of(first));
        given(failedOperationService.claim(2L)).willReturn(Optional.of(second));
        willThrow(new IllegalStateException("boom")).given(dispatcher).dispatch(first);

        // When
        retryScheduler.retryDueOperations();

        // Then
        verify(failedOperationService).resetStaleRetrying();
        verify(failedOperationService).markAttemptFailed(1L, "boom");
        verify(failedOperationService).markSucceeded(2L);
    }
}
