package io.hhplus.storefront.infrastructure.batch;

import io.hhplus.storefront.application.cart.CartExpiryService;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CartExpiryReaperTest {

    @Mock
    private CartExpiryService cartExpiryService;

    @Mock
    private MetricsCollector metricsCollector;

    @InjectMocks
    private CartExpiryReaper cartExpiryReaper;

    @Test
    @DisplayName("삭제 대상이 배치 크기보다 많으면 빈 배치가 나올 때까지 반복한다")
    void purgeAbandonedCarts_여러배치_모두삭제() {
        // Given
        given(cartExpiryService.findPurgeableCartIds())
            .willReturn(List.of(1L, 2L), List.of(3L, 4L), List.of(5L), List.of());
        given(cartExpiryService.purge(anyLong())).willReturn(true);

        // When
        cartExpiryReaper.purgeAbandonedCarts();

        // Then
        verify(cartExpiryService, times(4)).findPurgeableCartIds();
        verify(cartExpiryService, times(5)).purge(anyLong());
    }

    @Test
    @DisplayName("한 배치를 전부 실패하면 같은 배치를 반복하지 않고 다음 주기로 넘긴다")
    void purgeAbandonedCarts_전부실패_중단() {
        // Given
        given(cartExpiryService.findPurgeableCartIds()).willReturn(List.of(1L, 2L));
        willThrow(new IllegalStateException("lock timeout")).given(cartExpiryService).purge(anyLong());

        // When
        cartExpiryReaper.purgeAbandonedCarts();

        // Then
        verify(cartExpiryService, times(1)).findPurgeableCartIds();
        verify(cartExpiryService, times(2)).purge(anyLong());
    }

    @Test
    @DisplayName("만료 장바구니도 배치를 모두 비울 때까지 처리하고 처리 건수를 기록한다")
    void releaseExpiredCarts_여러배치() {
        // Given
        given(cartExpiryService.findExpiredCartIds())
            .willReturn(List.of(10L, 11L), List.of(12L), List.of());
        given(cartExpiryService.expire(anyLong())).willReturn(true);

        // When
        cartExpiryReaper.releaseExpiredCarts();

        // Then
        verify(cartExpiryService, times(3)).expire(anyLong());
        verify(metricsCollector).recordCartsAbandoned(3);
    }

    @Test
    @DisplayName("만료 대상이 없으면 지표를 남기지 않는다")
    void releaseExpiredCarts_대상없음() {
        // Given
        given(cartExpiryService.findExpiredCartIds()).willReturn(List.of());

        // When
        cartExpiryReaper.releaseExpiredCarts();

        // Then
        verify(cartExpiryService, never()).expire(anyLong());
        verifyNoInteractions(metricsCollector);
    }
}
