package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * 주문 번호 채번: ORD-{yyyyMM}-{테넌트 순번 5자리}
 *
 * 체크아웃 트랜잭션 시작 전에 호출되어 자체 트랜잭션에서 증가하고 즉시 커밋된다.
 * 체크아웃이 이후에 실패해도 번호는 재사용되지 않는다 (빈 번호는 허용).
 * 카운터 행 잠금은 증가 직후 풀리므로 체크아웃 트랜잭션 동안 다른 체크아웃을 막지 않는다.
 */
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private static final DateTimeFormatter PERIOD = DateTimeFormatter.ofPattern("yyyyMM");

    private final TenantRepository tenantRepository;
    private final Clock clock;

    @Transactional
    public String next(Long tenantId) {
        int updated = tenantRepository.incrementOrderSequence(tenantId);
        if (updated == 0) {
            throw new BusinessException(ErrorCode.TENANT_NOT_FOUND, "상점을 찾을 수 없습니다. tenantId: " + tenantId);
        }

        long sequence = tenantRepository.findOrderSequence(tenantId)
            .orElseThrow(() -> new BusinessException(ErrorCode.TENANT_NOT_FOUND));

        return format(LocalDate.now(clock), sequence);
    }

    static String format(LocalDate date, long sequence) {
        return String.format("ORD-%s-%05d", date.format(PERIOD), sequence);
    }
}
