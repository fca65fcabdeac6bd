package io.hhplus.storefront.application.checkout;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.customer.CustomerCreditAccount;
import io.hhplus.storefront.domain.customer.CustomerCreditAccountRepository;
import io.hhplus.storefront.domain.order.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * B2B 신용 한도 검사
 *
 * 미결제 노출액 = 같은 청구 계정에 묶인 모든 고객의 (취소되지 않은, 결제 PENDING/FAILED) 주문 총액 합계.
 * 노출액 + 이번 주문 총액이 한도를 넘으면 거절한다. 신용 계정이 없거나 한도가 0이면 검사하지 않는다.
 *
 * 청구 계정의 신용 행을 모두 잠근 뒤 합산하므로 호출 트랜잭션(체크아웃)이 커밋될 때까지
 * 같은 청구 계정의 다른 체크아웃은 대기한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CreditLimitPolicy {

    private final CustomerCreditAccountRepository creditAccountRepository;
    private final OrderRepository orderRepository;

    public void check(Long tenantId, Long customerId, long orderTotalCents) {
        if (customerId == null) {
            return;
        }

        Optional<CustomerCreditAccount> account = creditAccountRepository.findByTenantIdAndCustomerId(tenantId, customerId);
        if (account.isEmpty() || !account.get().hasLimit()) {
            return;
        }

        CustomerCreditAccount credit = account.get();
        List<Long> linkedCustomers = creditAccountRepository.findAllByBillingAccountForUpdate(
                tenantId, credit.getBillingAccountId()
            ).stream()
            .map(CustomerCreditAccount::getCustomerId)
            .toList();
        long exposure = orderRepository.sumUnpaidExposure(tenantId, linkedCustomers);

        if (exposure + orderTotalCents > credit.getCreditLimitCents()) {
            log.warn("신용 한도 초과: customerId={}, billingAccountId={}, exposure={}, order={}, limit={}",
                customerId, credit.getBillingAccountId(), exposure, orderTotalCents, credit.getCreditLimitCents());
            throw new BusinessException(
                ErrorCode.CREDIT_LIMIT_EXCEEDED,
                String.format("신용 한도를 초과했습니다. 한도: %d, 미결제: %d, 주문: %d",
                    credit.getCreditLimitCents(), exposure, orderTotalCents)
            );
        }
    }
}
