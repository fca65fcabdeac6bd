package io.hhplus.storefront.domain.customer;

import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * B2B 고객 신용 계정
 *
 * 같은 billingAccountId에 연결된 고객들은 하나의 신용 한도를 공유한다.
 */
@Entity
@Table(
    name = "customer_credit_accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_credit_tenant_customer", columnNames = {"tenant_id", "customer_id"}),
    indexes = @Index(name = "idx_credit_billing", columnList = "tenant_id, billing_account_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerCreditAccount extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "billing_account_id", nullable = false)
    private Long billingAccountId;

    @Column(name = "credit_limit_cents", nullable = false)
    private long creditLimitCents;

    public static CustomerCreditAccount of(Long tenantId, Long customerId, Long billingAccountId, long creditLimitCents) {
        CustomerCreditAccount account = new CustomerCreditAccount();
        account.tenantId = tenantId;
        account.customerId = customerId;
        account.billingAccountId = billingAccountId;
        account.creditLimitCents = creditLimitCents;
        return account;
    }

    public boolean hasLimit() {
        return creditLimitCents > 0;
    }
}
