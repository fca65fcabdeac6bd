package io.hhplus.storefront.domain.tenant;

import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상점(테넌트)
 *
 * orderSequence는 주문 번호 채번용 카운터이다.
 * 증가는 OrderNumberGenerator의 UPDATE 문으로만 이루어진다.
 */
@Entity
@Table(name = "tenants")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Tenant extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "order_sequence", nullable = false)
    private long orderSequence;

    public static Tenant create(String name, String currency) {
        Tenant tenant = new Tenant();
        tenant.name = name;
        tenant.currency = currency;
        tenant.orderSequence = 0L;
        return tenant;
    }
}
