package io.hhplus.storefront.domain.inventory;

import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
    name = "warehouses",
    uniqueConstraints = @UniqueConstraint(name = "uk_warehouse_tenant_code", columnNames = {"tenant_id", "code"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Warehouse extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 50)
    private String code;

    @Column(nullable = false)
    private boolean active;

    public static Warehouse create(Long tenantId, String code) {
        Warehouse warehouse = new Warehouse();
        warehouse.tenantId = tenantId;
        warehouse.code = code;
        warehouse.active = true;
        return warehouse;
    }
}
