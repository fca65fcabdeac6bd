package io.hhplus.storefront.domain.inventory;

import io.hhplus.storefront.domain.common.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 확정 출고 이력
 *
 * 결제 확정 후 차감된 수량을 창고 단위로 기록한다.
 * reference(주문 번호)는 재시도 시 중복 차감 여부를 판단하는 기준이다.
 */
@Entity
@Table(
    name = "stock_movements",
    indexes = @Index(name = "idx_movement_reference", columnList = "tenant_id, reference, product_id")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StockMovement extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "warehouse_id", nullable = false)
    private Long warehouseId;

    @Column(nullable = false)
    private long quantity;

    @Column(nullable = false, length = 64)
    private String reference;

    public static StockMovement issue(Long tenantId, Long productId, Long warehouseId, long quantity, String reference) {
        StockMovement movement = new StockMovement();
        movement.tenantId = tenantId;
        movement.productId = productId;
        movement.warehouseId = warehouseId;
        movement.quantity = quantity;
        movement.reference = reference;
        return movement;
    }
}
