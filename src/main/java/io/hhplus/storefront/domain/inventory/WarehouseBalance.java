package io.hhplus.storefront.domain.inventory;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 창고별 재고 잔량
 *
 * 불변식: 0 <= reservedQty <= actualQty
 * - available = actualQty - reservedQty
 * - 모든 변경은 해당 상품의 잔량 행을 SELECT ... FOR UPDATE 로 잠근 트랜잭션 안에서만 일어난다.
 */
@Entity
@Table(
    name = "warehouse_balances",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_balance_tenant_product_warehouse",
        columnNames = {"tenant_id", "product_id", "warehouse_id"}
    ),
    indexes = @Index(name = "idx_balance_tenant_product", columnList = "tenant_id, product_id, created_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WarehouseBalance extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "warehouse_id", nullable = false)
    private Long warehouseId;

    @Column(name = "actual_qty", nullable = false)
    private long actualQty;

    @Column(name = "reserved_qty", nullable = false)
    private long reservedQty;

    public static WarehouseBalance create(Long tenantId, Long productId, Long warehouseId, long actualQty) {
        if (actualQty < 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY, "재고 수량은 0 이상이어야 합니다");
        }
        WarehouseBalance balance = new WarehouseBalance();
        balance.tenantId = tenantId;
        balance.productId = productId;
        balance.warehouseId = warehouseId;
        balance.actualQty = actualQty;
        balance.reservedQty = 0L;
        return balance;
    }

    public long available() {
        return actualQty - reservedQty;
    }

    /**
     * 가용 수량 범위 안에서 최대 requested 만큼 예약한다.
     *
     * @return 실제로 예약한 수량
     */
    public long reserveUpTo(long requested) {
        long take = Math.min(requested, available());
        if (take <= 0) {
            return 0L;
        }
        this.reservedQty += take;
        return take;
    }

    /**
     * 예약을 최대 requested 만큼 해제한다. 0 미만으로 내려가지 않는다.
     *
     * @return 실제로 해제한 수량
     */
    public long releaseUpTo(long requested) {
        long take = Math.min(requested, reservedQty);
        if (take <= 0) {
            return 0L;
        }
        this.reservedQty -= take;
        return take;
    }

    /**
     * 결제 확정 차감: actualQty를 줄이고 같은 수량의 예약을 해제한다.
     */
    public void deduct(long quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
        if (quantity > actualQty) {
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("실재고보다 많이 차감할 수 없습니다. balanceId: %d, actual: %d, requested: %d",
                    id, actualQty, quantity)
            );
        }
        this.actualQty -= quantity;
        this.reservedQty = Math.max(0L, Math.min(this.reservedQty - quantity, this.actualQty));
    }
}
