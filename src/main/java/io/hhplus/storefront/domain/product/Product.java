package io.hhplus.storefront.domain.product;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 판매 상품
 *
 * 재고는 창고별 WarehouseBalance가 관리한다. 가격은 센트 단위 정수이다.
 */
@Entity
@Table(
    name = "products",
    uniqueConstraints = @UniqueConstraint(name = "uk_product_tenant_sku", columnNames = {"tenant_id", "sku"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(nullable = false, length = 64)
    private String sku;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "price_cents", nullable = false)
    private long priceCents;

    @Column(nullable = false)
    private boolean published;

    public static Product create(Long tenantId, String sku, String name, long priceCents) {
        if (priceCents < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "상품 가격은 0 이상이어야 합니다");
        }
        Product product = new Product();
        product.tenantId = tenantId;
        product.sku = sku;
        product.name = name;
        product.priceCents = priceCents;
        product.published = true;
        return product;
    }

    public void unpublish() {
        this.published = false;
    }
}
