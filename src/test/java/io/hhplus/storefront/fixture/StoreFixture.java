package io.hhplus.storefront.fixture;

import io.hhplus.storefront.domain.inventory.Warehouse;
import io.hhplus.storefront.domain.inventory.WarehouseBalance;
import io.hhplus.storefront.domain.inventory.WarehouseBalanceRepository;
import io.hhplus.storefront.domain.inventory.WarehouseRepository;
import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.product.ProductRepository;
import io.hhplus.storefront.domain.tenant.Tenant;
import io.hhplus.storefront.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.test.context.TestComponent;

import java.util.List;
import java.util.UUID;

/**
 * 통합 테스트용 상점 데이터
 *
 * 테스트마다 새 테넌트를 만들어 서로의 데이터와 주문 번호가 섞이지 않게 한다.
 */
@TestComponent
@RequiredArgsConstructor
public class StoreFixture {

    private final TenantRepository tenantRepository;
    private final ProductRepository productRepository;
    private final WarehouseRepository warehouseRepository;
    private final WarehouseBalanceRepository balanceRepository;

    public Tenant tenant() {
        return tenantRepository.save(Tenant.create("store-" + UUID.randomUUID(), "USD"));
    }

    public Warehouse warehouse(Long tenantId, String code) {
        return warehouseRepository.save(Warehouse.create(tenantId, code));
    }

    /**
     * 단일 창고에 재고를 가진 상품
     */
    public Product stockedProduct(Long tenantId, long priceCents, long stock) {
        Product product = productRepository.save(
            Product.create(tenantId, "SKU-" + UUID.randomUUID().toString().substring(0, 8), "테스트 상품", priceCents)
        );
        Warehouse warehouse = warehouse(tenantId, "WH-" + UUID.randomUUID().toString().substring(0, 8));
        balanceRepository.save(WarehouseBalance.create(tenantId, product.getId(), warehouse.getId(), stock));
        return product;
    }

    public long actualQty(Long tenantId, Long productId) {
        return balances(tenantId, productId).stream().mapToLong(WarehouseBalance::getActualQty).sum();
    }

    public long reservedQty(Long tenantId, Long productId) {
        return balances(tenantId, productId).stream().mapToLong(WarehouseBalance::getReservedQty).sum();
    }

    private List<WarehouseBalance> balances(Long tenantId, Long productId) {
        return balanceRepository.findAllByTenantIdAndProductId(tenantId, productId);
    }
}
