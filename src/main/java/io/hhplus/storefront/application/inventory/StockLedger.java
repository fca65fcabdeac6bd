package io.hhplus.storefront.application.inventory;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;
import io.hhplus.storefront.domain.inventory.StockMovement;
import io.hhplus.storefront.domain.inventory.StockMovementRepository;
import io.hhplus.storefront.domain.inventory.WarehouseBalance;
import io.hhplus.storefront.domain.inventory.WarehouseBalanceRepository;
import io.hhplus.storefront.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 재고 원장
 *
 * 상품(item) 단위 상호 배제는 해당 상품의 모든 창고 잔량 행에 대한 비관적 쓰기 잠금으로 구현한다.
 * 잠금은 호출자의 트랜잭션이 끝날 때 풀린다. 서로 다른 상품은 서로를 막지 않는다.
 *
 * 여러 상품을 잠글 때는 반드시 상품 ID 오름차순으로 잠가 교착을 피한다 ({@link #lockItems}).
 *
 * 예약 할당 순서: 창고 잔량 생성 순(FIFO), 동률이면 ID 순.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockLedger {

    private final WarehouseBalanceRepository balanceRepository;
    private final StockMovementRepository movementRepository;
    private final MetricsCollector metricsCollector;

    /**
     * 여러 상품의 잔량 행을 상품 ID 오름차순으로 잠근다.
     *
     * @return 상품 ID별 잠긴 잔량 목록 (FIFO 순)
     */
    @Transactional
    public Map<Long, List<WarehouseBalance>> lockItems(Long tenantId, Collection<Long> productIds) {
        Map<Long, List<WarehouseBalance>> locked = new TreeMap<>();
        productIds.stream()
            .distinct()
            .sorted()
            .forEach(productId -> locked.put(productId, balanceRepository.findAllForUpdate(tenantId, productId)));
        return locked;
    }

    /**
     * 상품을 quantity 만큼 예약한다. 가용 재고가 부족하면 아무것도 바꾸지 않고 실패한다.
     */
    @Transactional
    public void reserve(Long tenantId, Long productId, long quantity) {
        validateQuantity(quantity);
        List<WarehouseBalance> balances = balanceRepository.findAllForUpdate(tenantId, productId);
        reserveFrom(balances, productId, quantity);
    }

    /**
     * 이미 잠긴 잔량 목록에서 예약한다 (잠금 재획득 없음).
     */
    public void reserveFrom(List<WarehouseBalance> lockedBalances, Long productId, long quantity) {
        validateQuantity(quantity);
        long available = lockedBalances.stream().mapToLong(WarehouseBalance::available).sum();
        if (available < quantity) {
            metricsCollector.recordStockError();
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("재고가 부족합니다. productId: %d, 가용: %d, 요청: %d", productId, available, quantity)
            );
        }

        long remaining = quantity;
        for (WarehouseBalance balance : lockedBalances) {
            if (remaining == 0) {
                break;
            }
            remaining -= balance.reserveUpTo(remaining);
        }
        log.debug("재고 예약: productId={}, quantity={}", productId, quantity);
    }

    /**
     * 예약을 quantity 만큼 해제한다. 예약보다 많이 해제하려 하면 초과분은 무시된다.
     *
     * @return 실제로 해제된 수량
     */
    @Transactional
    public long release(Long tenantId, Long productId, long quantity) {
        if (quantity <= 0) {
            return 0L;
        }
        List<WarehouseBalance> balances = balanceRepository.findAllForUpdate(tenantId, productId);
        return releaseFrom(balances, productId, quantity);
    }

    public long releaseFrom(List<WarehouseBalance> lockedBalances, Long productId, long quantity) {
        long remaining = quantity;
        for (WarehouseBalance balance : lockedBalances) {
            if (remaining == 0) {
                break;
            }
            remaining -= balance.releaseUpTo(remaining);
        }

        long released = quantity - remaining;
        if (remaining > 0) {
            log.warn("예약보다 많은 해제 요청: productId={}, requested={}, released={}", productId, quantity, released);
        }
        return released;
    }

    /**
     * 특정 창고에서 확정 차감하고 출고 이력을 남긴다.
     */
    @Transactional
    public void deduct(Long tenantId, Long productId, Long warehouseId, long quantity, String reference) {
        validateQuantity(quantity);
        WarehouseBalance balance = balanceRepository.findOneForUpdate(tenantId, productId, warehouseId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                String.format("창고 재고를 찾을 수 없습니다. productId: %d, warehouseId: %d", productId, warehouseId)
            ));
        deductFrom(balance, quantity, reference);
    }

    /**
     * 결제 확정된 판매를 예약에서 실재고로 반영한다.
     *
     * 예약이 잡힌 창고부터 FIFO로 차감하고, 예약이 모자라면 남은 가용 재고에서 차감한다.
     * 같은 reference로 이미 이 상품의 출고 이력이 있으면 아무것도 하지 않는다 (재시도 안전).
     *
     * @return 이번 호출에서 차감했으면 true, 이미 반영되어 있었으면 false
     */
    @Transactional
    public boolean commitReservation(Long tenantId, Long productId, long quantity, String reference) {
        validateQuantity(quantity);
        List<WarehouseBalance> balances = balanceRepository.findAllForUpdate(tenantId, productId);

        // 잠금 획득 후 확인해야 동시 재시도 간에도 한 번만 반영된다
        if (movementRepository.existsByTenantIdAndReferenceAndProductId(tenantId, reference, productId)) {
            log.info("이미 확정 차감된 상품: reference={}, productId={}", reference, productId);
            return false;
        }

        long remaining = quantity;
        for (WarehouseBalance balance : balances) {
            if (remaining == 0) {
                break;
            }
            long take = Math.min(remaining, balance.getReservedQty());
            if (take > 0) {
                deductFrom(balance, take, reference);
                remaining -= take;
            }
        }

        for (WarehouseBalance balance : balances) {
            if (remaining == 0) {
                break;
            }
            long take = Math.min(remaining, balance.available());
            if (take > 0) {
                deductFrom(balance, take, reference);
                remaining -= take;
            }
        }

        if (remaining > 0) {
            metricsCollector.recordStockError();
            throw new BusinessException(
                ErrorCode.INSUFFICIENT_STOCK,
                String.format("확정 차감할 실재고가 부족합니다. productId: %d, 부족: %d", productId, remaining)
            );
        }

        log.info("재고 확정 차감: reference={}, productId={}, quantity={}", reference, productId, quantity);
        return true;
    }

    private void deductFrom(WarehouseBalance balance, long quantity, String reference) {
        balance.deduct(quantity);
        movementRepository.save(StockMovement.issue(
            balance.getTenantId(), balance.getProductId(), balance.getWarehouseId(), quantity, reference
        ));
    }

    private void validateQuantity(long quantity) {
        if (quantity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }
    }
}
