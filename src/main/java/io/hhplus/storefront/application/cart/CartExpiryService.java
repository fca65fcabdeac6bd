package io.hhplus.storefront.application.cart;

import io.hhplus.storefront.config.StorefrontProperties;
import io.hhplus.storefront.domain.cart.Cart;
import io.hhplus.storefront.domain.cart.CartRepository;
import io.hhplus.storefront.domain.cart.CartStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 만료 장바구니 정리
 *
 * 장바구니 하나당 트랜잭션 하나. 잠금 후 상태와 만료 시각을 다시 확인하므로
 * 조회 이후 고객이 장바구니를 갱신했다면 건너뛴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartExpiryService {

    private final CartRepository cartRepository;
    private final CartReservationManager cartReservationManager;
    private final StorefrontProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Long> findExpiredCartIds() {
        return cartRepository.findExpiredActiveCartIds(LocalDateTime.now(clock), properties.getCart().getReaperBatchSize());
    }

    @Transactional(readOnly = true)
    public List<Long> findPurgeableCartIds() {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(properties.getCart().getAbandonedRetention());
        return cartRepository.findAbandonedCartIdsBefore(threshold, properties.getCart().getReaperBatchSize());
    }

    /**
     * @return 만료 처리했으면 true
     */
    @Transactional
    public boolean expire(Long cartId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Cart cart = cartRepository.findByIdForUpdate(cartId).orElse(null);
        if (cart == null || !cart.isActive() || !cart.isExpired(now)) {
            return false;
        }

        cartReservationManager.releaseLineReservations(cart);
        cart.abandon(now);
        cartRepository.save(cart);

        log.info("장바구니 만료: cartId={}, tenantId={}, items={}", cart.getId(), cart.getTenantId(), cart.getItems().size());
        return true;
    }

    @Transactional
    public boolean purge(Long cartId) {
        Cart cart = cartRepository.findByIdForUpdate(cartId).orElse(null);
        if (cart == null || cart.getStatus() != CartStatus.ABANDONED) {
            return false;
        }
        cartRepository.delete(cart);
        return true;
    }
}
