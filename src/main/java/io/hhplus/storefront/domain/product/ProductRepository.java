package io.hhplus.storefront.domain.product;

import io.hhplus.storefront.common.exception.BusinessException;
import io.hhplus.storefront.common.exception.ErrorCode;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findByIdAndTenantId(Long id, Long tenantId);

    List<Product> findAllByIdIn(Collection<Long> ids);

    Product save(Product product);

    default Product findPublishedOrThrow(Long tenantId, Long productId) {
        return findByIdAndTenantId(productId, tenantId)
            .filter(Product::isPublished)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.PRODUCT_NOT_FOUND,
                "상품을 찾을 수 없습니다. productId: " + productId
            ));
    }
}
