package io.hhplus.storefront.infrastructure.persistence.product;

import io.hhplus.storefront.domain.product.Product;
import io.hhplus.storefront.domain.product.ProductRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaProductRepository extends JpaRepository<Product, Long>, ProductRepository {

    @Override
    Optional<Product> findByIdAndTenantId(Long id, Long tenantId);

    @Override
    List<Product> findAllByIdIn(Collection<Long> ids);

    @Override
    Product save(Product product);
}
