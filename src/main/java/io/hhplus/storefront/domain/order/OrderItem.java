package io.hhplus.storefront.domain.order;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 항목 (체크아웃 시점의 상품 스냅샷)
 */
@Entity
@Table(name = "order_items", indexes = @Index(name = "idx_order_item_order", columnList = "order_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(nullable = false, length = 64)
    private String sku;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "unit_price_cents", nullable = false)
    private long unitPriceCents;

    @Column(name = "total_price_cents", nullable = false)
    private long totalPriceCents;

    static OrderItem snapshot(Order order, Long productId, String sku, String name, int quantity, long unitPriceCents) {
        OrderItem item = new OrderItem();
        item.order = order;
        item.productId = productId;
        item.sku = sku;
        item.name = name;
        item.quantity = quantity;
        item.unitPriceCents = unitPriceCents;
        item.totalPriceCents = unitPriceCents * quantity;
        return item;
    }
}
