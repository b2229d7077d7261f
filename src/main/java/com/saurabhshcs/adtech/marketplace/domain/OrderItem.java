package com.saurabhshcs.adtech.marketplace.domain;
import java.math.BigDecimal;
/** Price and name of a product as captured when it entered a cart or an order. */
public record OrderItem(long productId, String name, ProductCategory category, BigDecimal price) {
    public static OrderItem of(Product product) {
        return new OrderItem(product.getId(), product.getName(), product.getCategory(), product.getPrice());
    }
}
