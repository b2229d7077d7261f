package com.saurabhshcs.adtech.marketplace.domain;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import java.math.BigDecimal;
/**
 * Catalog entry. Immutable: a stock change produces a new instance via {@link #withStock(int)}.
 */
@Getter @Builder(toBuilder = true) @ToString
public class Product {
    private final long id;
    private final String name;
    private final ProductCategory category;
    private final BigDecimal price;
    private final int stock;
    private final long sellerId;
    public Product withStock(int newStock) {
        if (newStock < 0) throw new IllegalArgumentException("Stock cannot be negative for product " + id + ": " + newStock);
        return toBuilder().stock(newStock).build();
    }
    public boolean inStock() { return stock > 0; }
    public BigDecimal inventoryValue() { return price.multiply(BigDecimal.valueOf(stock)); }
}
