package com.saurabhshcs.adtech.marketplace.repository;
import com.saurabhshcs.adtech.marketplace.common.LogMessage;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import com.saurabhshcs.adtech.marketplace.exception.StockInvariantViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
/**
 * Authoritative store of products and their stock counters.
 * <p>
 * Stock only changes through {@link #commitDecrement(Collection)}, which applies a whole batch
 * or nothing.
 */
@Slf4j @Repository
public class Catalog {
    private final ConcurrentHashMap<Long, Product> products = new ConcurrentHashMap<>();
    public synchronized void addProduct(Product product) {
        validate(product);
        if (products.putIfAbsent(product.getId(), product) != null)
            throw new IllegalArgumentException("Duplicate product id: " + product.getId());
    }
    /** @throws IllegalArgumentException if price or stock is missing or negative */
    public static void validate(Product product) {
        if (product.getPrice() == null || product.getPrice().signum() < 0)
            throw new IllegalArgumentException("Price must be non-negative for product " + product.getId());
        if (product.getStock() < 0)
            throw new IllegalArgumentException("Stock must be non-negative for product " + product.getId());
    }
    public Optional<Product> findProduct(long productId) { return Optional.ofNullable(products.get(productId)); }
    public List<Product> findAll() { return products.values().stream().sorted(Comparator.comparingLong(Product::getId)).toList(); }
    public List<Product> available() { return findAll().stream().filter(Product::inStock).toList(); }
    public List<Product> available(ProductCategory category) {
        return available().stream().filter(p -> p.getCategory() == category).toList();
    }
    public boolean hasStock(long productId) {
        Product product = products.get(productId);
        return product != null && product.inStock();
    }
    /**
     * Units requested per product that the current stock cannot cover. Unknown ids are reported
     * with the full requested count.
     */
    public synchronized Map<Long, Long> shortfall(Collection<Long> productIds) {
        Map<Long, Long> shortfall = new LinkedHashMap<>();
        unitsPerProduct(productIds).forEach((id, units) -> {
            Product product = products.get(id);
            long available = product == null ? 0 : product.getStock();
            if (units > available) shortfall.put(id, units - available);
        });
        return shortfall;
    }
    /**
     * Decrements stock by one for every occurrence of an id. The batch is validated in full
     * before anything is written.
     *
     * @throws StockInvariantViolationException if any product is unknown or would go negative
     */
    public synchronized void commitDecrement(Collection<Long> productIds) {
        Map<Long, Long> missing = shortfall(productIds);
        if (!missing.isEmpty())
            throw new StockInvariantViolationException("Stock decrement would go negative or hit unknown products: " + missing);
        unitsPerProduct(productIds).forEach((id, units) ->
                products.computeIfPresent(id, (key, product) -> product.withStock(product.getStock() - units.intValue())));
        log.debug(LogMessage.STOCK_COMMITTED.getMessage(), productIds);
    }
    private static Map<Long, Long> unitsPerProduct(Collection<Long> productIds) {
        return productIds.stream().collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));
    }
}
