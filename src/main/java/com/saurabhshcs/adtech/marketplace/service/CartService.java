package com.saurabhshcs.adtech.marketplace.service;
import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.OrderItem;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.readmodel.CartView;
import com.saurabhshcs.adtech.marketplace.repository.Catalog;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import com.saurabhshcs.adtech.marketplace.result.CartResult;
import com.saurabhshcs.adtech.marketplace.result.FailureReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.List;
import java.util.Optional;
import static com.saurabhshcs.adtech.marketplace.common.LogMessage.*;
/**
 * Stages products in a customer's cart. Checks are point-in-time: nothing is reserved, and
 * {@link OrderProcessor} validates again at checkout.
 */
@Slf4j @Service @RequiredArgsConstructor
public class CartService {
    private final MarketplaceRegistry registry;
    private final Catalog catalog;
    public CartResult add(long customerId, long productId) {
        Customer customer = registry.requireCustomer(customerId);
        Optional<Product> found = catalog.findProduct(productId).filter(Product::inStock);
        if (found.isEmpty()) return reject(customerId, productId, FailureReason.PRODUCT_UNAVAILABLE, "out of stock or unknown product");
        Product product = found.get();
        if (!customer.canAfford(product.getPrice()))
            return reject(customerId, productId, FailureReason.INSUFFICIENT_BUDGET,
                    "price " + product.getPrice() + " exceeds budget " + customer.getBudget());
        customer.getCart().add(OrderItem.of(product));
        log.info(PRODUCT_ADDED_TO_CART.getMessage(), productId, customerId);
        return CartResult.added(productId, product.getName());
    }
    public int remove(long customerId, long productId) {
        int removed = registry.requireCustomer(customerId).getCart().remove(productId);
        log.info(PRODUCT_REMOVED_FROM_CART.getMessage(), removed, productId, customerId);
        return removed;
    }
    public CartView view(long customerId) {
        Customer customer = registry.requireCustomer(customerId);
        return CartView.builder().customerId(customerId).items(customer.getCart().items())
                .total(customer.getCart().total()).budget(customer.getBudget()).build();
    }
    /** Available products in the customer's preferred categories that fit the current budget. */
    public List<Product> browse(long customerId) {
        Customer customer = registry.requireCustomer(customerId);
        return catalog.available().stream()
                .filter(p -> customer.prefers(p.getCategory()))
                .filter(p -> customer.canAfford(p.getPrice()))
                .toList();
    }
    private CartResult reject(long customerId, long productId, FailureReason reason, String detail) {
        log.info(PRODUCT_REJECTED_FROM_CART.getMessage(), productId, customerId, reason);
        return CartResult.rejected(productId, reason, detail);
    }
}
