package com.saurabhshcs.adtech.marketplace.repository;
import com.saurabhshcs.adtech.marketplace.common.LogMessage;
import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.domain.Seller;
import com.saurabhshcs.adtech.marketplace.exception.CustomerNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
/**
 * Known customers and sellers. Registering a seller seeds the catalog with its products.
 * Lookups here serve display and routing only; nothing in this class touches stock or budgets.
 */
@Slf4j @Repository @RequiredArgsConstructor
public class MarketplaceRegistry {
    static final String UNKNOWN_SELLER = "Unknown";
    private final Catalog catalog;
    private final List<Customer> customers = new ArrayList<>();
    private final List<Seller> sellers = new ArrayList<>();
    public synchronized void registerCustomer(Customer customer) {
        if (findCustomer(customer.getId()).isPresent())
            throw new IllegalArgumentException("Duplicate customer id: " + customer.getId());
        customers.add(customer);
        log.info(LogMessage.CUSTOMER_REGISTERED.getMessage(), customer.getName(), customer.getId());
    }
    public synchronized void registerSeller(Seller seller, List<Product> products) {
        if (findSeller(seller.getId()).isPresent())
            throw new IllegalArgumentException("Duplicate seller id: " + seller.getId());
        if (products.stream().map(Product::getId).distinct().count() != products.size())
            throw new IllegalArgumentException("Duplicate product ids for seller " + seller.getId());
        for (Product product : products) {
            if (product.getSellerId() != seller.getId())
                throw new IllegalArgumentException("Product " + product.getId() + " does not belong to seller " + seller.getId());
            Catalog.validate(product);
            if (catalog.findProduct(product.getId()).isPresent())
                throw new IllegalArgumentException("Duplicate product id: " + product.getId());
        }
        products.forEach(product -> {
            catalog.addProduct(product);
            seller.own(product.getId());
        });
        sellers.add(seller);
        log.info(LogMessage.SELLER_REGISTERED.getMessage(), seller.getName(), seller.getId(), products.size());
    }
    public synchronized Optional<Customer> findCustomer(long customerId) { return customers.stream().filter(c -> c.getId() == customerId).findFirst(); }
    public Customer requireCustomer(long customerId) { return findCustomer(customerId).orElseThrow(() -> new CustomerNotFoundException(customerId)); }
    public synchronized Optional<Seller> findSeller(long sellerId) { return sellers.stream().filter(s -> s.getId() == sellerId).findFirst(); }
    public String sellerName(long sellerId) { return findSeller(sellerId).map(Seller::getName).orElse(UNKNOWN_SELLER); }
    public synchronized List<Customer> customers() { return List.copyOf(customers); }
    public synchronized List<Seller> sellers() { return List.copyOf(sellers); }
}
