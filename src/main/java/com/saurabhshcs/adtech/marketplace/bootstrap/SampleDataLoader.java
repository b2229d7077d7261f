package com.saurabhshcs.adtech.marketplace.bootstrap;

import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import com.saurabhshcs.adtech.marketplace.domain.Seller;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;

import static com.saurabhshcs.adtech.marketplace.domain.ProductCategory.*;

/**
 * Seeds the registry with three sellers, nine products and three customers on startup.
 * <p>
 * Disable with {@code marketplace.sample-data.enabled=false}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "marketplace.sample-data.enabled", havingValue = "true", matchIfMissing = true)
public class SampleDataLoader implements ApplicationRunner {

    private final MarketplaceRegistry registry;

    @Override
    public void run(ApplicationArguments args) {
        registry.registerSeller(new Seller(1, "TechStore"), List.of(
                product(1, "iPhone 15", ELECTRONICS, "999.99", 5, 1),
                product(2, "MacBook Pro", ELECTRONICS, "1999.99", 3, 1),
                product(3, "Bluetooth Headphones", ELECTRONICS, "79.99", 8, 1),
                product(9, "Samsung Tablet", ELECTRONICS, "299.99", 6, 1)));
        registry.registerSeller(new Seller(2, "FashionHub"), List.of(
                product(4, "Nike T-Shirt", CLOTHING, "29.99", 20, 2),
                product(5, "Running Shoes", CLOTHING, "89.99", 10, 2),
                product(8, "Football", SPORTS, "25.99", 30, 2)));
        registry.registerSeller(new Seller(3, "BookWorld"), List.of(
                product(6, "Python Programming", BOOKS, "39.99", 15, 3),
                product(7, "Clean Code", BOOKS, "49.99", 12, 3)));

        registry.registerCustomer(new Customer(1, "Ana Garcia", new BigDecimal("1500.00"),
                EnumSet.of(ELECTRONICS, BOOKS)));
        registry.registerCustomer(new Customer(2, "Carlos Lopez", new BigDecimal("500.00"),
                EnumSet.of(CLOTHING, SPORTS)));
        registry.registerCustomer(new Customer(3, "Maria Rodriguez", new BigDecimal("3000.00"),
                EnumSet.of(ELECTRONICS, CLOTHING, BOOKS, SPORTS)));

        log.info("Sample marketplace loaded: {} sellers, {} customers",
                registry.sellers().size(), registry.customers().size());
    }

    private static Product product(long id, String name, ProductCategory category, String price, int stock, long sellerId) {
        return Product.builder()
                .id(id)
                .name(name)
                .category(category)
                .price(new BigDecimal(price))
                .stock(stock)
                .sellerId(sellerId)
                .build();
    }
}
