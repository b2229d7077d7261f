package com.saurabhshcs.adtech.marketplace.service;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.domain.Seller;
import com.saurabhshcs.adtech.marketplace.readmodel.MarketplaceStatistics;
import com.saurabhshcs.adtech.marketplace.readmodel.ProductView;
import com.saurabhshcs.adtech.marketplace.readmodel.SellerInventoryReport;
import com.saurabhshcs.adtech.marketplace.readmodel.SellerView;
import com.saurabhshcs.adtech.marketplace.repository.Catalog;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import com.saurabhshcs.adtech.marketplace.repository.OrderLedger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
/**
 * Read-only reporting over the catalog, registry and ledger: seller inventory analysis,
 * low-stock alerts and marketplace-wide statistics.
 */
@Service
public class ReportService {
    private final MarketplaceRegistry registry;
    private final Catalog catalog;
    private final OrderLedger ledger;
    private final int lowStockThreshold;
    public ReportService(MarketplaceRegistry registry, Catalog catalog, OrderLedger ledger,
                         @Value("${marketplace.low-stock-threshold:5}") int lowStockThreshold) {
        this.registry = registry;
        this.catalog = catalog;
        this.ledger = ledger;
        this.lowStockThreshold = lowStockThreshold;
    }
    public List<SellerInventoryReport> sellerInventory() { return registry.sellers().stream().map(this::inventoryOf).toList(); }
    public Optional<SellerInventoryReport> sellerInventory(long sellerId) { return registry.findSeller(sellerId).map(this::inventoryOf); }
    public List<ProductView> lowStock() {
        return catalog.findAll().stream().filter(this::isLowStock).map(this::toView).toList();
    }
    public List<ProductView> availableProducts() { return catalog.available().stream().map(this::toView).toList(); }
    public List<SellerView> sellers() {
        return registry.sellers().stream()
                .map(s -> SellerView.builder().id(s.getId()).name(s.getName()).products(productsOf(s).stream().map(this::toView).toList()).build())
                .toList();
    }
    public MarketplaceStatistics statistics() {
        return MarketplaceStatistics.builder().customers(registry.customers().size()).sellers(registry.sellers().size())
                .availableProducts(catalog.available().size()).orders(ledger.count()).totalRevenue(ledger.totalRevenue()).build();
    }
    public ProductView toView(Product product) { return ProductView.of(product, registry.sellerName(product.getSellerId())); }
    private SellerInventoryReport inventoryOf(Seller seller) {
        List<Product> products = productsOf(seller);
        return SellerInventoryReport.builder().sellerId(seller.getId()).sellerName(seller.getName())
                .productCount(products.size())
                .totalStock(products.stream().mapToInt(Product::getStock).sum())
                .inventoryValue(products.stream().map(Product::inventoryValue).reduce(BigDecimal.ZERO, BigDecimal::add))
                .lowStockProducts(products.stream().filter(this::isLowStock).map(this::toView).toList())
                .build();
    }
    private List<Product> productsOf(Seller seller) {
        return seller.getProductIds().stream().map(catalog::findProduct).flatMap(Optional::stream).toList();
    }
    private boolean isLowStock(Product product) { return product.getStock() < lowStockThreshold; }
}
