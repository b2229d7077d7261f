package com.saurabhshcs.adtech.marketplace.readmodel;
import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
import java.util.List;
@Data @Builder
public class SellerInventoryReport {
    private long sellerId;
    private String sellerName;
    private int productCount;
    private int totalStock;
    private BigDecimal inventoryValue;
    private List<ProductView> lowStockProducts;
}
