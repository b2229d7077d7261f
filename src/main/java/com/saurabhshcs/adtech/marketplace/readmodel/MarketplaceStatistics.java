package com.saurabhshcs.adtech.marketplace.readmodel;
import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
@Data @Builder
public class MarketplaceStatistics {
    private int customers;
    private int sellers;
    private int availableProducts;
    private int orders;
    private BigDecimal totalRevenue;
}
