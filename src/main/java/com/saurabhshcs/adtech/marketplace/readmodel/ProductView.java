package com.saurabhshcs.adtech.marketplace.readmodel;
import com.saurabhshcs.adtech.marketplace.domain.Product;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
@Data @Builder
public class ProductView {
    private long id;
    private String name;
    private ProductCategory category;
    private String categoryName;
    private BigDecimal price;
    private int stock;
    private long sellerId;
    private String sellerName;
    public static ProductView of(Product product, String sellerName) {
        return ProductView.builder().id(product.getId()).name(product.getName()).category(product.getCategory())
                .categoryName(product.getCategory().getDisplayName()).price(product.getPrice()).stock(product.getStock())
                .sellerId(product.getSellerId()).sellerName(sellerName).build();
    }
}
