package com.saurabhshcs.adtech.marketplace.readmodel;
import lombok.Builder;
import lombok.Data;
import java.util.List;
@Data @Builder
public class SellerView {
    private long id;
    private String name;
    private List<ProductView> products;
}
