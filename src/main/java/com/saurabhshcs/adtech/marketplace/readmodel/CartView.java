package com.saurabhshcs.adtech.marketplace.readmodel;
import com.saurabhshcs.adtech.marketplace.domain.OrderItem;
import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
import java.util.List;
@Data @Builder
public class CartView {
    private long customerId;
    private List<OrderItem> items;
    private BigDecimal total;
    private BigDecimal budget;
}
