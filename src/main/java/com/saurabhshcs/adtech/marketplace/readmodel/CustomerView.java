package com.saurabhshcs.adtech.marketplace.readmodel;
import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.OrderItem;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import lombok.Builder;
import lombok.Data;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
@Data @Builder
public class CustomerView {
    private long id;
    private String name;
    private BigDecimal budget;
    private Set<ProductCategory> preferences;
    private int cartSize;
    private List<OrderItem> purchaseHistory;
    public static CustomerView of(Customer customer) {
        return CustomerView.builder().id(customer.getId()).name(customer.getName()).budget(customer.getBudget())
                .preferences(customer.getPreferences()).cartSize(customer.getCart().size())
                .purchaseHistory(customer.getPurchaseHistory()).build();
    }
}
