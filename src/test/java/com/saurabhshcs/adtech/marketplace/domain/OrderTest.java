package com.saurabhshcs.adtech.marketplace.domain;
import org.junit.jupiter.api.Test;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
class OrderTest {
    @Test void completed_derivesTotalFromItemPrices() {
        Order order = Order.completed(1, 7, List.of(item(1, "19.99"), item(2, "0.01"), item(1, "19.99")));
        assertThat(order.getTotalAmount()).isEqualByComparingTo("40.00");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getCreatedAt()).isNotNull();
    }
    @Test void completed_snapshotsItems() {
        List<OrderItem> items = new ArrayList<>(List.of(item(1, "5")));
        Order order = Order.completed(1, 7, items);
        items.add(item(2, "100"));
        assertThat(order.getItems()).hasSize(1);
        assertThat(order.getTotalAmount()).isEqualByComparingTo("5");
        assertThatThrownBy(() -> order.getItems().add(item(3, "1"))).isInstanceOf(UnsupportedOperationException.class);
    }
    private static OrderItem item(long productId, String price) { return new OrderItem(productId, "P" + productId, ProductCategory.HOME, new BigDecimal(price)); }
}
