package com.saurabhshcs.adtech.marketplace.domain;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
@Getter @Builder(access = AccessLevel.PRIVATE) @ToString
public class Order {
    private final long orderId;
    private final long customerId;
    private final List<OrderItem> items;
    private final BigDecimal totalAmount;
    private final OrderStatus status;
    private final Instant createdAt;
    public static Order completed(long orderId, long customerId, List<OrderItem> items) {
        BigDecimal total = items.stream().map(OrderItem::price).reduce(BigDecimal.ZERO, BigDecimal::add);
        return Order.builder().orderId(orderId).customerId(customerId).items(List.copyOf(items))
                .totalAmount(total).status(OrderStatus.COMPLETED).createdAt(Instant.now()).build();
    }
}
