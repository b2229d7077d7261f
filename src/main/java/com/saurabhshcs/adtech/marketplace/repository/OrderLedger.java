package com.saurabhshcs.adtech.marketplace.repository;
import com.saurabhshcs.adtech.marketplace.domain.Order;
import org.springframework.stereotype.Repository;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
/** Append-only sequence of committed orders. Ids start at 1 and only grow. */
@Repository
public class OrderLedger {
    private final List<Order> orders = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    public long nextOrderId() { return sequence.incrementAndGet(); }
    public synchronized void append(Order order) {
        if (!orders.isEmpty() && orders.get(orders.size() - 1).getOrderId() >= order.getOrderId())
            throw new IllegalStateException("Order ids must be strictly increasing: " + order.getOrderId());
        orders.add(order);
    }
    public synchronized List<Order> findAll() { return List.copyOf(orders); }
    public synchronized Optional<Order> findById(long orderId) { return orders.stream().filter(o -> o.getOrderId() == orderId).findFirst(); }
    public synchronized List<Order> findByCustomer(long customerId) { return orders.stream().filter(o -> o.getCustomerId() == customerId).toList(); }
    public synchronized Optional<Order> latest() { return orders.isEmpty() ? Optional.empty() : Optional.of(orders.get(orders.size() - 1)); }
    public synchronized int count() { return orders.size(); }
    public synchronized BigDecimal totalRevenue() { return orders.stream().map(Order::getTotalAmount).reduce(BigDecimal.ZERO, BigDecimal::add); }
}
