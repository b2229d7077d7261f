package com.saurabhshcs.adtech.marketplace.domain;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
/**
 * Staging list of a single customer. Holds snapshots only; stock is untouched until checkout.
 */
public class Cart {
    private final List<OrderItem> items = new ArrayList<>();
    public synchronized void add(OrderItem item) { items.add(item); }
    public synchronized int remove(long productId) {
        int before = items.size();
        items.removeIf(item -> item.productId() == productId);
        return before - items.size();
    }
    public synchronized BigDecimal total() {
        return items.stream().map(OrderItem::price).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
    public synchronized List<OrderItem> items() { return List.copyOf(items); }
    public synchronized boolean isEmpty() { return items.isEmpty(); }
    public synchronized int size() { return items.size(); }
    public synchronized void clear() { items.clear(); }
}
