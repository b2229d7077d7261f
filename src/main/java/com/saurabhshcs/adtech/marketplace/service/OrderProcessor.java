package com.saurabhshcs.adtech.marketplace.service;
import com.saurabhshcs.adtech.marketplace.domain.Cart;
import com.saurabhshcs.adtech.marketplace.domain.Customer;
import com.saurabhshcs.adtech.marketplace.domain.Order;
import com.saurabhshcs.adtech.marketplace.domain.OrderItem;
import com.saurabhshcs.adtech.marketplace.repository.Catalog;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import com.saurabhshcs.adtech.marketplace.repository.OrderLedger;
import com.saurabhshcs.adtech.marketplace.result.FailureReason;
import com.saurabhshcs.adtech.marketplace.result.PurchaseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import static com.saurabhshcs.adtech.marketplace.common.LogMessage.*;
/**
 * The only path from a cart to a committed {@link Order}.
 * <p>
 * Validation (cart not empty, stock per product covers the units in the cart, total within
 * budget) mutates nothing. The commit phase decrements stock, debits the budget, records the
 * purchase, clears the cart and appends to the ledger. Both phases run under one lock, so two
 * checkouts can never both observe the last unit.
 */
@Slf4j @Service @RequiredArgsConstructor
public class OrderProcessor {
    private final MarketplaceRegistry registry;
    private final Catalog catalog;
    private final OrderLedger ledger;
    private final ReentrantLock commitLock = new ReentrantLock();
    public PurchaseResult placeOrder(long customerId) {
        Customer customer = registry.requireCustomer(customerId);
        Cart cart = customer.getCart();
        commitLock.lock();
        try {
            // holding the cart monitor keeps concurrent adds out until the cart is cleared
            synchronized (cart) {
                return checkout(customer, cart.items());
            }
        } finally {
            commitLock.unlock();
        }
    }
    public List<Order> ordersFor(long customerId) {
        registry.requireCustomer(customerId);
        return ledger.findByCustomer(customerId);
    }
    private PurchaseResult checkout(Customer customer, List<OrderItem> items) {
        long customerId = customer.getId();
        log.info(CHECKOUT_STARTED.getMessage(), customerId, items.size());
        if (items.isEmpty())
            return reject(customerId, FailureReason.EMPTY_CART, "cart is empty");
        List<Long> productIds = items.stream().map(OrderItem::productId).toList();
        Map<Long, Long> shortfall = catalog.shortfall(productIds);
        if (!shortfall.isEmpty())
            return reject(customerId, FailureReason.PRODUCT_UNAVAILABLE, "insufficient stock for products " + shortfall.keySet());
        BigDecimal total = items.stream().map(OrderItem::price).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (!customer.canAfford(total))
            return reject(customerId, FailureReason.INSUFFICIENT_BUDGET,
                    "total " + total + " exceeds budget " + customer.getBudget());
        return PurchaseResult.completed(commit(customer, items, productIds));
    }
    private Order commit(Customer customer, List<OrderItem> items, List<Long> productIds) {
        catalog.commitDecrement(productIds);
        Order order = Order.completed(ledger.nextOrderId(), customer.getId(), items);
        customer.debit(order.getTotalAmount());
        customer.recordPurchase(items);
        customer.getCart().clear();
        ledger.append(order);
        log.info(ORDER_COMPLETED.getMessage(), order.getOrderId(), customer.getId(), order.getTotalAmount());
        return order;
    }
    private PurchaseResult reject(long customerId, FailureReason reason, String detail) {
        log.warn(CHECKOUT_REJECTED.getMessage(), customerId, reason);
        return PurchaseResult.rejected(reason, detail);
    }
}
