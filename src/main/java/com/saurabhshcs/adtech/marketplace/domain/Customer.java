package com.saurabhshcs.adtech.marketplace.domain;
import lombok.Getter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
@Getter
public class Customer {
    private final long id;
    private final String name;
    private final Set<ProductCategory> preferences;
    private final Cart cart = new Cart();
    private final List<OrderItem> purchaseHistory = new ArrayList<>();
    private BigDecimal budget;
    public Customer(long id, String name, BigDecimal budget, Set<ProductCategory> preferences) {
        Objects.requireNonNull(budget, "Budget must not be null");
        Objects.requireNonNull(preferences, "Preferences must not be null");
        if (budget.signum() < 0) throw new IllegalArgumentException("Budget must not be negative");
        this.id = id;
        this.name = name;
        this.budget = budget;
        this.preferences = preferences.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ProductCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(preferences));
    }
    public synchronized BigDecimal getBudget() { return budget; }
    public synchronized boolean canAfford(BigDecimal amount) { return amount.compareTo(budget) <= 0; }
    public boolean prefers(ProductCategory category) { return preferences.contains(category); }
    public synchronized void debit(BigDecimal amount) {
        if (amount.signum() < 0) throw new IllegalArgumentException("Debit must not be negative");
        if (budget.compareTo(amount) < 0) throw new IllegalStateException("Insufficient budget for customer " + id);
        budget = budget.subtract(amount);
    }
    public synchronized void recordPurchase(List<OrderItem> items) { purchaseHistory.addAll(items); }
    public synchronized List<OrderItem> getPurchaseHistory() { return List.copyOf(purchaseHistory); }
}
