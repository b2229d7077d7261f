package com.saurabhshcs.adtech.marketplace.common;

public enum LogMessage {
    PRODUCT_ADDED_TO_CART("Product {} added to cart of customerId: {}"),
    PRODUCT_REJECTED_FROM_CART("Product {} rejected for cart of customerId: {}. Reason: {}"),
    PRODUCT_REMOVED_FROM_CART("Removed {} entries of product {} from cart of customerId: {}"),
    CHECKOUT_STARTED("Starting checkout for customerId: {} with {} items"),
    CHECKOUT_REJECTED("Checkout rejected for customerId: {}. Reason: {}"),
    STOCK_COMMITTED("Stock decremented for products: {}"),
    ORDER_COMPLETED("Order {} completed for customerId: {} with total: {}"),
    CUSTOMER_REGISTERED("Registered customer {} ({})"),
    SELLER_REGISTERED("Registered seller {} ({}) with {} products");

    private final String message;

    LogMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return message;
    }
}
