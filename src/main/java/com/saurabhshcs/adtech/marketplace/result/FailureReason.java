package com.saurabhshcs.adtech.marketplace.result;

public enum FailureReason {
    PRODUCT_UNAVAILABLE,
    INSUFFICIENT_BUDGET,
    EMPTY_CART
}
