package com.saurabhshcs.adtech.marketplace.exception;

/**
 * A stock decrement reached the catalog that would drive a counter below zero or that names
 * an unknown product. Checkout validates before committing, so this always indicates a bug
 * rather than a customer-facing failure.
 */
public class StockInvariantViolationException extends IllegalStateException {

    public StockInvariantViolationException(String message) {
        super(message);
    }
}
