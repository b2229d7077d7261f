package com.saurabhshcs.adtech.marketplace.domain;

public enum OrderStatus {
    PENDING,
    COMPLETED,
    CANCELLED
}
