package com.saurabhshcs.adtech.marketplace.result;
import com.saurabhshcs.adtech.marketplace.domain.Order;
import lombok.Builder;
import lombok.Getter;
import java.util.Optional;
@Getter @Builder
public class PurchaseResult {
    private final boolean success;
    private final Order order;
    private final FailureReason failureReason;
    private final String message;
    public static PurchaseResult completed(Order order) {
        return PurchaseResult.builder().success(true).order(order)
                .message("Order #" + order.getOrderId() + " completed").build();
    }
    public static PurchaseResult rejected(FailureReason reason, String detail) {
        return PurchaseResult.builder().success(false).failureReason(reason)
                .message("Purchase rejected: " + detail).build();
    }
    public Optional<Order> order() { return Optional.ofNullable(order); }
}
