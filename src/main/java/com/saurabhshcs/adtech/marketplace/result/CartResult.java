package com.saurabhshcs.adtech.marketplace.result;
import lombok.Builder;
import lombok.Getter;
@Getter @Builder
public class CartResult {
    private final boolean success;
    private final long productId;
    private final FailureReason failureReason;
    private final String message;
    public static CartResult added(long productId, String productName) {
        return CartResult.builder().success(true).productId(productId)
                .message("'" + productName + "' added to cart").build();
    }
    public static CartResult rejected(long productId, FailureReason reason, String detail) {
        return CartResult.builder().success(false).productId(productId).failureReason(reason)
                .message("Product " + productId + " not added: " + detail).build();
    }
}
