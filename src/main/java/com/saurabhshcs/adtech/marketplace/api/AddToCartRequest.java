package com.saurabhshcs.adtech.marketplace.api;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
@Data
public class AddToCartRequest {
    @NotNull @Positive private Long productId;
}
