package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.readmodel.CartView;
import com.saurabhshcs.adtech.marketplace.result.CartResult;
import com.saurabhshcs.adtech.marketplace.service.CartService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.Map;
@RestController @RequestMapping("/api/v1/customers/{customerId}/cart") @RequiredArgsConstructor
public class CartController {
    private final CartService cartService;
    @GetMapping public ResponseEntity<CartView> view(@PathVariable long customerId) { return ResponseEntity.ok(cartService.view(customerId)); }
    @PostMapping
    public ResponseEntity<CartResult> add(@PathVariable long customerId, @Valid @RequestBody AddToCartRequest request) {
        CartResult result = cartService.add(customerId, request.getProductId());
        return ResponseEntity.status(result.isSuccess() ? 200 : 422).body(result);
    }
    @DeleteMapping("/{productId}")
    public ResponseEntity<Map<String, Integer>> remove(@PathVariable long customerId, @PathVariable long productId) {
        return ResponseEntity.ok(Map.of("removed", cartService.remove(customerId, productId)));
    }
}
