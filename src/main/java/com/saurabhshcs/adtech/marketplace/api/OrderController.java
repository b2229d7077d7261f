package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.domain.Order;
import com.saurabhshcs.adtech.marketplace.result.PurchaseResult;
import com.saurabhshcs.adtech.marketplace.service.OrderProcessor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
@RestController @RequestMapping("/api/v1/customers/{customerId}/orders") @RequiredArgsConstructor
public class OrderController {
    private final OrderProcessor orderProcessor;
    @PostMapping
    public ResponseEntity<PurchaseResult> placeOrder(@PathVariable long customerId) {
        PurchaseResult result = orderProcessor.placeOrder(customerId);
        int status = result.isSuccess() ? 201 : 422;
        return ResponseEntity.status(status).body(result);
    }
    @GetMapping public ResponseEntity<List<Order>> orders(@PathVariable long customerId) { return ResponseEntity.ok(orderProcessor.ordersFor(customerId)); }
}
