package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.readmodel.CustomerView;
import com.saurabhshcs.adtech.marketplace.readmodel.ProductView;
import com.saurabhshcs.adtech.marketplace.repository.MarketplaceRegistry;
import com.saurabhshcs.adtech.marketplace.service.CartService;
import com.saurabhshcs.adtech.marketplace.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
@RestController @RequestMapping("/api/v1/customers") @RequiredArgsConstructor
public class CustomerController {
    private final MarketplaceRegistry registry;
    private final CartService cartService;
    private final ReportService reportService;
    @GetMapping public ResponseEntity<List<CustomerView>> customers() { return ResponseEntity.ok(registry.customers().stream().map(CustomerView::of).toList()); }
    @GetMapping("/{id}") public ResponseEntity<CustomerView> customer(@PathVariable long id) { return registry.findCustomer(id).map(CustomerView::of).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build()); }
    @GetMapping("/{id}/recommendations")
    public ResponseEntity<List<ProductView>> recommendations(@PathVariable long id) {
        return ResponseEntity.ok(cartService.browse(id).stream().map(reportService::toView).toList());
    }
}
