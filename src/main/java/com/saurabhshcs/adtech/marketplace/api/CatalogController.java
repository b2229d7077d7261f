package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.domain.ProductCategory;
import com.saurabhshcs.adtech.marketplace.readmodel.ProductView;
import com.saurabhshcs.adtech.marketplace.readmodel.SellerView;
import com.saurabhshcs.adtech.marketplace.repository.Catalog;
import com.saurabhshcs.adtech.marketplace.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.List;
@RestController @RequestMapping("/api/v1") @RequiredArgsConstructor
public class CatalogController {
    private final Catalog catalog;
    private final ReportService reportService;
    @GetMapping("/products")
    public ResponseEntity<List<ProductView>> availableProducts(@RequestParam(required = false) ProductCategory category) {
        if (category == null) return ResponseEntity.ok(reportService.availableProducts());
        return ResponseEntity.ok(catalog.available(category).stream().map(reportService::toView).toList());
    }
    @GetMapping("/sellers") public ResponseEntity<List<SellerView>> sellers() { return ResponseEntity.ok(reportService.sellers()); }
}
