package com.saurabhshcs.adtech.marketplace.api;
import com.saurabhshcs.adtech.marketplace.service.ReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
@RestController @RequestMapping("/api/v1/reports") @RequiredArgsConstructor
public class ReportController {
    private final ReportService reportService;
    @GetMapping("/sellers") public ResponseEntity<?> sellerInventory() { return ResponseEntity.ok(reportService.sellerInventory()); }
    @GetMapping("/sellers/{id}") public ResponseEntity<?> sellerInventory(@PathVariable long id) { return reportService.sellerInventory(id).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build()); }
    @GetMapping("/low-stock") public ResponseEntity<?> lowStock() { return ResponseEntity.ok(reportService.lowStock()); }
    @GetMapping("/statistics") public ResponseEntity<?> statistics() { return ResponseEntity.ok(reportService.statistics()); }
}
