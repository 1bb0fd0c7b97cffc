package com.catalogcache.web;

import com.catalogcache.model.Product;
import com.catalogcache.model.ProductPage;
import com.catalogcache.service.CatalogQueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Product and stats endpoints
 */
@Slf4j
@RestController
public class ProductController {

    private final CatalogQueryService catalogQueryService;

    public ProductController(CatalogQueryService catalogQueryService) {
        this.catalogQueryService = catalogQueryService;
    }

    /**
     * Products sorted by title, cursor paginated
     */
    @GetMapping("/products")
    public ResponseEntity<Map<String, Object>> listProducts(
            @RequestParam(value = "limit", defaultValue = "10") String limitParam,
            @RequestParam(value = "cursor", required = false) String cursor) {

        int limit;
        try {
            limit = Integer.parseInt(limitParam.trim());
        } catch (NumberFormatException e) {
            return badRequest("Invalid limit parameter");
        }
        if (limit < 1) {
            return badRequest("Invalid limit parameter");
        }

        log.info("Fetching products list with limit={} and cursor={}", limit, cursor);
        ProductPage page = catalogQueryService.listProducts(limit, cursor);

        Map<String, Object> response = new HashMap<>();
        response.put("products", page.products());
        response.put("nextPage", page.nextCursor());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/products/{id}")
    public ResponseEntity<?> getProduct(@PathVariable String id) {
        Optional<Product> product = catalogQueryService.getProductById(id);
        if (product.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Product not found"));
        }
        return ResponseEntity.ok(product.get());
    }

    @GetMapping("/api-stats")
    public ApiStatsResponse apiStats() {
        return ApiStatsResponse.from(catalogQueryService.getMetricsSnapshot());
    }

    @PostMapping("/reset-stats")
    public ResponseEntity<String> resetStats() {
        catalogQueryService.resetMetrics();
        return ResponseEntity.ok("Metrics reset successfully");
    }

    private ResponseEntity<Map<String, Object>> badRequest(String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
