package io.intellixity.quill.examples.web;

import io.intellixity.quill.examples.domain.Product;
import io.intellixity.quill.examples.domain.Review;
import io.intellixity.quill.examples.service.ProductService;
import io.intellixity.quill.exec.QueryException;
import io.intellixity.quill.query.QueryValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/products")
public final class ProductController {
  private final ProductService products;

  public ProductController(ProductService products) {
    this.products = products;
  }

  public record CreateProductRequest(String name, String category, Integer priceCents, List<String> tags) {}

  public record RepriceRequest(int priceCents) {}

  @PostMapping
  public Product create(@RequestBody CreateProductRequest req) {
    return products.create(new Product(null, req.name(), req.category(), req.priceCents(), true,
        req.tags() == null ? List.of() : req.tags()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<Product> get(@PathVariable("id") String id) {
    Product p = products.get(id);
    return (p == null) ? ResponseEntity.notFound().build() : ResponseEntity.ok(p);
  }

  @GetMapping
  public List<Product> search(@RequestParam(name = "category", required = false) String category,
                              @RequestParam(name = "maxPriceCents", required = false) Integer maxPriceCents,
                              @RequestParam(name = "limit", required = false) Integer limit) {
    return products.search(category, maxPriceCents, limit);
  }

  @GetMapping("/count")
  public long count(@RequestParam(name = "category", required = false) String category) {
    return products.count(category);
  }

  @PatchMapping("/{id}/price")
  public ResponseEntity<Void> reprice(@PathVariable("id") String id, @RequestBody RepriceRequest req) {
    products.reprice(id, req.priceCents());
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    products.delete(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/reviews")
  public Review addReview(@PathVariable("id") String id, @RequestBody Review review) {
    return products.addReview(id, review);
  }

  @GetMapping("/{id}/reviews")
  public List<Review> reviews(@PathVariable("id") String id,
                              @RequestParam(name = "minRating", defaultValue = "1") int minRating) {
    return products.reviews(id, minRating);
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<Map<String, String>> invalid(QueryValidationException e) {
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler(QueryException.class)
  public ResponseEntity<Map<String, String>> failed(QueryException e) {
    HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
    return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
  }
}
