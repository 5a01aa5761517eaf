package com.flagship.inventory_ledger.catalog;

import com.flagship.inventory_ledger.catalog.dto.CreateProductRequest;
import com.flagship.inventory_ledger.catalog.dto.ProductResponse;
import com.flagship.inventory_ledger.catalog.dto.StockMovementResponse;
import com.flagship.inventory_ledger.catalog.dto.UpdateProductRequest;
import com.flagship.inventory_ledger.common.Actor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request,
                                                         Actor actor) {
        Product product = productService.create(request.toNewProduct(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.from(product));
    }

    @PutMapping("/{id}")
    public ProductResponse updateProduct(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdateProductRequest request,
                                         Actor actor) {
        return ProductResponse.from(productService.update(id, request.toChanges(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProduct(@PathVariable("id") UUID id, Actor actor) {
        productService.delete(id, actor);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public ProductResponse getProduct(@PathVariable("id") UUID id) {
        return ProductResponse.from(productService.get(id));
    }

    @GetMapping
    public List<ProductResponse> listProducts(
            @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "low_stock", defaultValue = "false") boolean lowStockOnly) {

        ProductFilter filter = ProductFilter.builder()
            .search(search)
            .category(category)
            .lowStockOnly(lowStockOnly)
            .build();
        return productService.list(filter).stream().map(ProductResponse::from).toList();
    }

    @GetMapping("/categories")
    public List<String> listCategories() {
        return productService.categories();
    }

    @GetMapping("/{id}/movements")
    public List<StockMovementResponse> listMovements(@PathVariable("id") UUID id) {
        return productService.movements(id).stream().map(StockMovementResponse::from).toList();
    }
}
