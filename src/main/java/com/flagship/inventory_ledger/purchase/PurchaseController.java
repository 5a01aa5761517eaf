package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.purchase.dto.PurchaseResponse;
import com.flagship.inventory_ledger.purchase.dto.RecordPurchaseRequest;
import com.flagship.inventory_ledger.purchase.dto.UpdatePurchaseRequest;
import com.flagship.inventory_ledger.web.ActorHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/purchases")
@RequiredArgsConstructor
@Slf4j
public class PurchaseController {

    private final TransactionRecorder transactionRecorder;
    private final PurchaseQueryService purchaseQueryService;

    @PostMapping
    public ResponseEntity<PurchaseResponse> recordPurchase(
            @Valid @RequestBody RecordPurchaseRequest request,
            @RequestHeader(value = ActorHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            Actor actor) {

        log.info("Received purchase request: productId={}, quantity={}, supplier={}",
                request.getProductId(), request.getQuantity(), request.getSupplier());

        Purchase purchase = transactionRecorder.createPurchase(
            request.getProductId(),
            request.getQuantity(),
            request.getUnitCost(),
            request.getSupplier(),
            actor,
            idempotencyKey
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(PurchaseResponse.from(purchase));
    }

    @PutMapping("/{id}")
    public PurchaseResponse updatePurchase(@PathVariable("id") UUID id,
                                           @Valid @RequestBody UpdatePurchaseRequest request,
                                           Actor actor) {
        return PurchaseResponse.from(transactionRecorder.updatePurchase(id, request.toChanges(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePurchase(@PathVariable("id") UUID id, Actor actor) {
        transactionRecorder.deletePurchase(id, actor);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public PurchaseResponse getPurchase(@PathVariable("id") UUID id) {
        return PurchaseResponse.from(purchaseQueryService.get(id));
    }

    @GetMapping("/suppliers")
    public List<String> listSuppliers() {
        return purchaseQueryService.suppliers();
    }

    @GetMapping
    public PageResponse<PurchaseResponse> listPurchases(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "product_id", required = false) UUID productId,
            @RequestParam(value = "supplier", required = false) String supplier,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "" + PageRequests.DEFAULT_SIZE) int size) {

        PurchaseFilter filter = PurchaseFilter.builder()
            .from(from)
            .to(to)
            .productId(productId)
            .supplier(supplier)
            .build();
        return purchaseQueryService.list(filter, page, size).map(PurchaseResponse::from);
    }
}
