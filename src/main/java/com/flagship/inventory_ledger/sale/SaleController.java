package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.ledger.TransactionRecorder;
import com.flagship.inventory_ledger.sale.dto.PaymentStatusRequest;
import com.flagship.inventory_ledger.sale.dto.RecordSaleRequest;
import com.flagship.inventory_ledger.sale.dto.SaleResponse;
import com.flagship.inventory_ledger.sale.dto.UpdateSaleRequest;
import com.flagship.inventory_ledger.web.ActorHeaders;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Sales endpoints. Creation accepts an optional Idempotency-Key header; a
 * repeated key returns the sale recorded the first time.
 */
@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
@Slf4j
public class SaleController {

    private final TransactionRecorder transactionRecorder;
    private final SaleQueryService saleQueryService;

    @PostMapping
    public ResponseEntity<SaleResponse> recordSale(
            @Valid @RequestBody RecordSaleRequest request,
            @RequestHeader(value = ActorHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            Actor actor) {

        log.info("Received sale request: productId={}, quantity={}, idempotencyKey={}",
                request.getProductId(), request.getQuantity(), idempotencyKey);

        Sale sale = transactionRecorder.createSale(
            request.getProductId(),
            request.getQuantity(),
            request.getUnitPrice(),
            request.getPaymentMethod(),
            request.getPaymentStatus(),
            actor,
            idempotencyKey
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(SaleResponse.from(sale));
    }

    @PutMapping("/{id}")
    public SaleResponse updateSale(@PathVariable("id") UUID id,
                                   @Valid @RequestBody UpdateSaleRequest request,
                                   Actor actor) {
        return SaleResponse.from(transactionRecorder.updateSale(id, request.toChanges(), actor));
    }

    @PatchMapping("/{id}/payment-status")
    public SaleResponse updatePaymentStatus(@PathVariable("id") UUID id,
                                            @Valid @RequestBody PaymentStatusRequest request,
                                            Actor actor) {
        return SaleResponse.from(transactionRecorder.updatePaymentStatus(id, request.getPaymentStatus(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSale(@PathVariable("id") UUID id, Actor actor) {
        transactionRecorder.deleteSale(id, actor);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public SaleResponse getSale(@PathVariable("id") UUID id) {
        return SaleResponse.from(saleQueryService.get(id));
    }

    @GetMapping
    public PageResponse<SaleResponse> listSales(
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "product_id", required = false) UUID productId,
            @RequestParam(value = "payment_status", required = false) PaymentStatus paymentStatus,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "" + PageRequests.DEFAULT_SIZE) int size) {

        SaleFilter filter = SaleFilter.builder()
            .from(from)
            .to(to)
            .productId(productId)
            .paymentStatus(paymentStatus)
            .build();
        return saleQueryService.list(filter, page, size).map(SaleResponse::from);
    }
}
