package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PurchaseQueryService {

    private final PurchaseRepository purchaseRepository;
    private final ZoneId organizationZone;

    public Purchase get(UUID purchaseId) {
        return purchaseRepository.findById(purchaseId)
            .map(PurchaseEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Purchase", purchaseId));
    }

    public PageResponse<Purchase> list(PurchaseFilter filter, int page, int size) {
        PurchaseFilter effective = filter != null ? filter : PurchaseFilter.builder().build();
        return PageResponse.from(
            purchaseRepository.findAll(PurchaseSpecifications.matching(effective, organizationZone),
                    PageRequests.newestFirst(page, size, "purchasedAt")),
            PurchaseEntity::toDomain);
    }

    /**
     * Distinct supplier names, alphabetical.
     */
    public List<String> suppliers() {
        return purchaseRepository.findDistinctSuppliers();
    }
}
