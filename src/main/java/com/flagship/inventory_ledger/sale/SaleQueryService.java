package com.flagship.inventory_ledger.sale;

import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PageResponse;
import com.flagship.inventory_ledger.common.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneId;
import java.util.UUID;

/**
 * Read side of sales. Writes go through the transaction recorder.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SaleQueryService {

    private final SaleRepository saleRepository;
    private final ZoneId organizationZone;

    public Sale get(UUID saleId) {
        return saleRepository.findById(saleId)
            .map(SaleEntity::toDomain)
            .orElseThrow(() -> new NotFoundException("Sale", saleId));
    }

    public PageResponse<Sale> list(SaleFilter filter, int page, int size) {
        SaleFilter effective = filter != null ? filter : SaleFilter.builder().build();
        return PageResponse.from(
            saleRepository.findAll(SaleSpecifications.matching(effective, organizationZone),
                    PageRequests.newestFirst(page, size, "soldAt")),
            SaleEntity::toDomain);
    }
}
