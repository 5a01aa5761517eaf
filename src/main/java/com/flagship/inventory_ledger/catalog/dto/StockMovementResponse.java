package com.flagship.inventory_ledger.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.ledger.MovementType;
import com.flagship.inventory_ledger.ledger.StockMovement;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class StockMovementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("movement_type")
    MovementType movementType;

    @JsonProperty("quantity_delta")
    int quantityDelta;

    @JsonProperty("stock_after")
    int stockAfter;

    @JsonProperty("reference_type")
    String referenceType;

    @JsonProperty("reference_id")
    UUID referenceId;

    @JsonProperty("actor_id")
    UUID actorId;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_at")
    Instant createdAt;

    public static StockMovementResponse from(StockMovement movement) {
        return StockMovementResponse.builder()
            .id(movement.getId())
            .movementType(movement.getMovementType())
            .quantityDelta(movement.getQuantityDelta())
            .stockAfter(movement.getStockAfter())
            .referenceType(movement.getReferenceType())
            .referenceId(movement.getReferenceId())
            .actorId(movement.getActorId())
            .note(movement.getNote())
            .createdAt(movement.getCreatedAt())
            .build();
    }
}
