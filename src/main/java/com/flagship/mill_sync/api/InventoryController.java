package com.flagship.mill_sync.api;

import com.flagship.mill_sync.api.dto.CreateInventoryItemRequest;
import com.flagship.mill_sync.api.dto.InventoryItemResponse;
import com.flagship.mill_sync.api.dto.StockAdjustmentRequest;
import com.flagship.mill_sync.api.dto.StockMovementResponse;
import com.flagship.mill_sync.api.dto.UpdateInventoryItemRequest;
import com.flagship.mill_sync.inventory.InventoryItemEntity;
import com.flagship.mill_sync.stock.StockMovement;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
@Slf4j
public class InventoryController {

    private final SyncFacade syncFacade;

    @PostMapping
    public ResponseEntity<InventoryItemResponse> createItem(@Valid @RequestBody CreateInventoryItemRequest request) {
        log.info("Received inventory item creation request: type={}, name={}, opening={}",
                request.getItemType(), request.getName(), request.getOpeningQuantity());
        InventoryItemEntity item = syncFacade.createInventoryItem(request.toDetails(), request.getOpeningQuantity(),
                request.openingBagsOrZero(), request.getOpeningPricePerKg()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(InventoryItemResponse.from(item));
    }

    @PutMapping("/{id}")
    public ResponseEntity<InventoryItemResponse> updateItem(@PathVariable("id") long id,
                                                            @Valid @RequestBody UpdateInventoryItemRequest request) {
        InventoryItemEntity item = syncFacade.updateInventoryItem(id, request.toDetails()).getOrThrow();
        return ResponseEntity.ok(InventoryItemResponse.from(item));
    }

    /**
     * Corrects the item to a counted quantity. The signed difference is
     * recorded as an adjustment movement.
     */
    @PostMapping("/{id}/adjustments")
    public ResponseEntity<StockMovementResponse> adjustStock(@PathVariable("id") long id,
                                                             @Valid @RequestBody StockAdjustmentRequest request) {
        log.info("Received stock adjustment: item={}, quantity={}, bags={}",
                id, request.getQuantity(), request.getBags());
        StockMovement movement = syncFacade.adjustStock(id, request.getQuantity(), request.getBags(),
                request.getReason()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(StockMovementResponse.from(movement));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InventoryItemResponse> getItem(@PathVariable("id") long id) {
        InventoryItemEntity item = syncFacade.findInventoryItem(id).getOrThrow();
        List<StockMovement> movements = syncFacade.findStockMovements(id).getOrThrow();
        return ResponseEntity.ok(InventoryItemResponse.from(item, movements));
    }
}
