package com.flagship.mill_sync.transaction;

import com.flagship.mill_sync.common.LedgerRecord;
import com.flagship.mill_sync.inventory.ItemType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * One line of a transaction. Synced together with its transaction.
 */
@Entity
@Table(name = "transaction_items")
@Getter
public class TransactionItemEntity extends LedgerRecord {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "transaction_local_id", nullable = false, updatable = false)
    private TransactionEntity transaction;

    @Column(name = "inventory_item_local_id", nullable = false, updatable = false)
    private long inventoryItemLocalId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 16)
    private ItemType itemType;

    @Column(name = "variety", length = 100)
    private String variety;

    @Column(name = "bags", nullable = false)
    private int bags;

    @Column(name = "quantity", nullable = false, precision = 19, scale = 3)
    private BigDecimal quantity;

    @Column(name = "price_per_kg", nullable = false, precision = 19, scale = 2)
    private BigDecimal pricePerKg;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    protected TransactionItemEntity() {
        // JPA
    }

    public TransactionItemEntity(long localId, Instant now, long inventoryItemLocalId, ItemType itemType,
                                 String variety, int bags, BigDecimal quantity, BigDecimal pricePerKg) {
        super(localId, now);
        this.inventoryItemLocalId = inventoryItemLocalId;
        this.itemType = itemType;
        this.variety = variety;
        this.bags = bags;
        this.quantity = quantity;
        this.pricePerKg = pricePerKg;
        this.totalAmount = quantity.multiply(pricePerKg).setScale(2, RoundingMode.HALF_UP);
    }

    void attachTo(TransactionEntity transaction) {
        this.transaction = transaction;
    }
}
