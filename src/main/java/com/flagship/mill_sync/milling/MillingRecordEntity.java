package com.flagship.mill_sync.milling;

import com.flagship.mill_sync.common.LedgerRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Audit row of one milling run: paddy consumed, rice produced, and the
 * wastage between them.
 */
@Entity
@Table(name = "milling_records")
@Getter
public class MillingRecordEntity extends LedgerRecord {

    @Column(name = "paddy_item_local_id", nullable = false, updatable = false)
    private long paddyItemLocalId;

    @Column(name = "rice_item_local_id", nullable = false, updatable = false)
    private long riceItemLocalId;

    @Column(name = "paddy_quantity", nullable = false, updatable = false, precision = 19, scale = 3)
    private BigDecimal paddyQuantity;

    @Column(name = "rice_quantity", nullable = false, updatable = false, precision = 19, scale = 3)
    private BigDecimal riceQuantity;

    @Column(name = "paddy_bags", nullable = false, updatable = false)
    private int paddyBags;

    @Column(name = "rice_bags", nullable = false, updatable = false)
    private int riceBags;

    @Column(name = "wastage_quantity", nullable = false, updatable = false, precision = 19, scale = 3)
    private BigDecimal wastageQuantity;

    @Column(name = "milling_percentage", nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal millingPercentage;

    @Column(name = "notes", length = 1000)
    private String notes;

    @Column(name = "milling_date", nullable = false, updatable = false)
    private Instant millingDate;

    protected MillingRecordEntity() {
        // JPA
    }

    public MillingRecordEntity(long localId, Instant now, long paddyItemLocalId, long riceItemLocalId,
                               BigDecimal paddyQuantity, BigDecimal riceQuantity,
                               int paddyBags, int riceBags, String notes) {
        super(localId, now);
        this.paddyItemLocalId = paddyItemLocalId;
        this.riceItemLocalId = riceItemLocalId;
        this.paddyQuantity = paddyQuantity;
        this.riceQuantity = riceQuantity;
        this.paddyBags = paddyBags;
        this.riceBags = riceBags;
        this.wastageQuantity = paddyQuantity.subtract(riceQuantity);
        this.millingPercentage = riceQuantity.multiply(BigDecimal.valueOf(100))
                .divide(paddyQuantity, 2, RoundingMode.HALF_UP);
        this.notes = notes;
        this.millingDate = now;
    }
}
