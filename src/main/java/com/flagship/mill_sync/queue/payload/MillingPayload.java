package com.flagship.mill_sync.queue.payload;

import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.milling.MillingRecordEntity;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
public class MillingPayload implements MutationPayload {
    long paddyItemLocalId;
    long riceItemLocalId;
    BigDecimal paddyQuantity;
    BigDecimal riceQuantity;
    int paddyBags;
    int riceBags;
    BigDecimal wastageQuantity;
    BigDecimal millingPercentage;
    String notes;
    Instant millingDate;

    public static MillingPayload from(MillingRecordEntity record) {
        return new MillingPayload(
                record.getPaddyItemLocalId(),
                record.getRiceItemLocalId(),
                record.getPaddyQuantity(),
                record.getRiceQuantity(),
                record.getPaddyBags(),
                record.getRiceBags(),
                record.getWastageQuantity(),
                record.getMillingPercentage(),
                record.getNotes(),
                record.getMillingDate());
    }

    @Override
    public List<EntityRef> references() {
        return List.of(
                EntityRef.of(EntityType.INVENTORY, paddyItemLocalId),
                EntityRef.of(EntityType.INVENTORY, riceItemLocalId));
    }
}
