package com.flagship.mill_sync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.mill_sync.common.SyncStatus;
import com.flagship.mill_sync.milling.MillingRecordEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class MillingResponse {

    @JsonProperty("local_id")
    long localId;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("paddy_item_id")
    long paddyItemId;

    @JsonProperty("rice_item_id")
    long riceItemId;

    @JsonProperty("paddy_quantity")
    BigDecimal paddyQuantity;

    @JsonProperty("rice_quantity")
    BigDecimal riceQuantity;

    @JsonProperty("paddy_bags")
    int paddyBags;

    @JsonProperty("rice_bags")
    int riceBags;

    @JsonProperty("wastage_quantity")
    BigDecimal wastageQuantity;

    @JsonProperty("milling_percentage")
    BigDecimal millingPercentage;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("sync_status")
    SyncStatus syncStatus;

    @JsonProperty("milling_date")
    Instant millingDate;

    public static MillingResponse from(MillingRecordEntity record) {
        return MillingResponse.builder()
                .localId(record.getLocalId())
                .serverId(record.getServerId())
                .paddyItemId(record.getPaddyItemLocalId())
                .riceItemId(record.getRiceItemLocalId())
                .paddyQuantity(record.getPaddyQuantity())
                .riceQuantity(record.getRiceQuantity())
                .paddyBags(record.getPaddyBags())
                .riceBags(record.getRiceBags())
                .wastageQuantity(record.getWastageQuantity())
                .millingPercentage(record.getMillingPercentage())
                .notes(record.getNotes())
                .syncStatus(record.getSyncStatus())
                .millingDate(record.getMillingDate())
                .build();
    }
}
