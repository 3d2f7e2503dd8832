package com.flagship.mill_sync.api;

import com.flagship.mill_sync.api.dto.MillingResponse;
import com.flagship.mill_sync.api.dto.RecordMillingRequest;
import com.flagship.mill_sync.milling.MillingRecordEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/milling")
@RequiredArgsConstructor
@Slf4j
public class MillingController {

    private final SyncFacade syncFacade;

    @PostMapping
    public ResponseEntity<MillingResponse> recordMilling(@Valid @RequestBody RecordMillingRequest request) {
        log.info("Received milling record: paddy={} ({} kg), rice={} ({} kg)",
                request.getPaddyItemId(), request.getPaddyQuantity(),
                request.getRiceItemId(), request.getRiceQuantity());
        MillingRecordEntity record = syncFacade.recordMilling(request.toCommand()).getOrThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(MillingResponse.from(record));
    }
}
