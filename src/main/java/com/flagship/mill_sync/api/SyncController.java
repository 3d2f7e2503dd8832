package com.flagship.mill_sync.api;

import com.flagship.mill_sync.api.dto.ConnectivityRequest;
import com.flagship.mill_sync.api.dto.SyncPassResponse;
import com.flagship.mill_sync.api.dto.SyncProblemResponse;
import com.flagship.mill_sync.api.dto.SyncStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Sync indicator, manual sync and manual resolution of stuck records.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncController {

    private final SyncFacade syncFacade;

    /**
     * Runs a pass on the sync thread; the response is written when it finishes.
     */
    @PostMapping("/now")
    public CompletableFuture<ResponseEntity<SyncPassResponse>> syncNow() {
        log.info("Manual sync requested");
        return syncFacade.syncNow().thenApply(result -> ResponseEntity.ok(SyncPassResponse.from(result)));
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status() {
        return ResponseEntity.ok(SyncStatusResponse.from(syncFacade.getSyncStatus().getOrThrow()));
    }

    @GetMapping("/problems")
    public ResponseEntity<List<SyncProblemResponse>> problems() {
        List<SyncProblemResponse> problems = syncFacade.getProblems().getOrThrow().stream()
                .map(SyncProblemResponse::from)
                .toList();
        return ResponseEntity.ok(problems);
    }

    @PostMapping("/records/{id}/retry")
    public ResponseEntity<SyncProblemResponse> retry(@PathVariable("id") UUID id) {
        log.info("Retry requested for mutation {}", id);
        return ResponseEntity.ok(SyncProblemResponse.from(syncFacade.retryRecord(id).getOrThrow()));
    }

    @PostMapping("/records/{id}/discard")
    public ResponseEntity<SyncProblemResponse> discard(@PathVariable("id") UUID id) {
        log.info("Discard requested for mutation {}", id);
        return ResponseEntity.ok(SyncProblemResponse.from(syncFacade.discardRecord(id).getOrThrow()));
    }

    @PostMapping("/connectivity")
    public ResponseEntity<SyncStatusResponse> connectivity(@Valid @RequestBody ConnectivityRequest request) {
        syncFacade.reportConnectivity(request.getOnline());
        return ResponseEntity.ok(SyncStatusResponse.from(syncFacade.getSyncStatus().getOrThrow()));
    }
}
