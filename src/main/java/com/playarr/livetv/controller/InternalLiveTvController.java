package com.playarr.livetv.controller;

import com.playarr.livetv.dto.SyncResult;
import com.playarr.livetv.service.impl.LiveTvSyncJob;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Internal controller for triggering and cancelling the live TV sync.
 * Protected by InternalApiKeyFilter (X-Api-Key header).
 */
@RestController
@RequestMapping("/internal/livetv")
public class InternalLiveTvController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(InternalLiveTvController.class);

    private final LiveTvSyncJob syncJob;
    private final MeterRegistry meterRegistry;

    public InternalLiveTvController(LiveTvSyncJob syncJob, MeterRegistry meterRegistry) {
        this.syncJob = syncJob;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a full sync and wait for it.
     *
     * @return 200 OK with the per-user results, 409 if a sync is already running or gets cancelled
     */
    @PostMapping("/sync")
    public ResponseEntity<SyncResult> triggerSync() {
        logger.info("Manual live TV sync requested");
        meterRegistry.counter("livetv_manual_sync_total", "action", "trigger").increment();

        SyncResult result = syncJob.runNow();
        return ResponseEntity.ok(result);
    }

    /**
     * Cancel the running sync, if any.
     *
     * @return 202 Accepted when a running sync was interrupted, 404 when nothing was running
     */
    @PostMapping("/sync/cancel")
    public ResponseEntity<Map<String, String>> cancelSync() {
        meterRegistry.counter("livetv_manual_sync_total", "action", "cancel").increment();

        if (!syncJob.cancel()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("status", "idle", "message", "No live TV sync is running"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("status", "cancelling"));
    }
}
