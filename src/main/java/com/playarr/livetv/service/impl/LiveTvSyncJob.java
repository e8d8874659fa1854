package com.playarr.livetv.service.impl;

import com.playarr.livetv.config.LiveTvProperties;
import com.playarr.livetv.dto.SyncResult;
import com.playarr.livetv.exception.SyncInProgressException;
import com.playarr.livetv.service.LiveTvSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the live TV sync on a schedule and on demand, never more than one at a time.
 * Scheduled runs only happen when livetv.sync.enabled=true; manual runs are always allowed.
 */
@Service
public class LiveTvSyncJob {

    private static final Logger logger = LoggerFactory.getLogger(LiveTvSyncJob.class);

    private final LiveTvSyncService syncService;
    private final boolean scheduleEnabled;
    private final AtomicReference<Thread> runningThread = new AtomicReference<>();
    // guards the interrupt in cancel() against the release in runNow()
    private final Object cancelLock = new Object();

    public LiveTvSyncJob(LiveTvSyncService syncService, LiveTvProperties properties) {
        this(syncService, properties.getSync().isEnabled());
    }

    LiveTvSyncJob(LiveTvSyncService syncService, boolean scheduleEnabled) {
        this.syncService = syncService;
        this.scheduleEnabled = scheduleEnabled;
    }

    /**
     * Run a sync on the calling thread.
     *
     * @throws SyncInProgressException if another sync is running
     */
    public SyncResult runNow() {
        Thread current = Thread.currentThread();
        if (!runningThread.compareAndSet(null, current)) {
            throw new SyncInProgressException();
        }
        try {
            return syncService.syncAllUsers();
        } finally {
            synchronized (cancelLock) {
                runningThread.set(null);
                // a cancel that arrived while the sync was finishing must not leak into the next task on this thread
                Thread.interrupted();
            }
        }
    }

    /**
     * Interrupt the running sync. Nothing is deleted once the sync notices the interrupt.
     *
     * @return false if no sync was running
     */
    public boolean cancel() {
        synchronized (cancelLock) {
            Thread running = runningThread.get();
            if (running == null) {
                return false;
            }
            logger.warn("Cancelling running live TV sync on thread {}", running.getName());
            running.interrupt();
            return true;
        }
    }

    public boolean isRunning() {
        return runningThread.get() != null;
    }

    /**
     * Every six hours by default (configurable via livetv.sync.cron).
     */
    @Scheduled(cron = "${livetv.sync.cron:0 0 */6 * * *}")
    public void scheduledSync() {
        if (!scheduleEnabled) {
            return;
        }
        logger.info("Starting scheduled live TV sync");
        try {
            SyncResult result = runNow();
            logger.info("Scheduled live TV sync finished: {}", result);
        } catch (SyncInProgressException e) {
            logger.info("Skipping scheduled live TV sync, one is already running");
        } catch (Exception e) {
            logger.error("Scheduled live TV sync failed", e);
        }
    }
}
