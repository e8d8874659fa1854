package com.playarr.livetv.service;

import com.playarr.livetv.dto.SyncResult;

/**
 * Refreshes every user's live TV channels and programmes from their upstream playlist and guide.
 */
public interface LiveTvSyncService {

    /**
     * Run one full sync on the calling thread.
     *
     * Process:
     * 1. Load users and sort them into skipped, corrupt and eligible
     * 2. Coalesce identical playlist and guide URLs across users
     * 3. Fetch every unique URL once, in parallel
     * 4. Process each user in parallel into channel and programme records
     * 5. Bulk delete the successful users' old records, then bulk insert the new ones
     *
     * Per-user failures are reported in the result. Interrupting the calling thread before step 5
     * aborts the sync without touching stored records.
     *
     * @throws com.playarr.livetv.exception.RepositoryException if loading users or bulk persistence fails
     * @throws com.playarr.livetv.exception.SyncCancelledException if the sync is interrupted before persistence
     */
    SyncResult syncAllUsers();
}
