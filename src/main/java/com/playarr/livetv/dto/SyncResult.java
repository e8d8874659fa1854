package com.playarr.livetv.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one full live TV sync. Users without live TV configured do not appear.
 */
public class SyncResult {

    @JsonProperty("users_processed")
    private int usersProcessed;

    private List<UserSyncResult> results;

    @JsonProperty("duration_ms")
    private long durationMs;

    public SyncResult() {
    }

    public SyncResult(List<UserSyncResult> results, long durationMs) {
        this.usersProcessed = results.size();
        this.results = results;
        this.durationMs = durationMs;
    }

    public static SyncResult empty(long durationMs) {
        return new SyncResult(List.of(), durationMs);
    }

    public int getUsersProcessed() {
        return usersProcessed;
    }

    public void setUsersProcessed(int usersProcessed) {
        this.usersProcessed = usersProcessed;
    }

    public List<UserSyncResult> getResults() {
        return results;
    }

    public void setResults(List<UserSyncResult> results) {
        this.results = results;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public long countSuccessful() {
        return results.stream().filter(UserSyncResult::isSuccess).count();
    }

    @Override
    public String toString() {
        return "SyncResult{" +
                "usersProcessed=" + usersProcessed +
                ", successful=" + countSuccessful() +
                ", durationMs=" + durationMs +
                '}';
    }
}
