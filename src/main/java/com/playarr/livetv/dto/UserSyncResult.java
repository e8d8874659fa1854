package com.playarr.livetv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one user's sync as reported to callers. Counts are present only on success,
 * the error only on failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSyncResult {

    private String username;
    private boolean success;
    private Integer channels;
    private Integer programs;
    private String error;

    public UserSyncResult() {
    }

    private UserSyncResult(String username, boolean success, Integer channels, Integer programs, String error) {
        this.username = username;
        this.success = success;
        this.channels = channels;
        this.programs = programs;
        this.error = error;
    }

    public static UserSyncResult success(String username, int channels, int programs) {
        return new UserSyncResult(username, true, channels, programs, null);
    }

    public static UserSyncResult failure(String username, String error) {
        return new UserSyncResult(username, false, null, null, error);
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public Integer getChannels() {
        return channels;
    }

    public void setChannels(Integer channels) {
        this.channels = channels;
    }

    public Integer getPrograms() {
        return programs;
    }

    public void setPrograms(Integer programs) {
        this.programs = programs;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return success
                ? username + "{channels=" + channels + ", programs=" + programs + "}"
                : username + "{error='" + error + "'}";
    }
}
