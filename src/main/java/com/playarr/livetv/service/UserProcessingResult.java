package com.playarr.livetv.service;

import com.playarr.livetv.model.Channel;
import com.playarr.livetv.model.Program;

import java.util.List;

/**
 * What the per-user processor produced for one user: owned records on success, an error otherwise.
 */
public final class UserProcessingResult {

    private final String username;
    private final boolean success;
    private final List<Channel> channels;
    private final List<Program> programs;
    private final String error;

    private UserProcessingResult(String username, boolean success, List<Channel> channels,
                                 List<Program> programs, String error) {
        this.username = username;
        this.success = success;
        this.channels = channels;
        this.programs = programs;
        this.error = error;
    }

    public static UserProcessingResult success(String username, List<Channel> channels, List<Program> programs) {
        return new UserProcessingResult(username, true, List.copyOf(channels), List.copyOf(programs), null);
    }

    public static UserProcessingResult failure(String username, String error) {
        return new UserProcessingResult(username, false, List.of(), List.of(), error);
    }

    public String getUsername() {
        return username;
    }

    public boolean isSuccess() {
        return success;
    }

    public List<Channel> getChannels() {
        return channels;
    }

    public List<Program> getPrograms() {
        return programs;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "UserProcessingResult{" +
                "username='" + username + '\'' +
                ", success=" + success +
                ", channels=" + channels.size() +
                ", programs=" + programs.size() +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
