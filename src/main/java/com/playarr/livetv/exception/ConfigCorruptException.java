package com.playarr.livetv.exception;

/**
 * A user has a liveTV configuration object but no m3u_url key inside it.
 */
public class ConfigCorruptException extends RuntimeException {

    public static final String MISSING_M3U_URL = "Live TV configuration is corrupted (m3u_url property missing)";

    private final String username;

    public ConfigCorruptException(String username, String message) {
        super(message);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }

    public static ConfigCorruptException missingM3uUrl(String username) {
        return new ConfigCorruptException(username, MISSING_M3U_URL);
    }
}
