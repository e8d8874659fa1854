package com.playarr.livetv.exception;

/**
 * Thrown when an M3U playlist cannot be turned into channels at all.
 * Single malformed entries are skipped by the parser and never raise this.
 */
public class PlaylistParseException extends RuntimeException {

    public PlaylistParseException(String message) {
        super(message);
    }

    public PlaylistParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
