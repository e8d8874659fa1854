package com.playarr.livetv.exception;

/**
 * Thrown when the on-disk live TV cache cannot be read or written.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
