package com.playarr.livetv.exception;

/**
 * Raised when a running live TV sync is cancelled before it reaches persistence.
 */
public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String message) {
        super(message);
    }

    public SyncCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
