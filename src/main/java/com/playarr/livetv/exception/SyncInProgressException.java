package com.playarr.livetv.exception;

public class SyncInProgressException extends RuntimeException {

    public SyncInProgressException() {
        super("A live TV sync is already running");
    }
}
