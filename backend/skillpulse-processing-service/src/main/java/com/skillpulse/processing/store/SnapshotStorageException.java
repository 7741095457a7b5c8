package com.skillpulse.processing.store;

public class SnapshotStorageException extends RuntimeException {

    public SnapshotStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
