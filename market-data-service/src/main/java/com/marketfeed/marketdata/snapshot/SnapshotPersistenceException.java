package com.marketfeed.marketdata.snapshot;

/**
 * Reading or writing the snapshot file failed. Internal to the store: write failures are
 * logged and recorded, read failures fall back to an empty store.
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
