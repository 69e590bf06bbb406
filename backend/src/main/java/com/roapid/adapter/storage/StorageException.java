package com.roapid.adapter.storage;

import com.roapid.common.RoapidException;
import com.roapid.common.SyncErrorKind;

/**
 * Thrown when a persisted artifact cannot be read or written.
 */
public class StorageException extends RoapidException {

    public StorageException(String message) {
        super(SyncErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(SyncErrorKind.STORAGE, message, cause);
    }
}
