package com.roapid.adapter.fetch;

import com.roapid.common.RoapidException;
import com.roapid.common.SyncErrorKind;

/**
 * Thrown when a remote API GET fails (transport error, non-2xx, local budget exhausted).
 */
public class FetchException extends RoapidException {

    public FetchException(String message) {
        super(SyncErrorKind.FETCH, message);
    }

    public FetchException(String message, Throwable cause) {
        super(SyncErrorKind.FETCH, message, cause);
    }
}
