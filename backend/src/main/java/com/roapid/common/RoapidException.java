package com.roapid.common;

import lombok.Getter;

/**
 * Base of all sync engine failures. The kind selects the handling policy.
 */
@Getter
public class RoapidException extends RuntimeException {

    private final SyncErrorKind kind;

    public RoapidException(SyncErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RoapidException(SyncErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
