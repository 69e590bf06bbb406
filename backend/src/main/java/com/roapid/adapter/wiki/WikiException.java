package com.roapid.adapter.wiki;

import com.roapid.common.RoapidException;
import com.roapid.common.SyncErrorKind;
import lombok.Getter;

/**
 * Thrown when a MediaWiki API call fails (HTTP error or API {@code error} object).
 */
@Getter
public class WikiException extends RoapidException {

    /** MediaWiki error code, e.g. {@code badtoken}; null for transport failures. */
    private final String apiCode;

    public WikiException(SyncErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public WikiException(SyncErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public WikiException(SyncErrorKind kind, String apiCode, String message, Throwable cause) {
        super(kind, message, cause);
        this.apiCode = apiCode;
    }

    /**
     * Same failure re-tagged with the kind of the operation that observed it.
     */
    public WikiException withKind(SyncErrorKind kind) {
        if (kind == getKind()) {
            return this;
        }
        return new WikiException(kind, apiCode, getMessage(), this);
    }
}
