package com.roapid.common;

/**
 * Error taxonomy of the sync engine and the single policy each kind follows.
 * Loops and executors consult {@link #getDisposition()} instead of deciding per call site.
 */
public enum SyncErrorKind {

    /** Unparseable category label or artifact name. */
    INVALID_FORMAT(Disposition.SKIP),
    /** Remote API transport failure or non-2xx answer. */
    FETCH(Disposition.RETRY_NEXT_SWEEP),
    /** Wiki edit failed. */
    PUBLISH(Disposition.RETRY_NEXT_SWEEP),
    /** Wiki purge failed; never blocks a job's success. */
    PURGE(Disposition.LOG_ONLY),
    /** Category listing could not be read; the whole discovery sweep is retried. */
    DISCOVERY(Disposition.RETRY_NEXT_SWEEP),
    /** Malformed interval, unknown endpoint type, missing secret. */
    CONFIG(Disposition.FATAL_AT_STARTUP),
    /** Artifact read/write failure. */
    STORAGE(Disposition.RETRY_NEXT_SWEEP);

    private final Disposition disposition;

    SyncErrorKind(Disposition disposition) {
        this.disposition = disposition;
    }

    public Disposition getDisposition() {
        return disposition;
    }

    public enum Disposition {
        /** Log and move on to the next item; schedule untouched. */
        SKIP,
        /** Job fails, schedule untouched, next sweep retries. */
        RETRY_NEXT_SWEEP,
        /** Logged only; the surrounding operation still succeeds. */
        LOG_ONLY,
        /** Aborts startup; raised by a running job it behaves like RETRY_NEXT_SWEEP. */
        FATAL_AT_STARTUP
    }
}
