package com.roapid.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Schedule state of one job, keyed in the store by its raw category label.
 * Immutable; the store replaces entries on every update.
 */
public record ScheduleEntry(String endpointType, Duration interval, Instant nextEligibleRun) {

    /** Due when {@code now >= nextEligibleRun}. */
    public boolean isDueAt(Instant now) {
        return !now.isBefore(nextEligibleRun);
    }
}
