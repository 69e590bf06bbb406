package com.roapid.api.dto;

import com.roapid.domain.ScheduleEntry;

import java.time.Instant;

/**
 * One row of GET /api/v1/schedule.
 */
public record ScheduleEntryResponse(String category,
                                    String endpointType,
                                    long intervalSeconds,
                                    Instant nextEligibleRun,
                                    boolean due) {

    public static ScheduleEntryResponse from(String category, ScheduleEntry entry, Instant now) {
        return new ScheduleEntryResponse(category, entry.endpointType(), entry.interval().toSeconds(),
                entry.nextEligibleRun(), entry.isDueAt(now));
    }
}
