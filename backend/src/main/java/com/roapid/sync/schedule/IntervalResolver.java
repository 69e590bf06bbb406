package com.roapid.sync.schedule;

import java.time.Duration;

/**
 * Supplies the refresh interval of a job that has none established yet.
 */
@FunctionalInterface
public interface IntervalResolver {

    Duration intervalFor(String endpointType);
}
