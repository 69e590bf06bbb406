package com.roapid.sync.job;

/**
 * Result of one successful job execution.
 *
 * @param changed   payload differed from the stored artifact
 * @param published page was written to the wiki
 * @param purged    category members were purged afterwards
 */
public record JobOutcome(String url, boolean changed, boolean published, boolean purged) {
}
