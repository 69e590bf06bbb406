package com.roapid.sync.schedule;

import com.roapid.domain.ScheduleEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Per-job schedule keyed by the raw category label. One lock guards the whole map and is held only
 * for the map access or the snapshot copy, never while a job runs. Entries are never removed.
 */
@Slf4j
public class ScheduleStore {

    /** Used when neither the entry nor the resolver yields a positive interval. */
    public static final Duration FALLBACK_INTERVAL = Duration.ofMinutes(1);

    private final Map<String, ScheduleEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public ScheduleStore(Clock clock) {
        this.clock = clock;
    }

    public Optional<ScheduleEntry> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Key the job is stored under: {@code label} itself when present, otherwise the first key {@code sameJob}
     * accepts. Empty when the job has no entry yet.
     */
    public Optional<String> findKey(String label, Predicate<String> sameJob) {
        lock.lock();
        try {
            if (entries.containsKey(label)) {
                return Optional.of(label);
            }
            return entries.keySet().stream().filter(sameJob).findFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of all entries, safe to iterate while jobs run.
     */
    public Map<String, ScheduleEntry> snapshotAll() {
        lock.lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Creates or updates the entry for {@code key}.
     * <ul>
     *   <li>An established positive interval is kept; otherwise {@code resolver} supplies one
     *       ({@link #FALLBACK_INTERVAL} if it yields nothing positive).</li>
     *   <li>{@code explicitNext} is used verbatim when given, else {@code now + interval}.</li>
     *   <li>The due time never moves backwards for an existing entry.</li>
     * </ul>
     *
     * @return the stored entry
     */
    public ScheduleEntry upsert(String key, String endpointType, Instant explicitNext, IntervalResolver resolver) {
        Duration interval = establishedInterval(key);
        if (interval == null) {
            interval = resolve(resolver, endpointType);
        }

        lock.lock();
        try {
            ScheduleEntry existing = entries.get(key);
            if (existing != null && isPositive(existing.interval())) {
                interval = existing.interval();
            }
            Instant next = explicitNext != null ? explicitNext : clock.instant().plus(interval);
            if (existing != null && next.isBefore(existing.nextEligibleRun())) {
                log.debug("Not rewinding {} from {} to {}", key, existing.nextEligibleRun(), next);
                next = existing.nextEligibleRun();
            }
            ScheduleEntry updated = new ScheduleEntry(endpointType, interval, next);
            entries.put(key, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private Duration establishedInterval(String key) {
        lock.lock();
        try {
            ScheduleEntry existing = entries.get(key);
            return existing != null && isPositive(existing.interval()) ? existing.interval() : null;
        } finally {
            lock.unlock();
        }
    }

    private static Duration resolve(IntervalResolver resolver, String endpointType) {
        Duration resolved = null;
        if (resolver != null) {
            try {
                resolved = resolver.intervalFor(endpointType);
            } catch (RuntimeException e) {
                log.warn("Interval lookup failed for {}: {}", endpointType, e.getMessage());
            }
        }
        return isPositive(resolved) ? resolved : FALLBACK_INTERVAL;
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }
}
