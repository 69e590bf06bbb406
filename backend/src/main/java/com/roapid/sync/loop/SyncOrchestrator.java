package com.roapid.sync.loop;

import com.roapid.adapter.wiki.WikiClient;
import com.roapid.common.RoapidException;
import com.roapid.config.AsyncConfig;
import com.roapid.config.SchedulerConfig;
import com.roapid.domain.JobIdentity;
import com.roapid.domain.JobIdentityCodec;
import com.roapid.domain.ScheduleEntry;
import com.roapid.sync.bootstrap.BootstrapRecoverer;
import com.roapid.sync.config.StaticDocumentProperties;
import com.roapid.sync.config.SyncIntervals;
import com.roapid.sync.config.SyncProperties;
import com.roapid.sync.docs.StaticDocumentSync;
import com.roapid.sync.docs.WikiModuleInstaller;
import com.roapid.sync.job.JobRunner;
import com.roapid.sync.schedule.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the sync lifecycle. On start: login, module install, static documents, restart recovery, immediate
 * dispatch of due jobs, a first discovery sweep, then the periodic loops. On stop: no new iterations or
 * dispatches, running ones finish before the context closes.
 */
@Component
@Slf4j
public class SyncOrchestrator implements SmartLifecycle {

    private final WikiClient wikiClient;
    private final WikiModuleInstaller wikiModuleInstaller;
    private final StaticDocumentSync staticDocumentSync;
    private final BootstrapRecoverer bootstrapRecoverer;
    private final CategoryDiscoveryLoop discoveryLoop;
    private final DataRefreshLoop refreshLoop;
    private final JobRunner jobRunner;
    private final ScheduleStore scheduleStore;
    private final SyncIntervals intervals;
    private final SyncProperties syncProperties;
    private final StaticDocumentProperties documentProperties;
    private final Clock clock;
    private final TaskExecutor dispatchExecutor;
    private final TaskScheduler scheduler;

    private final WorkTracker tracker = new WorkTracker();
    private final List<ScheduledFuture<?>> loops = new ArrayList<>();
    private volatile boolean running;

    public SyncOrchestrator(WikiClient wikiClient,
                            WikiModuleInstaller wikiModuleInstaller,
                            StaticDocumentSync staticDocumentSync,
                            BootstrapRecoverer bootstrapRecoverer,
                            CategoryDiscoveryLoop discoveryLoop,
                            DataRefreshLoop refreshLoop,
                            JobRunner jobRunner,
                            ScheduleStore scheduleStore,
                            SyncIntervals intervals,
                            SyncProperties syncProperties,
                            StaticDocumentProperties documentProperties,
                            Clock clock,
                            @Qualifier(AsyncConfig.DISPATCH_EXECUTOR) TaskExecutor dispatchExecutor,
                            @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler) {
        this.wikiClient = wikiClient;
        this.wikiModuleInstaller = wikiModuleInstaller;
        this.staticDocumentSync = staticDocumentSync;
        this.bootstrapRecoverer = bootstrapRecoverer;
        this.discoveryLoop = discoveryLoop;
        this.refreshLoop = refreshLoop;
        this.jobRunner = jobRunner;
        this.scheduleStore = scheduleStore;
        this.intervals = intervals;
        this.syncProperties = syncProperties;
        this.documentProperties = documentProperties;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        wikiClient.login();
        wikiModuleInstaller.install();
        syncDocuments();

        bootstrapRecoverer.recover();
        int dispatched = dispatchDueJobs();
        log.info("Immediate dispatch: {} due job(s)", dispatched);
        submit("initial category check", discoveryLoop::sweep);

        Duration categoryInterval = intervals.categoryCheckInterval();
        Duration dataInterval = intervals.dataRefreshInterval();
        Duration docsInterval = documentsInterval();
        schedule(discoveryLoop::sweep, categoryInterval);
        schedule(refreshLoop::sweep, dataInterval);
        schedule(this::syncDocuments, docsInterval);
        running = true;
        log.info("Sync started: category check every {}, data refresh every {}, documents every {}",
                categoryInterval, dataInterval, docsInterval);
    }

    @Override
    public void stop() {
        log.info("Shutting down: waiting for running jobs");
        synchronized (loops) {
            loops.forEach(f -> f.cancel(false));
            loops.clear();
        }
        if (!tracker.closeAndAwait()) {
            log.warn("Interrupted while waiting for {} running job(s)", tracker.activeCount());
        }
        running = false;
        log.info("Sync stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public boolean isShuttingDown() {
        return tracker.isClosed();
    }

    /**
     * Runs the job named by {@code label} now on the dispatch pool, under its existing schedule key if it has one.
     *
     * @return false when shutdown has started
     * @throws com.roapid.domain.InvalidCategoryException when the label does not name a job
     */
    public boolean requestRefresh(String label) {
        String prefix = syncProperties.getCategoryPrefix();
        JobIdentity identity = JobIdentityCodec.parse(label, prefix);
        if (tracker.isClosed()) {
            return false;
        }
        String category = scheduleStore.findKey(label, JobIdentityCodec.sameJob(identity, prefix)).orElse(label);
        log.info("Refresh requested for {}", category);
        return submit(category, () -> jobRunner.run(category, identity));
    }

    int dispatchDueJobs() {
        Map<String, ScheduleEntry> snapshot = scheduleStore.snapshotAll();
        int count = 0;
        for (Map.Entry<String, ScheduleEntry> e : snapshot.entrySet()) {
            if (!e.getValue().isDueAt(clock.instant())) {
                continue;
            }
            JobIdentity identity = JobIdentityCodec.tryParse(e.getKey(), syncProperties.getCategoryPrefix()).orElse(null);
            if (identity == null) {
                continue;
            }
            String category = e.getKey();
            if (submit(category, () -> jobRunner.runIfDue(category, identity))) {
                count++;
            }
        }
        return count;
    }

    private Duration documentsInterval() {
        String configured = documentProperties.getInterval();
        if (configured != null && !configured.isBlank()) {
            return intervals.intervalOrDefault(configured);
        }
        return intervals.intervalFor("about");
    }

    private void syncDocuments() {
        try {
            staticDocumentSync.syncAll();
        } catch (RoapidException e) {
            log.warn("Static document sync failed: {}", e.getMessage());
        }
    }

    private boolean submit(String name, Runnable task) {
        try {
            dispatchExecutor.execute(tracked(name, task));
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Could not dispatch {}: {}", name, e.getMessage());
            return false;
        }
    }

    private void schedule(Runnable task, Duration period) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
                tracked("periodic sweep", task), clock.instant().plus(period), period);
        synchronized (loops) {
            loops.add(future);
        }
    }

    private Runnable tracked(String name, Runnable task) {
        return () -> {
            if (!tracker.tryBegin()) {
                log.debug("Not starting {}: shutting down", name);
                return;
            }
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("{} failed", name, e);
            } finally {
                tracker.end();
            }
        };
    }
}
