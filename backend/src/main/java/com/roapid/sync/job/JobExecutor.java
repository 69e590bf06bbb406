package com.roapid.sync.job;

import com.roapid.adapter.config.WikiProperties;
import com.roapid.adapter.fetch.ApiFetcher;
import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.wiki.WikiClient;
import com.roapid.adapter.wiki.WikiException;
import com.roapid.domain.JobIdentity;
import com.roapid.sync.detect.ChangeDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * fetch → change-detect → persist → publish → purge for one job.
 * Anything failing before the publish decision aborts the run; purge failures are only logged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobExecutor {

    static final String PAGE_DIRECTORY = "roapid/";

    private final EndpointUrlResolver endpointUrlResolver;
    private final ApiFetcher apiFetcher;
    private final ChangeDetector changeDetector;
    private final ArtifactStore artifactStore;
    private final WikiClient wikiClient;
    private final WikiProperties wikiProperties;

    /**
     * @throws com.roapid.common.RoapidException when fetch, storage or publish fails
     */
    public JobOutcome execute(JobIdentity identity, String category) {
        ResolvedEndpoint endpoint = endpointUrlResolver.resolve(identity);
        log.debug("Fetching {} for {}", endpoint.url(), category);
        byte[] data = apiFetcher.fetch(endpoint.url(), endpoint.headers());

        String artifact = identity.artifactName();
        boolean changed = changeDetector.hasChanged(artifact, data);
        byte[] stored = artifactStore.save(artifact, data);

        String title = pageTitle(identity);
        boolean publish = changed;
        if (!changed) {
            publish = !pageExistsOrAssume(title);
            if (publish) {
                log.info("{} unchanged but {} is missing; republishing", artifact, title);
            } else {
                log.debug("{} unchanged; skipping wiki update", artifact);
            }
        }

        if (publish) {
            wikiClient.push(title, new String(stored, StandardCharsets.UTF_8), "Automated update from " + endpoint.url());
            log.info("Published {}", title);
        }

        boolean purged = purgeQuietly(category);
        return new JobOutcome(endpoint.url(), changed, publish, purged);
    }

    public String pageTitle(JobIdentity identity) {
        return wikiProperties.getNamespace() + ":" + PAGE_DIRECTORY + identity.artifactName();
    }

    private boolean pageExistsOrAssume(String title) {
        try {
            return wikiClient.pageExists(title);
        } catch (WikiException e) {
            log.warn("Could not check whether {} exists, assuming it does: {}", title, e.getMessage());
            return true;
        }
    }

    private boolean purgeQuietly(String category) {
        try {
            wikiClient.purgeCategoryMembers(category);
            return true;
        } catch (WikiException e) {
            log.warn("Error purging members of {}: {}", category, e.getMessage());
            return false;
        }
    }
}
