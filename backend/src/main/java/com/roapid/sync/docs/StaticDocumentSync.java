package com.roapid.sync.docs;

import com.roapid.adapter.config.WikiProperties;
import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.storage.StorageException;
import com.roapid.adapter.wiki.WikiClient;
import com.roapid.adapter.wiki.WikiException;
import com.roapid.common.RoapidException;
import com.roapid.sync.config.StaticDocumentProperties;
import com.roapid.sync.config.StaticDocumentProperties.Document;
import com.roapid.sync.detect.ChangeDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Mirrors the configured local documents to the wiki when their content changes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StaticDocumentSync {

    private final StaticDocumentProperties properties;
    private final WikiProperties wikiProperties;
    private final ChangeDetector changeDetector;
    private final ArtifactStore artifactStore;
    private final WikiClient wikiClient;

    /**
     * Syncs every document; one failing does not stop the others.
     *
     * @throws RoapidException the first failure, after all documents were attempted
     */
    public void syncAll() {
        RoapidException firstFailure = null;
        List<Document> documents = properties.getDocuments();
        for (Document document : documents) {
            try {
                sync(document);
            } catch (RoapidException e) {
                log.warn("Error syncing {}: {}", document.getFile(), e.getMessage());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    /**
     * @return true when the document was pushed
     */
    public boolean sync(Document document) {
        Path source = Path.of(properties.getSourceDir()).resolve(document.getFile());
        byte[] content;
        try {
            content = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + source, e);
        }

        if (!changeDetector.hasChanged(document.getFile(), content)) {
            log.debug("{} unchanged; skipping wiki update", document.getFile());
            return false;
        }

        byte[] stored = artifactStore.save(document.getFile(), content);
        String title = wikiProperties.getNamespace() + ":roapid/" + document.getSlug();
        wikiClient.push(title, new String(stored, StandardCharsets.UTF_8), document.getSummary());
        try {
            wikiClient.purgePages(List.of(title));
        } catch (WikiException e) {
            log.warn("Error purging {}: {}", title, e.getMessage());
        }
        log.info("Synced {}", title);
        return true;
    }
}
