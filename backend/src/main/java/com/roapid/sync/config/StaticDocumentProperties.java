package com.roapid.sync.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Local usage guides mirrored verbatim to {@code <namespace>:roapid/<slug>}.
 */
@ConfigurationProperties(prefix = "roapid.docs")
@NoArgsConstructor
@Getter
@Setter
public class StaticDocumentProperties {

    /** Directory the documents are read from. */
    private String sourceDir = "config";

    /** Sync period. When unset the {@code about} entry of refresh-intervals applies, then the data refresh interval. */
    private String interval;

    private List<Document> documents = new ArrayList<>(List.of(
            new Document("about.json", "about.json", "Automated sync of about information"),
            new Document("badges.json", "badges.json", "Automated sync of legacy badges usage guide"),
            new Document("users.json", "users.json", "Automated sync of users usage guide"),
            new Document("groups.json", "groups.json", "Automated sync of groups usage guide"),
            new Document("universes.json", "universes.json", "Automated sync of universes usage guide"),
            new Document("places.json", "places.json", "Automated sync of places usage guide"),
            new Document("games.json", "games.json", "Automated sync of legacy games API guide")));

    public void setDocuments(List<Document> documents) {
        this.documents = documents != null ? documents : new ArrayList<>();
    }

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Document {

        /** File name under {@code source-dir}; also the artifact name. */
        private String file;
        /** Page name under {@code roapid/}. */
        private String slug;
        private String summary;
    }
}
