package com.roapid.adapter.wiki;

import java.util.List;
import java.util.Optional;

/**
 * Wiki side of the sync: the discovery signal (categories), publishing and view invalidation.
 */
public interface WikiClient {

    /**
     * Logs in and verifies the account may edit as a bot.
     */
    void login();

    /**
     * Creates or overwrites a page. Writes are throttled globally.
     *
     * @throws WikiException with kind PUBLISH
     */
    void push(String title, String content, String summary);

    boolean pageExists(String title);

    Optional<String> pageContent(String title);

    /**
     * All categories starting with the given prefix, as {@code Category:<name>} labels, in no particular order.
     *
     * @throws WikiException with kind DISCOVERY
     */
    List<String> categoriesWithPrefix(String prefix);

    List<String> categoryMembers(String category);

    /**
     * @throws WikiException with kind PURGE
     */
    void purgePages(List<String> titles);

    /**
     * Purges every page in the category so views that depend on it re-render.
     *
     * @throws WikiException with kind PURGE
     */
    void purgeCategoryMembers(String category);
}
