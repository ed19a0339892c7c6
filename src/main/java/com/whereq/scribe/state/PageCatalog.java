package com.whereq.scribe.state;

import com.whereq.scribe.model.InternalLinkTarget;
import com.whereq.scribe.model.Page;
import com.whereq.scribe.util.Slugs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Catalogue of known pages, keyed by URL and kept in discovery order
 */
@Slf4j
@Component
public class PageCatalog {

    private final ConcurrentHashMap<String, Page> pages = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> order = new CopyOnWriteArrayList<>();

    /**
     * Add pages that are not known yet
     *
     * @return number of pages added
     */
    public int addPages(Collection<Page> discovered) {
        int added = 0;
        for (Page page : discovered) {
            if (pages.putIfAbsent(page.getId(), page) == null) {
                order.add(page.getId());
                added++;
            }
        }
        if (added > 0) {
            log.info("Added {} pages to catalogue ({} total)", added, pages.size());
        }
        return added;
    }

    /**
     * Get the entry for a URL, creating one titled from its last path segment if unseen
     */
    public Page ensurePage(String url) {
        Page created = fromUrl(url, "New Page");
        Page existing = pages.putIfAbsent(url, created);
        if (existing != null) {
            return existing;
        }
        order.add(url);
        log.info("Added page {} to catalogue", url);
        return created;
    }

    public Optional<Page> get(String id) {
        return Optional.ofNullable(pages.get(id));
    }

    /**
     * All pages in discovery order
     */
    public List<Page> all() {
        List<Page> result = new ArrayList<>(order.size());
        for (String id : order) {
            Page page = pages.get(id);
            if (page != null) {
                result.add(page);
            }
        }
        return result;
    }

    public int size() {
        return pages.size();
    }

    /**
     * Atomic copy-then-commit write for one page. Unknown pages are ignored.
     */
    public Optional<Page> update(String id, UnaryOperator<Page> change) {
        return Optional.ofNullable(pages.computeIfPresent(id, (key, page) -> change.apply(page)));
    }

    /**
     * Page with the lowest health score among those not excluded; a missing score counts as 0.
     * Ties keep discovery order.
     */
    public Optional<Page> lowestHealthCandidate(Predicate<String> excluded) {
        return all().stream()
            .filter(p -> !excluded.test(p.getId()))
            .min(Comparator.comparingInt(Page::healthScoreOrZero));
    }

    /**
     * Link candidates: other pages with a meaningful title, in discovery order
     */
    public List<InternalLinkTarget> internalLinkTargets(String excludeId, int max) {
        return all().stream()
            .filter(p -> !p.getId().equals(excludeId))
            .filter(p -> p.getTitle() != null && p.getTitle().length() > 5)
            .limit(max)
            .map(p -> InternalLinkTarget.builder()
                .url(p.getId())
                .title(p.getTitle())
                .slug(p.getSlug())
                .build())
            .toList();
    }

    /**
     * New catalogue entry for a URL
     *
     * @param fallbackTitle title used when the URL has no path
     */
    public static Page fromUrl(String url, String fallbackTitle) {
        String title = Slugs.titleFromUrl(url);
        return Page.builder()
            .id(url)
            .title(title.isEmpty() ? fallbackTitle : title)
            .slug(Slugs.sanitizeSlug(Slugs.extractSlugFromUrl(url)))
            .build();
    }
}
