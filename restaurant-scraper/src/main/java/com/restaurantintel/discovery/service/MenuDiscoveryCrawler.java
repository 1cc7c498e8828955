package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Breadth-first, same-origin crawl of a restaurant website looking for a menu link.
 *
 * The first anchor the {@link MenuLinkClassifier} accepts ends the crawl. Pages that
 * are not 200/HTML, and any fetch or parse failure, are skipped. Links to another
 * scheme or host are dropped before classification. Running out of queue is a
 * normal "no menu" outcome. A {@code maxPages} of zero or less leaves the crawl
 * bounded by depth only.
 */
@Service
@Slf4j
public class MenuDiscoveryCrawler {

    private final PageFetcher pageFetcher;
    private final MenuLinkClassifier classifier;
    private final int maxDepth;
    private final int maxPages;

    @Autowired
    public MenuDiscoveryCrawler(PageFetcher pageFetcher, MenuLinkClassifier classifier,
                                DiscoveryProperties properties) {
        this(pageFetcher, classifier, properties.getCrawl().getMaxDepth(), properties.getCrawl().getMaxPages());
    }

    public MenuDiscoveryCrawler(PageFetcher pageFetcher, MenuLinkClassifier classifier, int maxDepth, int maxPages) {
        this.pageFetcher = pageFetcher;
        this.classifier = classifier;
        this.maxDepth = maxDepth;
        this.maxPages = maxPages;
    }

    private record QueuedUrl(String url, int depth) {}

    public Optional<String> findMenu(String websiteUrl) {
        if (websiteUrl == null || websiteUrl.isBlank()) {
            return Optional.empty();
        }
        String rootOrigin = origin(websiteUrl.trim());
        if (rootOrigin == null) {
            log.debug("Skipping crawl of unparseable website {}", websiteUrl);
            return Optional.empty();
        }

        Deque<QueuedUrl> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(new QueuedUrl(websiteUrl.trim(), 0));
        int fetched = 0;

        while (!queue.isEmpty() && (maxPages <= 0 || fetched < maxPages)) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("Crawl of {} interrupted", websiteUrl);
                break;
            }

            QueuedUrl next = queue.poll();
            if (visited.contains(next.url()) || next.depth() > maxDepth) {
                continue;
            }
            visited.add(next.url());
            fetched++;

            try {
                PageFetcher.FetchedPage page = pageFetcher.fetch(next.url());
                if (!page.isOk() || !page.isHtml() || page.body() == null) {
                    continue;
                }

                Document doc = Jsoup.parse(page.body(), next.url());
                for (Element anchor : doc.select("a[href]")) {
                    String href = anchor.attr("href");
                    String absolute = stripFragment(anchor.absUrl("href"));
                    if (absolute.isEmpty() || !rootOrigin.equals(origin(absolute))) {
                        continue;
                    }

                    if (classifier.isMenuLink(href, anchor.text())) {
                        log.debug("Menu link on {} at depth {}: {}", next.url(), next.depth(), absolute);
                        return Optional.of(absolute);
                    }

                    if (next.depth() < maxDepth && !visited.contains(absolute)) {
                        queue.add(new QueuedUrl(absolute, next.depth() + 1));
                    }
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.debug("Crawl error at {}: {}", next.url(), e.getMessage());
            }
        }

        return Optional.empty();
    }

    /**
     * scheme://host, lowercased; null when the URL has no http(s) scheme or host.
     * Parsed leniently: anchors resolved by jsoup may keep raw spaces in the path.
     */
    static String origin(String url) {
        try {
            URL parsed = new URL(url);
            String scheme = parsed.getProtocol().toLowerCase(Locale.ROOT);
            String host = parsed.getHost();
            if (!scheme.equals("http") && !scheme.equals("https")) return null;
            if (host == null || host.isEmpty()) return null;
            return scheme + "://" + host.toLowerCase(Locale.ROOT);
        } catch (MalformedURLException e) {
            return null;
        }
    }

    private static String stripFragment(String url) {
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }
}
