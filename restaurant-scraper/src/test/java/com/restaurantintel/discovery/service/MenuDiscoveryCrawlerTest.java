package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class MenuDiscoveryCrawlerTest {

    private final FakeFetcher fetcher = new FakeFetcher();
    private final MenuLinkClassifier classifier = new MenuLinkClassifier(new DiscoveryProperties());
    private final MenuDiscoveryCrawler crawler = new MenuDiscoveryCrawler(fetcher, classifier, 2, 40);

    @Test
    void findsPdfLinkOnHomepage() {
        fetcher.html("https://example.com", "<a href=\"/about\">About</a><a href=\"menu.pdf\">Download</a>");

        Optional<String> menu = crawler.findMenu("https://example.com");

        assertThat(menu).contains("https://example.com/menu.pdf");
        assertThat(fetcher.requested).containsExactly("https://example.com");
    }

    @Test
    void findsPdfWhoseFileNameContainsSpaces() {
        fetcher.html("https://example.com", "<a href=\"/files/Our Menu.pdf\">Download</a>");

        assertThat(crawler.findMenu("https://example.com")).hasValueSatisfying(url ->
                assertThat(url.replace("%20", " ")).isEqualTo("https://example.com/files/Our Menu.pdf"));
    }

    @Test
    void followsSameOriginPagesWhosePathContainsSpaces() {
        fetcher.html("https://example.com", "<a href=\"/our story\">Our story</a>");
        fetcher.html("https://example.com/our story", "<a href=\"/dinner\">Dinner</a>");

        assertThat(crawler.findMenu("https://example.com")).contains("https://example.com/dinner");
    }

    @Test
    void cyclicLinksTerminateWithoutMenu() {
        fetcher.html("https://example.com/a", "<a href=\"/b\">B</a>");
        fetcher.html("https://example.com/b", "<a href=\"/a\">A</a><a href=\"/b#top\">Top</a>");

        assertThat(crawler.findMenu("https://example.com/a")).isEmpty();
        assertThat(fetcher.requested).containsExactly("https://example.com/a", "https://example.com/b");
    }

    @Test
    void neverFollowsOrReturnsOtherOrigins() {
        fetcher.html("https://example.com", """
                <a href="https://other.com/menu">Menu elsewhere</a>
                <a href="http://example.com/menu">Plain http menu</a>
                <a href="https://cdn.example.com/about">About</a>
                <a href="/about">About</a>
                """);
        fetcher.html("https://example.com/about", "<p>No links here</p>");

        assertThat(crawler.findMenu("https://example.com")).isEmpty();
        assertThat(fetcher.requested).containsExactly("https://example.com", "https://example.com/about");
    }

    @Test
    void originComparisonIgnoresHostCase() {
        fetcher.html("https://Example.com", "<a href=\"https://EXAMPLE.com/menu\">Menu</a>");

        assertThat(crawler.findMenu("https://Example.com"))
                .hasValueSatisfying(url -> assertThat(url).isEqualToIgnoringCase("https://example.com/menu"));
    }

    @Test
    void shallowerMenuWinsOverDeeperOne() {
        fetcher.html("https://example.com", "<a href=\"/about\">About</a><a href=\"/visit\">Visit</a>");
        fetcher.html("https://example.com/about", "<a href=\"/deep\">Deep</a>");
        fetcher.html("https://example.com/visit", "<a href=\"/lunch\">Lunch</a>");
        fetcher.html("https://example.com/deep", "<a href=\"/deep-menu.pdf\">PDF</a>");

        assertThat(crawler.findMenu("https://example.com")).contains("https://example.com/lunch");
        assertThat(fetcher.requested).doesNotContain("https://example.com/deep");
    }

    @Test
    void doesNotFetchBeyondMaxDepth() {
        fetcher.html("https://example.com", "<a href=\"/one\">One</a>");
        fetcher.html("https://example.com/one", "<a href=\"/two\">Two</a>");
        fetcher.html("https://example.com/two", "<a href=\"/three\">Three</a>");
        fetcher.html("https://example.com/three", "<a href=\"/menu\">Menu</a>");

        assertThat(crawler.findMenu("https://example.com")).isEmpty();
        assertThat(fetcher.requested)
                .containsExactly("https://example.com", "https://example.com/one", "https://example.com/two");
    }

    @Test
    void linkOnLastAllowedLevelIsStillClassified() {
        fetcher.html("https://example.com", "<a href=\"/one\">One</a>");
        fetcher.html("https://example.com/one", "<a href=\"/two\">Two</a>");
        fetcher.html("https://example.com/two", "<a href=\"/menu\">Menu</a>");

        assertThat(crawler.findMenu("https://example.com")).contains("https://example.com/menu");
    }

    @Test
    void skipsFailedAndNonHtmlPages() {
        fetcher.html("https://example.com", """
                <a href="/missing">Missing</a>
                <a href="/image">Image</a>
                <a href="/broken">Broken</a>
                <a href="/ok">OK</a>
                """);
        fetcher.pages.put("https://example.com/missing",
                new PageFetcher.FetchedPage("https://example.com/missing", 404, "text/html", null));
        fetcher.pages.put("https://example.com/image",
                new PageFetcher.FetchedPage("https://example.com/image", 200, "image/png", null));
        fetcher.failures.put("https://example.com/broken", new IOException("connection reset"));
        fetcher.html("https://example.com/ok", "<a href=\"/dinner\">Dinner</a>");

        assertThat(crawler.findMenu("https://example.com")).contains("https://example.com/dinner");
    }

    @Test
    void unreachableHomepageMeansNoMenu() {
        fetcher.failures.put("https://example.com", new IOException("timeout"));

        assertThat(crawler.findMenu("https://example.com")).isEmpty();
    }

    @Test
    void pageBudgetCapsTheCrawl() {
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            links.append("<a href=\"/page").append(i).append("\">Page</a>");
        }
        fetcher.html("https://example.com", links.toString());
        MenuDiscoveryCrawler budgeted = new MenuDiscoveryCrawler(fetcher, classifier, 2, 3);

        assertThat(budgeted.findMenu("https://example.com")).isEmpty();
        assertThat(fetcher.requested).hasSize(3);
    }

    @Test
    void withoutPageBudgetCrawlRunsUntilQueueIsExhausted() {
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 60; i++) {
            links.append("<a href=\"/page").append(i).append("\">Page</a>");
        }
        fetcher.html("https://example.com", links.toString());
        fetcher.html("https://example.com/page59", "<a href=\"/wine-list\">Wines</a>");
        MenuDiscoveryCrawler unbounded = new MenuDiscoveryCrawler(fetcher, classifier, 2, 0);

        assertThat(unbounded.findMenu("https://example.com")).contains("https://example.com/wine-list");
        assertThat(fetcher.requested).hasSize(61);
    }

    @Test
    void defaultConfigurationHasNoPageBudget() {
        MenuDiscoveryCrawler configured = new MenuDiscoveryCrawler(fetcher, classifier, new DiscoveryProperties());
        StringBuilder links = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            links.append("<a href=\"/page").append(i).append("\">Page</a>");
        }
        fetcher.html("https://example.com", links.toString());

        assertThat(configured.findMenu("https://example.com")).isEmpty();
        assertThat(fetcher.requested).hasSize(51);
    }

    @Test
    void ignoresBlankAndNonHttpWebsites() {
        assertThat(crawler.findMenu(null)).isEmpty();
        assertThat(crawler.findMenu("  ")).isEmpty();
        assertThat(crawler.findMenu("mailto:hello@example.com")).isEmpty();
        assertThat(fetcher.requested).isEmpty();
    }

    @Test
    void ignoresMailtoAndTelLinks() {
        fetcher.html("https://example.com",
                "<a href=\"mailto:menu@example.com\">Email for menu</a><a href=\"tel:+4420\">Call for menu</a>");

        assertThat(crawler.findMenu("https://example.com")).isEmpty();
        assertThat(fetcher.requested).containsExactly("https://example.com");
    }

    @Test
    void originNormalisesSchemeAndHost() {
        assertThat(MenuDiscoveryCrawler.origin("HTTPS://Example.COM/path?q=1")).isEqualTo("https://example.com");
        assertThat(MenuDiscoveryCrawler.origin("ftp://example.com/menu")).isNull();
        assertThat(MenuDiscoveryCrawler.origin("not a url")).isNull();
        assertThat(MenuDiscoveryCrawler.origin("https://Example.com/files/Our Menu.pdf")).isEqualTo("https://example.com");
        assertThat(MenuDiscoveryCrawler.origin("mailto:menu@example.com")).isNull();
    }

    private static class FakeFetcher implements PageFetcher {

        final Map<String, FetchedPage> pages = new HashMap<>();
        final Map<String, IOException> failures = new HashMap<>();
        final List<String> requested = new ArrayList<>();

        void html(String url, String body) {
            pages.put(url, new FetchedPage(url, 200, "text/html; charset=utf-8", "<html><body>" + body + "</body></html>"));
        }

        @Override
        public FetchedPage fetch(String url) throws IOException {
            requested.add(url);
            if (failures.containsKey(url)) {
                throw failures.get(url);
            }
            FetchedPage page = pages.get(url.replace("%20", " "));
            return page != null ? page : new FetchedPage(url, 404, "text/html", null);
        }
    }
}
