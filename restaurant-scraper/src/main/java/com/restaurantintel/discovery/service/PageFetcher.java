package com.restaurantintel.discovery.service;

import java.io.IOException;
import java.util.Locale;

/**
 * Fetches one page for the menu crawler.
 */
public interface PageFetcher {

    /**
     * @param url absolute http(s) URL
     * @return the response; {@code body} is null unless the status is 200 and the content is HTML
     * @throws IOException on timeout, DNS failure, connection reset and similar
     */
    FetchedPage fetch(String url) throws IOException, InterruptedException;

    record FetchedPage(String url, int statusCode, String contentType, String body) {

        public boolean isHtml() {
            return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
        }

        public boolean isOk() {
            return statusCode == 200;
        }
    }
}
