package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * JDK HttpClient-backed fetcher. Redirects are followed; the body is only read
 * for 200 responses with an HTML content type, so PDFs and images are never downloaded.
 * Bodies are decoded with the charset the response declares, UTF-8 otherwise.
 */
@Component
public class HttpPageFetcher implements PageFetcher {

    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";

    private final DiscoveryProperties properties;

    private final HttpClient httpClient;

    public HttpPageFetcher(DiscoveryProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getCrawl().getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public FetchedPage fetch(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(toUri(url))
                .timeout(Duration.ofSeconds(properties.getCrawl().getTimeoutSeconds()))
                .header("User-Agent", properties.getCrawl().getUserAgent())
                .header("Accept", ACCEPT)
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, info -> {
            String contentType = contentType(info.headers());
            boolean readable = info.statusCode() == 200 && contentType.toLowerCase(Locale.ROOT).contains("text/html");
            return readable
                    ? HttpResponse.BodySubscribers.ofString(charset(contentType))
                    : HttpResponse.BodySubscribers.replacing(null);
        });

        return new FetchedPage(response.uri().toString(), response.statusCode(),
                contentType(response.headers()), response.body());
    }

    /**
     * Links taken from HTML often carry raw spaces or other characters URI rejects;
     * those are re-encoded component by component.
     */
    static URI toUri(String url) throws IOException {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            URL parsed = new URL(url);
            try {
                return new URI(parsed.getProtocol(), parsed.getUserInfo(), parsed.getHost(), parsed.getPort(),
                        parsed.getPath(), parsed.getQuery(), null);
            } catch (URISyntaxException ex) {
                throw new IOException("Unusable URL: " + url, ex);
            }
        }
    }

    static Charset charset(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset declared = MediaType.parseMediaType(contentType).getCharset();
            return declared != null ? declared : StandardCharsets.UTF_8;
        } catch (IllegalArgumentException e) {
            return StandardCharsets.UTF_8;
        }
    }

    private static String contentType(HttpHeaders headers) {
        return headers.firstValue("Content-Type").orElse("");
    }
}
