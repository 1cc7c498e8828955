package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.GeoPoint;
import com.restaurantintel.discovery.model.PlacesApiPlace;
import com.restaurantintel.discovery.model.PlacesSearchResponse;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Thin client over the Places API (New).
 *
 * Every call goes through the shared placesApi Retry: 429, 5xx and transport
 * errors are retried with exponential backoff, 401/403 fail fast. Calls that
 * still fail come back empty so the pipeline can skip and carry on.
 */
@Service
@Slf4j
public class PlacesApiClient {

    static final String SEARCH_FIELD_MASK =
            "places.id,places.displayName,places.location,places.formattedAddress,nextPageToken";
    static final String DETAILS_FIELD_MASK =
            "id,displayName,formattedAddress,postalAddress,location,websiteUri,types,"
                    + "rating,userRatingCount,priceLevel,photos";

    private final RestTemplate restTemplate;
    private final DiscoveryProperties properties;
    private final Retry retry;
    private final AtomicBoolean accessDeniedLogged = new AtomicBoolean(false);

    public PlacesApiClient(RestTemplate placesRestTemplate, DiscoveryProperties properties, Retry placesApiRetry) {
        this.restTemplate = placesRestTemplate;
        this.properties = properties;
        this.retry = placesApiRetry;
    }

    /**
     * Text search biased to a circle, following nextPageToken until the last page.
     *
     * @return every place returned across all pages (may be empty, never null)
     */
    public List<PlacesApiPlace> searchText(String query, GeoPoint center, double radiusMeters) {
        String url = properties.getApi().getBaseUrl() + "/places:searchText";
        List<PlacesApiPlace> places = new ArrayList<>();
        String pageToken = null;
        int page = 0;

        do {
            Map<String, Object> body = searchBody(query, center, radiusMeters, pageToken);
            HttpEntity<Map<String, Object>> request = new HttpEntity<>(body, headers(SEARCH_FIELD_MASK));
            page++;

            Optional<PlacesSearchResponse> response = execute("searchText page " + page, () ->
                    restTemplate.exchange(url, HttpMethod.POST, request, PlacesSearchResponse.class).getBody());
            if (response.isEmpty()) {
                if (page > 1) {
                    log.warn("Search paging stopped at page {} near {}; keeping {} places", page, center, places.size());
                }
                break;
            }

            if (response.get().getPlaces() != null) {
                places.addAll(response.get().getPlaces());
            }
            pageToken = response.get().getNextPageToken();

            if (pageToken != null && !pageToken.isBlank()) {
                sleepMs(properties.getApi().getPageDelayMs());
            }
        } while (pageToken != null && !pageToken.isBlank() && !Thread.currentThread().isInterrupted());

        log.debug("Search near {} returned {} places over {} page(s)", center, places.size(), page);
        return places;
    }

    /**
     * Fetch the full detail record for one place.
     *
     * @return empty on access denial, exhausted retries or an unreadable response
     */
    public Optional<PlacesApiPlace> getPlaceDetails(String placeId) {
        String url = properties.getApi().getBaseUrl() + "/places/{placeId}";
        HttpEntity<Void> request = new HttpEntity<>(headers(DETAILS_FIELD_MASK));
        return execute("details " + placeId, () ->
                restTemplate.exchange(url, HttpMethod.GET, request, PlacesApiPlace.class, placeId).getBody());
    }

    /**
     * Build a Place Photo media URL. Pure string construction, no request is made.
     */
    public String photoUrl(String photoName, int maxWidthPx, int maxHeightPx) {
        if (photoName == null || photoName.isBlank()) {
            return "";
        }
        return String.format("%s/%s/media?maxHeightPx=%d&maxWidthPx=%d&key=%s",
                properties.getApi().getBaseUrl(), photoName, maxHeightPx, maxWidthPx, properties.getApi().getKey());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> Optional<T> execute(String operation, Supplier<T> call) {
        try {
            return Optional.ofNullable(retry.executeSupplier(() -> classify(operation, call)));

        } catch (PlacesAccessDeniedException e) {
            if (accessDeniedLogged.compareAndSet(false, true)) {
                log.error("Places API denied access ({}). Ensure Places API (New) is enabled for this key.",
                        e.getMessage());
            }
            return Optional.empty();

        } catch (TransientPlacesApiException e) {
            log.error("Places {} failed after {} attempts: {}",
                    operation, retry.getRetryConfig().getMaxAttempts(), e.getMessage());
            return Optional.empty();

        } catch (RestClientException e) {
            log.error("Places {} failed: {}", operation, e.getMessage());
            return Optional.empty();
        }
    }

    private <T> T classify(String operation, Supplier<T> call) {
        try {
            return call.get();

        } catch (HttpClientErrorException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status == HttpStatus.FORBIDDEN || status == HttpStatus.UNAUTHORIZED) {
                throw new PlacesAccessDeniedException(e.getStatusCode().toString(), e);
            }
            if (status == HttpStatus.TOO_MANY_REQUESTS) {
                log.warn("Rate limited (429) on {} — backing off", operation);
                throw new TransientPlacesApiException("429 rate limited", e);
            }
            throw e;

        } catch (HttpServerErrorException e) {
            log.warn("Places {} returned {} — will retry", operation, e.getStatusCode());
            throw new TransientPlacesApiException(e.getStatusCode().toString(), e);

        } catch (ResourceAccessException e) {
            log.warn("Places {} transport error: {}", operation, e.getMessage());
            throw new TransientPlacesApiException(e.getMessage(), e);
        }
    }

    private HttpHeaders headers(String fieldMask) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Goog-Api-Key", properties.getApi().getKey());
        headers.set("X-Goog-FieldMask", fieldMask);
        return headers;
    }

    private Map<String, Object> searchBody(String query, GeoPoint center, double radiusMeters, String pageToken) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("textQuery", query);
        body.put("locationBias", Map.of(
                "circle", Map.of(
                        "center", Map.of("latitude", center.latitude(), "longitude", center.longitude()),
                        "radius", radiusMeters)));
        if (pageToken != null) {
            body.put("pageToken", pageToken);
        }
        return body;
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
