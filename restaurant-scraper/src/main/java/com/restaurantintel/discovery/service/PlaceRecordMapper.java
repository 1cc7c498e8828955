package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import com.restaurantintel.discovery.model.DiscoveredEntity;
import com.restaurantintel.discovery.model.PlacesApiPlace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a Places API detail record to the DiscoveredEntity domain model.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlaceRecordMapper {

    static final String DEFAULT_CUISINE = "Restaurant";

    private static final Pattern UK_POSTCODE = Pattern.compile(
            "([Gg][Ii][Rr] 0[Aa]{2})|((([A-Za-z][0-9]{1,2})|(([A-Za-z][A-Ha-hJ-Yj-y][0-9]{1,2})"
                    + "|(([A-Za-z][0-9][A-Za-z])|([A-Za-z][A-Ha-hJ-Yj-y][0-9][A-Za-z]?))))\\s?[0-9][A-Za-z]{2})");

    private static final Map<String, Integer> PRICE_LEVELS = Map.of(
            "PRICE_LEVEL_FREE", 0,
            "PRICE_LEVEL_INEXPENSIVE", 1,
            "PRICE_LEVEL_MODERATE", 2,
            "PRICE_LEVEL_EXPENSIVE", 3,
            "PRICE_LEVEL_VERY_EXPENSIVE", 4);

    // Ordered: the first matching place type wins
    private static final List<Map.Entry<String, String>> CUISINES = List.of(
            Map.entry("italian_restaurant", "Italian"),
            Map.entry("chinese_restaurant", "Chinese"),
            Map.entry("indian_restaurant", "Indian"),
            Map.entry("japanese_restaurant", "Japanese"),
            Map.entry("thai_restaurant", "Thai"),
            Map.entry("french_restaurant", "French"),
            Map.entry("spanish_restaurant", "Spanish"),
            Map.entry("mexican_restaurant", "Mexican"),
            Map.entry("middle_eastern_restaurant", "Middle Eastern"),
            Map.entry("american_restaurant", "American"),
            Map.entry("mediterranean_restaurant", "Mediterranean"),
            Map.entry("seafood_restaurant", "Seafood"),
            Map.entry("steak_house", "Steakhouse"),
            Map.entry("sushi_restaurant", "Sushi"),
            Map.entry("vietnamese_restaurant", "Vietnamese"),
            Map.entry("korean_restaurant", "Korean"),
            Map.entry("greek_restaurant", "Greek"),
            Map.entry("turkish_restaurant", "Turkish"),
            Map.entry("brazilian_restaurant", "Brazilian"),
            Map.entry("pizza_restaurant", "Pizza"),
            Map.entry("hamburger_restaurant", "Burgers"),
            Map.entry("lebanese_restaurant", "Lebanese"),
            Map.entry("ethiopian_restaurant", "Ethiopian"),
            Map.entry("israeli_restaurant", "Israeli"),
            Map.entry("bakery", "Bakery"),
            Map.entry("cafe", "Cafe"),
            Map.entry("wine_bar", "Wine Bar"),
            Map.entry("pub", "Gastropub"),
            Map.entry("brasserie", "Brasserie"));

    private final PlacesApiClient placesApiClient;
    private final DiscoveryProperties properties;

    /**
     * Convert a detail record into a new entity owned by {@code zoneId}.
     *
     * @param details  Detail response for the place
     * @param fallback Search summary, used when the details omit name or location
     * @param menuUrl  Crawl result, null when no menu was found or there is no website
     */
    public DiscoveredEntity map(PlacesApiPlace details, PlacesApiPlace fallback, String menuUrl, String zoneId) {
        PlacesApiPlace.LatLng location = details.getLocation() != null
                ? details.getLocation()
                : fallback != null ? fallback.getLocation() : null;

        String name = details.displayNameText();
        if (name == null && fallback != null) name = fallback.displayNameText();

        String address = details.getFormattedAddress();
        if (address == null && fallback != null) address = fallback.getFormattedAddress();

        PlacesApiPlace.PostalAddress postal = details.getPostalAddress();
        String postcode = postal != null && !isBlank(postal.getPostalCode())
                ? postal.getPostalCode()
                : extractPostcode(address);

        List<String> types = details.getTypes() != null ? details.getTypes() : List.of();
        List<String> images = imageUrls(details.getPhotos());

        return DiscoveredEntity.builder()
                .googlePlaceId(details.getId() != null ? details.getId() : fallback != null ? fallback.getId() : null)
                .name(name != null ? name : "Unknown")
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .formattedAddress(emptyToNull(address))
                .postcode(emptyToNull(postcode))
                .locality(postal != null ? emptyToNull(postal.getLocality()) : null)
                .cuisine(deriveCuisine(types))
                .categories(List.copyOf(types))
                .website(emptyToNull(details.getWebsiteUri()))
                .rating(details.getRating())
                .reviewsCount(details.getUserRatingCount())
                .priceLevel(priceLevel(details.getPriceLevel()))
                .menuUrl(emptyToNull(menuUrl))
                .heroImageUrl(images.isEmpty() ? null : images.get(0))
                .imageUrls(images)
                .zoneId(zoneId)
                .discoveredAt(Instant.now())
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String deriveCuisine(List<String> types) {
        for (String type : types) {
            for (Map.Entry<String, String> cuisine : CUISINES) {
                if (cuisine.getKey().equals(type)) return cuisine.getValue();
            }
        }
        return DEFAULT_CUISINE;
    }

    static String extractPostcode(String address) {
        if (address == null) return null;
        Matcher m = UK_POSTCODE.matcher(address);
        return m.find() ? m.group(0) : null;
    }

    static Integer priceLevel(String level) {
        if (level == null) return null;
        Integer value = PRICE_LEVELS.get(level);
        if (value == null && !"PRICE_LEVEL_UNSPECIFIED".equals(level)) {
            log.warn("Unrecognised price level: {}", level);
        }
        return value;
    }

    private List<String> imageUrls(List<PlacesApiPlace.Photo> photos) {
        if (photos == null) return List.of();
        int px = properties.getApi().getPhotoMaxPx();
        return photos.stream()
                .map(PlacesApiPlace.Photo::getName)
                .filter(Objects::nonNull)
                .limit(properties.getApi().getMaxImages())
                .map(name -> placesApiClient.photoUrl(name, px, px))
                .filter(url -> !url.isEmpty())
                .toList();
    }

    private static boolean isBlank(String val) {
        return val == null || val.isBlank();
    }

    private static String emptyToNull(String val) {
        return isBlank(val) ? null : val;
    }
}
