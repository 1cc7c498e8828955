package com.restaurantintel.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching the Places API (New) place resource.
 * Search responses only populate id, displayName, location and formattedAddress;
 * the details call fills in the rest according to its field mask.
 * Kept separate from the domain model to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlacesApiPlace {

    private String id;

    private LocalizedText displayName;

    private String formattedAddress;

    private PostalAddress postalAddress;

    private LatLng location;

    private String websiteUri;

    private List<String> types;

    private Double rating;

    private Integer userRatingCount;

    /** e.g. PRICE_LEVEL_MODERATE */
    private String priceLevel;

    private List<Photo> photos;

    public String displayNameText() {
        return displayName != null ? displayName.getText() : null;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocalizedText {
        private String text;
        private String languageCode;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LatLng {
        private Double latitude;
        private Double longitude;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PostalAddress {
        private String regionCode;
        private String postalCode;
        private String locality;
        private List<String> addressLines;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Photo {
        /** Resource name, e.g. places/{placeId}/photos/{photoRef} */
        private String name;
        private Integer widthPx;
        private Integer heightPx;
    }
}
