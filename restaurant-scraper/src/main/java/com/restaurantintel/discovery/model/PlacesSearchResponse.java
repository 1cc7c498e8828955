package com.restaurantintel.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of a places:searchText response.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlacesSearchResponse {

    private List<PlacesApiPlace> places = new ArrayList<>();

    /** Absent on the last page */
    private String nextPageToken;
}
