package com.restaurantintel.discovery.service;

/**
 * 401/403 from the Places API. Never retried.
 */
public class PlacesAccessDeniedException extends RuntimeException {

    public PlacesAccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
