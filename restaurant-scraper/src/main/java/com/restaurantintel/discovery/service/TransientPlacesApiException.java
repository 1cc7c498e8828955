package com.restaurantintel.discovery.service;

/**
 * Rate limiting, 5xx or transport failure. Retried by the placesApi retry instance.
 */
public class TransientPlacesApiException extends RuntimeException {

    public TransientPlacesApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
