package com.restaurantintel.discovery.config;

/**
 * Fatal configuration fault, raised before any network activity.
 */
public class DiscoveryConfigurationException extends RuntimeException {

    public DiscoveryConfigurationException(String message) {
        super(message);
    }
}
