package com.restaurantintel.discovery.config;

public class ScanInProgressException extends RuntimeException {

    public ScanInProgressException(String runId) {
        super("A zone scan is already running: " + runId);
    }
}
