package com.reelhub.discovery.service;

public class InvalidDiscoveryRequestException extends RuntimeException {
    public InvalidDiscoveryRequestException(String message) {
        super(message);
    }
}
