package com.reelhub.discovery.upstream;

public class TmdbConfigurationException extends RuntimeException {
    public TmdbConfigurationException(String message) {
        super(message);
    }
}
