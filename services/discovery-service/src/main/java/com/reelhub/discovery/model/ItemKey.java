package com.reelhub.discovery.model;

/**
 * Identity of a provider item. Movie and tv id spaces are not guaranteed to be disjoint,
 * so the media type is part of the key.
 */
public record ItemKey(MediaType mediaType, long id) {

    public static ItemKey of(MediaType mediaType, long id) {
        return new ItemKey(mediaType, id);
    }

    @Override
    public String toString() {
        return (mediaType == null ? "unknown" : mediaType.value()) + ":" + id;
    }
}
