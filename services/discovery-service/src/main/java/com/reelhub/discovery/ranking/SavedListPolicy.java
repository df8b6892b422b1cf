package com.reelhub.discovery.ranking;

/**
 * How candidates already on the user's saved list are treated.
 */
public enum SavedListPolicy {
    BOOST,
    PENALTY,
    IGNORE
}
