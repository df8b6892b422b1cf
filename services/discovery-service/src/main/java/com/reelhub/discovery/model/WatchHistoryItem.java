package com.reelhub.discovery.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

/**
 * An entry of a user's watch history or saved list. Lists are ordered newest-first;
 * index 0 is the most recent entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WatchHistoryItem {
    private long id;

    @JsonProperty("media_type")
    private MediaType mediaType;

    @JsonProperty("genre_ids")
    private List<Integer> genreIds;

    @JsonProperty("release_date")
    private String releaseDate;

    @JsonProperty("first_air_date")
    private String firstAirDate;

    @JsonProperty("last_watched")
    private Instant lastWatched;

    public WatchHistoryItem() {
    }

    public WatchHistoryItem(long id, MediaType mediaType, List<Integer> genreIds) {
        this.id = id;
        this.mediaType = mediaType;
        this.genreIds = genreIds;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public MediaType getMediaType() {
        return mediaType;
    }

    public void setMediaType(MediaType mediaType) {
        this.mediaType = mediaType;
    }

    public List<Integer> getGenreIds() {
        return genreIds;
    }

    public void setGenreIds(List<Integer> genreIds) {
        this.genreIds = genreIds;
    }

    public String getReleaseDate() {
        return releaseDate;
    }

    public void setReleaseDate(String releaseDate) {
        this.releaseDate = releaseDate;
    }

    public String getFirstAirDate() {
        return firstAirDate;
    }

    public void setFirstAirDate(String firstAirDate) {
        this.firstAirDate = firstAirDate;
    }

    public Instant getLastWatched() {
        return lastWatched;
    }

    public void setLastWatched(Instant lastWatched) {
        this.lastWatched = lastWatched;
    }

    /**
     * Media type as recorded, or inferred from the date field the provider uses for series.
     */
    @JsonIgnore
    public MediaType resolveMediaType() {
        if (mediaType != null) {
            return mediaType;
        }
        return firstAirDate != null && !firstAirDate.isBlank() ? MediaType.TV : MediaType.MOVIE;
    }

    @JsonIgnore
    public ItemKey key() {
        return ItemKey.of(resolveMediaType(), id);
    }
}
