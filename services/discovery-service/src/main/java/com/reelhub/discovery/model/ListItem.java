package com.reelhub.discovery.model;

import java.util.List;

/**
 * A saved-list ("watch later") entry. Same shape as a history entry; membership checks use
 * {@link #key()}, recency order is kept when the list is used as a taste signal.
 */
public class ListItem extends WatchHistoryItem {

    public ListItem() {
    }

    public ListItem(long id, MediaType mediaType, List<Integer> genreIds) {
        super(id, mediaType, genreIds);
    }
}
