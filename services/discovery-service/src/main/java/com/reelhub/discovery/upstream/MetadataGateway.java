package com.reelhub.discovery.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.MediaType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.stereotype.Component;

/**
 * Typed provider operations on top of {@link TmdbClient}. Listing results are normalized to
 * {@link CandidateItem}s here.
 */
@Component
public class MetadataGateway {
    static final String DETAIL_APPENDS = "credits,keywords";
    static final String MODAL_APPENDS = "credits,images,videos,similar,recommendations";

    private final TmdbClient tmdbClient;
    private final TmdbProperties properties;

    public MetadataGateway(TmdbClient tmdbClient, TmdbProperties properties) {
        this.tmdbClient = tmdbClient;
        this.properties = properties;
    }

    public CompletableFuture<List<CandidateItem>> trending() {
        return tmdbClient.fetch("/trending/all/week", Map.of())
            .thenApply(body -> TmdbItemMapper.toCandidates(body, null));
    }

    public CompletableFuture<List<CandidateItem>> discover(MediaType type, Map<String, ?> params) {
        return tmdbClient.fetch("/discover/" + type.value(), params)
            .thenApply(body -> TmdbItemMapper.toCandidates(body, type));
    }

    public CompletableFuture<List<CandidateItem>> similar(ItemKey key) {
        return tmdbClient.fetch(itemPath(key) + "/similar", Map.of())
            .thenApply(body -> TmdbItemMapper.toCandidates(body, key.mediaType()));
    }

    public CompletableFuture<List<CandidateItem>> recommendations(ItemKey key) {
        return tmdbClient.fetch(itemPath(key) + "/recommendations", Map.of())
            .thenApply(body -> TmdbItemMapper.toCandidates(body, key.mediaType()));
    }

    /**
     * Members of a franchise collection. Collections only group movies.
     */
    public CompletableFuture<List<CandidateItem>> collectionParts(long collectionId) {
        return tmdbClient.fetch("/collection/" + collectionId, Map.of())
            .thenApply(body -> TmdbItemMapper.toCandidates(body, MediaType.MOVIE));
    }

    public CompletableFuture<ItemDetail> details(ItemKey key) {
        return tmdbClient.fetch(itemPath(key), Map.of("append_to_response", DETAIL_APPENDS))
            .thenApply(body -> TmdbItemMapper.toDetail(body, key));
    }

    public CompletableFuture<List<CandidateItem>> searchMulti(String query, int page) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("language", properties.getDefaultLanguage());
        params.put("page", page);
        return tmdbClient.fetch("/search/multi", params)
            .thenApply(body -> TmdbItemMapper.toCandidates(body, null));
    }

    public CompletableFuture<JsonNode> modal(ItemKey key) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("append_to_response", MODAL_APPENDS);
        params.put("language", properties.getDefaultLanguage());
        return tmdbClient.fetch(itemPath(key), params);
    }

    public CompletableFuture<JsonNode> raw(String path, Map<String, ?> params) {
        Map<String, Object> merged = new LinkedHashMap<>(params);
        merged.putIfAbsent("language", properties.getDefaultLanguage());
        return tmdbClient.fetch(path, merged);
    }

    private static String itemPath(ItemKey key) {
        return "/" + key.mediaType().value() + "/" + key.id();
    }
}
