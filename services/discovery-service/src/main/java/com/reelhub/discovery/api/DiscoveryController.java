package com.reelhub.discovery.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelhub.discovery.api.dto.RecommendationRequest;
import com.reelhub.discovery.api.dto.RecommendationResponse;
import com.reelhub.discovery.api.dto.SearchResponse;
import com.reelhub.discovery.api.dto.SuggestionsResponse;
import com.reelhub.discovery.api.dto.TrendingSearchesResponse;
import com.reelhub.discovery.cache.CacheResult;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.MediaType;
import com.reelhub.discovery.search.SearchFilters;
import com.reelhub.discovery.search.SearchService;
import com.reelhub.discovery.search.SearchSort;
import com.reelhub.discovery.service.CatalogService;
import com.reelhub.discovery.service.InvalidDiscoveryRequestException;
import com.reelhub.discovery.service.RecommendationService;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DiscoveryController {
    static final String CACHE_HEADER = "X-Cache";
    private static final String PROXY_PREFIX = "/proxy";

    private final RecommendationService recommendationService;
    private final SearchService searchService;
    private final CatalogService catalogService;

    public DiscoveryController(
        RecommendationService recommendationService,
        SearchService searchService,
        CatalogService catalogService
    ) {
        this.recommendationService = recommendationService;
        this.searchService = searchService;
        this.catalogService = catalogService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/recommendations")
    public ResponseEntity<RecommendationResponse> guestRecommendations() {
        return withCacheHeader(recommendationService.guestHome());
    }

    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationResponse> recommendations(
        @RequestBody(required = false) RecommendationRequest request
    ) {
        RecommendationRequest resolved = request == null ? new RecommendationRequest() : request;
        return withCacheHeader(
            recommendationService.home(resolved.getUserId(), resolved.getWatchHistory(), resolved.getMyList())
        );
    }

    @GetMapping("/recommendations/{type}/{id}")
    public ResponseEntity<RecommendationResponse> itemRecommendations(
        @PathVariable("type") String type,
        @PathVariable("id") long id
    ) {
        return withCacheHeader(recommendationService.forItem(itemKey(type, id), null, List.of(), List.of()));
    }

    @PostMapping("/recommendations/{type}/{id}")
    public ResponseEntity<RecommendationResponse> itemRecommendationsForUser(
        @PathVariable("type") String type,
        @PathVariable("id") long id,
        @RequestBody(required = false) RecommendationRequest request
    ) {
        RecommendationRequest resolved = request == null ? new RecommendationRequest() : request;
        return withCacheHeader(
            recommendationService.forItem(
                itemKey(type, id),
                resolved.getUserId(),
                resolved.getWatchHistory(),
                resolved.getMyList()
            )
        );
    }

    @DeleteMapping("/recommendations/cache/users/{userId}")
    public Map<String, Object> invalidateUserRecommendations(@PathVariable("userId") String userId) {
        int removed = recommendationService.invalidateUser(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", userId);
        body.put("invalidated", removed);
        return body;
    }

    @GetMapping("/titles/{type}/{id}/modal")
    public ResponseEntity<JsonNode> modal(@PathVariable("type") String type, @PathVariable("id") long id) {
        return withCacheHeader(catalogService.modal(itemKey(type, id)));
    }

    @GetMapping("/search")
    public ResponseEntity<SearchResponse> search(
        @RequestParam(value = "query", required = false) String query,
        @RequestParam(value = "media_type", required = false) String mediaType,
        @RequestParam(value = "year_start", required = false) Integer yearStart,
        @RequestParam(value = "year_end", required = false) Integer yearEnd,
        @RequestParam(value = "min_rating", required = false) Double minRating,
        @RequestParam(value = "genres", required = false) String genres,
        @RequestParam(value = "sort_by", required = false) String sortBy,
        @RequestParam(value = "page", required = false) Integer page,
        @RequestParam(value = "limit", required = false) Integer limit
    ) {
        SearchFilters filters = new SearchFilters(
            parseMediaFilter(mediaType),
            yearStart,
            yearEnd,
            minRating,
            parseGenres(genres)
        );
        return withCacheHeader(searchService.search(query, filters, SearchSort.fromValue(sortBy), page, limit));
    }

    @GetMapping("/search/suggestions")
    public ResponseEntity<SuggestionsResponse> suggestions(@RequestParam(value = "query", required = false) String query) {
        return withCacheHeader(searchService.suggestions(query));
    }

    @GetMapping("/search/trending")
    public TrendingSearchesResponse trendingSearches() {
        return new TrendingSearchesResponse(searchService.trendingQueries(), Instant.now());
    }

    @GetMapping("/proxy/**")
    public ResponseEntity<JsonNode> proxy(HttpServletRequest request, @RequestParam Map<String, String> query) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        String path = uri.startsWith(PROXY_PREFIX) ? uri.substring(PROXY_PREFIX.length()) : uri;
        return withCacheHeader(catalogService.proxy(path, query));
    }

    private static ItemKey itemKey(String type, long id) {
        MediaType mediaType = MediaType.fromValue(type);
        if (mediaType == null) {
            throw new InvalidDiscoveryRequestException("type must be movie or tv");
        }
        if (id <= 0) {
            throw new InvalidDiscoveryRequestException("id must be positive");
        }
        return ItemKey.of(mediaType, id);
    }

    private static MediaType parseMediaFilter(String raw) {
        if (raw == null || raw.isBlank() || "all".equalsIgnoreCase(raw.trim())) {
            return null;
        }
        MediaType mediaType = MediaType.fromValue(raw.trim());
        if (mediaType == null) {
            throw new InvalidDiscoveryRequestException("media_type must be all, movie or tv");
        }
        return mediaType;
    }

    private static List<Integer> parseGenres(String raw) {
        List<Integer> genres = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return genres;
        }
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                genres.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidDiscoveryRequestException("genres must be a comma separated list of ids");
            }
        }
        return genres;
    }

    private static ResponseEntity<RecommendationResponse> withCacheHeader(RecommendationResponse response) {
        return ResponseEntity.ok().header(CACHE_HEADER, response.cacheHeader()).body(response);
    }

    private static <T> ResponseEntity<T> withCacheHeader(CacheResult<T> result) {
        return ResponseEntity.ok().header(CACHE_HEADER, result.fromCache() ? "HIT" : "MISS").body(result.value());
    }
}
