package com.reelhub.discovery.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelhub.discovery.model.CandidateItem;
import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.MediaType;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes provider payloads. Nothing past this class reads provider-specific field names.
 */
public final class TmdbItemMapper {
    private TmdbItemMapper() {
    }

    /**
     * Maps the {@code results} (listings, discovery, search) or {@code parts} (collections) array.
     * Entries without a usable id, and entries whose media type is neither movie nor tv
     * (people in multi-search), are dropped. {@code fallbackType} applies to endpoints that
     * omit {@code media_type}.
     */
    public static List<CandidateItem> toCandidates(JsonNode response, MediaType fallbackType) {
        List<CandidateItem> items = new ArrayList<>();
        if (response == null || response.isMissingNode()) {
            return items;
        }
        JsonNode array = response.path("results");
        if (!array.isArray()) {
            array = response.path("parts");
        }
        if (!array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            CandidateItem item = toCandidate(node, fallbackType);
            if (item != null) {
                items.add(item);
            }
        }
        return items;
    }

    public static CandidateItem toCandidate(JsonNode node, MediaType fallbackType) {
        if (node == null || !node.isObject()) {
            return null;
        }
        long id = node.path("id").asLong(0L);
        if (id <= 0) {
            return null;
        }
        MediaType mediaType;
        if (node.hasNonNull("media_type")) {
            mediaType = MediaType.fromValue(node.get("media_type").asText());
        } else {
            mediaType = fallbackType;
        }
        if (mediaType == null) {
            return null;
        }

        CandidateItem item = new CandidateItem();
        item.setId(id);
        item.setMediaType(mediaType);
        item.setTitle(firstText(node, "title", "name"));
        item.setOriginalTitle(firstText(node, "original_title", "original_name"));
        item.setPosterPath(text(node, "poster_path"));
        item.setBackdropPath(text(node, "backdrop_path"));
        item.setOverview(text(node, "overview"));
        item.setGenreIds(intList(node.path("genre_ids")));
        item.setVoteAverage(number(node, "vote_average"));
        Double voteCount = number(node, "vote_count");
        item.setVoteCount(voteCount == null ? null : voteCount.intValue());
        item.setPopularity(number(node, "popularity"));
        item.setReleaseDate(firstText(node, "release_date", "first_air_date"));
        item.setOriginalLanguage(text(node, "original_language"));
        if (node.has("adult") && node.get("adult").isBoolean()) {
            item.setAdult(node.get("adult").asBoolean());
        }
        return item;
    }

    public static ItemDetail toDetail(JsonNode node, ItemKey key) {
        List<Long> directors = new ArrayList<>();
        for (JsonNode crew : node.path("credits").path("crew")) {
            if ("Director".equals(crew.path("job").asText())) {
                long id = crew.path("id").asLong(0L);
                if (id > 0 && !directors.contains(id)) {
                    directors.add(id);
                }
            }
        }

        JsonNode keywordNode = node.path("keywords").path("keywords");
        if (!keywordNode.isArray()) {
            keywordNode = node.path("keywords").path("results");
        }

        List<Integer> genres = new ArrayList<>();
        for (JsonNode genre : node.path("genres")) {
            int id = genre.path("id").asInt(0);
            if (id > 0) {
                genres.add(id);
            }
        }

        JsonNode collection = node.path("belongs_to_collection");
        Long collectionId = null;
        if (collection.isObject() && collection.path("id").asLong(0L) > 0) {
            collectionId = collection.path("id").asLong();
        }

        return new ItemDetail(
            key,
            text(node, "original_language"),
            firstText(node, "release_date", "first_air_date"),
            genres,
            directors,
            idList(node.path("credits").path("cast")),
            idList(keywordNode),
            idList(node.path("production_companies")),
            collectionId
        );
    }

    private static List<Long> idList(JsonNode array) {
        List<Long> ids = new ArrayList<>();
        if (!array.isArray()) {
            return ids;
        }
        for (JsonNode entry : array) {
            long id = entry.path("id").asLong(0L);
            if (id > 0) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static List<Integer> intList(JsonNode array) {
        List<Integer> values = new ArrayList<>();
        if (!array.isArray()) {
            return values;
        }
        for (JsonNode entry : array) {
            if (entry.canConvertToInt()) {
                values.add(entry.asInt());
            }
        }
        return values;
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        double parsed = value.asDouble();
        return Double.isFinite(parsed) ? parsed : null;
    }

    private static String firstText(JsonNode node, String primary, String secondary) {
        String value = text(node, primary);
        return value != null ? value : text(node, secondary);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
