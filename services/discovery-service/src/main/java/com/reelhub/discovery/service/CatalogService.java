package com.reelhub.discovery.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelhub.discovery.cache.CacheKeyUtil;
import com.reelhub.discovery.cache.CacheResult;
import com.reelhub.discovery.cache.ComputeCache;
import com.reelhub.discovery.cache.DiscoveryCacheProperties;
import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.upstream.MetadataGateway;
import com.reelhub.discovery.upstream.UpstreamFutures;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class CatalogService {
    private final MetadataGateway gateway;
    private final ComputeCache computeCache;
    private final DiscoveryCacheProperties cacheProperties;

    public CatalogService(MetadataGateway gateway, ComputeCache computeCache, DiscoveryCacheProperties cacheProperties) {
        this.gateway = gateway;
        this.computeCache = computeCache;
        this.cacheProperties = cacheProperties;
    }

    /**
     * Details, credits, images, videos, similar and recommendations in one provider call.
     */
    public CacheResult<JsonNode> modal(ItemKey key) {
        return computeCache.get(
            "modal_" + key.mediaType().value() + "_" + key.id(),
            () -> UpstreamFutures.join(gateway.modal(key)),
            cacheProperties.getDetailsTtlMs()
        );
    }

    /**
     * Pass-through to an arbitrary provider path. Caller-supplied credentials are dropped; the
     * configured key is always used.
     */
    public CacheResult<JsonNode> proxy(String path, Map<String, String> query) {
        String normalized = normalizePath(path);
        Map<String, String> params = new LinkedHashMap<>();
        if (query != null) {
            query.forEach((name, value) -> {
                if (name != null && !name.isBlank() && !"api_key".equalsIgnoreCase(name) && value != null) {
                    params.put(name, value);
                }
            });
        }
        String key = "proxy_" + CacheKeyUtil.pathWithQuery(normalized, params);
        return computeCache.get(
            key,
            () -> UpstreamFutures.join(gateway.raw(normalized, params)),
            cacheProperties.getProxyTtlMs()
        );
    }

    private static String normalizePath(String path) {
        if (path == null || path.isBlank() || "/".equals(path.trim())) {
            throw new InvalidDiscoveryRequestException("provider path is required");
        }
        String trimmed = path.trim();
        if (trimmed.contains("..") || trimmed.contains("://")) {
            throw new InvalidDiscoveryRequestException("invalid provider path");
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }
}
