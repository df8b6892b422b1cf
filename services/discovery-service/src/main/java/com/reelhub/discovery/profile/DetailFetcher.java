package com.reelhub.discovery.profile;

import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.ItemKey;
import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface DetailFetcher {
    CompletableFuture<ItemDetail> fetch(ItemKey key);
}
