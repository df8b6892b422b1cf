package com.reelhub.discovery.ranking;

import com.reelhub.discovery.model.ItemKey;
import com.reelhub.discovery.model.TasteProfile;
import java.util.Set;

/**
 * Per-call ranking inputs. A null saved-list policy or limit falls back to the configured
 * default for the mode.
 */
public final class RankingContext {
    private final RankingMode mode;
    private final TasteProfile profile;
    private final Set<ItemKey> watchedKeys;
    private final Set<ItemKey> listKeys;
    private final ItemKey referenceKey;
    private final SavedListPolicy savedListPolicy;
    private final Integer limit;

    private RankingContext(
        RankingMode mode,
        TasteProfile profile,
        Set<ItemKey> watchedKeys,
        Set<ItemKey> listKeys,
        ItemKey referenceKey,
        SavedListPolicy savedListPolicy,
        Integer limit
    ) {
        this.mode = mode;
        this.profile = profile == null ? TasteProfile.empty() : profile;
        this.watchedKeys = watchedKeys == null ? Set.of() : Set.copyOf(watchedKeys);
        this.listKeys = listKeys == null ? Set.of() : Set.copyOf(listKeys);
        this.referenceKey = referenceKey;
        this.savedListPolicy = savedListPolicy;
        this.limit = limit;
    }

    public static RankingContext homeFeed(TasteProfile profile, Set<ItemKey> watchedKeys, Set<ItemKey> listKeys) {
        return new RankingContext(RankingMode.HOME_FEED, profile, watchedKeys, listKeys, null, null, null);
    }

    public static RankingContext itemDetail(ItemKey referenceKey, TasteProfile profile, Set<ItemKey> listKeys) {
        return new RankingContext(RankingMode.ITEM_DETAIL, profile, Set.of(), listKeys, referenceKey, null, null);
    }

    public RankingContext withSavedListPolicy(SavedListPolicy policy) {
        return new RankingContext(mode, profile, watchedKeys, listKeys, referenceKey, policy, limit);
    }

    public RankingContext withLimit(Integer limit) {
        return new RankingContext(mode, profile, watchedKeys, listKeys, referenceKey, savedListPolicy, limit);
    }

    public RankingMode getMode() {
        return mode;
    }

    public TasteProfile getProfile() {
        return profile;
    }

    public Set<ItemKey> getWatchedKeys() {
        return watchedKeys;
    }

    public Set<ItemKey> getListKeys() {
        return listKeys;
    }

    public ItemKey getReferenceKey() {
        return referenceKey;
    }

    public SavedListPolicy getSavedListPolicy() {
        return savedListPolicy;
    }

    public Integer getLimit() {
        return limit;
    }
}
