package com.windfarm.conformance.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 资产表。保留读入顺序；重复声明的assetId由一致性校验器拒绝。
 */
public final class AssetTable implements Serializable {
    private final List<Asset> assets;
    private final Map<String, Asset> byId = new LinkedHashMap<>();

    public AssetTable(Collection<Asset> assets) {
        this.assets = List.copyOf(assets);
        for (Asset asset : this.assets) {
            byId.putIfAbsent(asset.getAssetId(), asset);
        }
    }

    public Asset get(String assetId) {
        return byId.get(assetId);
    }

    public boolean contains(String assetId) {
        return byId.containsKey(assetId);
    }

    public Set<String> getAssetIds() {
        return Collections.unmodifiableSet(byId.keySet());
    }

    public List<Asset> getAssets() {
        return assets;
    }

    public int size() {
        return assets.size();
    }

    /** 重复出现的assetId，按首次重复的顺序 */
    public Set<String> findDuplicateIds() {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Asset asset : assets) {
            if (!seen.add(asset.getAssetId())) {
                duplicates.add(asset.getAssetId());
            }
        }
        return duplicates;
    }

    /** 只保留给定标识的资产 */
    public AssetTable restrictTo(Set<String> assetIds) {
        List<Asset> kept = new ArrayList<>();
        for (Asset asset : assets) {
            if (assetIds.contains(asset.getAssetId())) {
                kept.add(asset);
            }
        }
        return new AssetTable(kept);
    }
}
