package com.windfarm.conformance.contract;

import com.windfarm.conformance.model.SourceType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 元数据契约：声明每个数据源的文件、列映射、单位、采样周期以及资产表结构。
 * 所有内容均为静态配置，不从数据中推断。
 */
public final class MetadataContract implements Serializable {
    private final Map<String, SourceSchema> sources;
    private final AssetSchema assetSchema;

    public MetadataContract(List<SourceSchema> sources, AssetSchema assetSchema) {
        Map<String, SourceSchema> byName = new LinkedHashMap<>();
        for (SourceSchema schema : sources) {
            if (byName.put(schema.getName(), schema) != null) {
                throw new IllegalArgumentException("Source '" + schema.getName() + "' is declared twice");
            }
        }
        this.sources = Collections.unmodifiableMap(byName);
        this.assetSchema = assetSchema;
    }

    public Map<String, SourceSchema> getSources() { return sources; }
    public AssetSchema getAssetSchema() { return assetSchema; }

    public SourceSchema getSource(String name) {
        return sources.get(name);
    }

    public List<SourceSchema> getSourcesOfType(SourceType type) {
        List<SourceSchema> result = new ArrayList<>();
        for (SourceSchema schema : sources.values()) {
            if (schema.getType() == type) {
                result.add(schema);
            }
        }
        return result;
    }
}
