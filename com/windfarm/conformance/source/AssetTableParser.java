package com.windfarm.conformance.source;

import com.windfarm.conformance.contract.AssetSchema;
import com.windfarm.conformance.exception.SchemaViolationException;
import com.windfarm.conformance.model.Asset;
import com.windfarm.conformance.model.AssetTable;
import com.windfarm.conformance.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按资产契约解析资产表。重复的资产标识原样保留，由一致性校验器拒绝。
 */
public class AssetTableParser {

    private static final Logger log = LoggerFactory.getLogger(AssetTableParser.class);

    static final String SOURCE_NAME = "assets";

    public AssetTable parse(AssetSchema schema, RawTable table) {
        int idIndex = table.indexOf(schema.getIdColumn());
        if (idIndex < 0) {
            throw new SchemaViolationException(SOURCE_NAME, schema.getIdColumn(),
                    "asset id column missing from " + table.getName());
        }

        Map<String, Integer> attributeIndex = new HashMap<>();
        for (Map.Entry<String, String> entry : schema.getAttributeColumns().entrySet()) {
            int index = table.indexOf(entry.getValue());
            if (index < 0) {
                throw new SchemaViolationException(SOURCE_NAME, entry.getKey(),
                        "column '" + entry.getValue() + "' missing from " + table.getName());
            }
            attributeIndex.put(entry.getKey(), index);
        }

        List<Asset> assets = new ArrayList<>();
        int skipped = 0;
        for (String[] row : table.getRows()) {
            String id = RawTable.cell(row, idIndex);
            if (id == null || id.isBlank()) {
                skipped++;
                continue;
            }
            String type = text(row, attributeIndex.get("type"));
            assets.add(new Asset(id.trim(),
                    type != null ? type : schema.getDefaultType(),
                    number(row, attributeIndex.get("latitude"), id),
                    number(row, attributeIndex.get("longitude"), id),
                    number(row, attributeIndex.get("rated_power"), id),
                    number(row, attributeIndex.get("hub_height"), id),
                    number(row, attributeIndex.get("rotor_diameter"), id),
                    number(row, attributeIndex.get("elevation"), id)));
        }
        if (skipped > 0) {
            log.warn("Asset table {}: {} rows without asset id skipped", table.getName(), skipped);
        }
        log.info("Parsed {} assets from {}", assets.size(), table.getName());
        return new AssetTable(assets);
    }

    private static String text(String[] row, Integer index) {
        if (index == null) {
            return null;
        }
        String value = RawTable.cell(row, index);
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    private static Double number(String[] row, Integer index, String assetId) {
        String value = text(row, index);
        if (value == null || StreamAssembler.isMissing(value)) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            log.warn("Asset '{}': unparseable attribute value '{}' nulled", assetId, value);
            return null;
        }
    }
}
