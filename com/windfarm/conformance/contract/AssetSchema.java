package com.windfarm.conformance.contract;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 资产表的契约声明：资产属性名 -> 原始列名
 */
public final class AssetSchema implements Serializable {
    private final String fileName;
    private final char delimiter;
    private final String idColumn;
    private final Map<String, String> attributeColumns;
    /** 原始表中没有type列时使用的默认类型 */
    private final String defaultType;

    public AssetSchema(String fileName, char delimiter, String idColumn,
                       Map<String, String> attributeColumns, String defaultType) {
        this.fileName = fileName;
        this.delimiter = delimiter;
        this.idColumn = idColumn;
        this.attributeColumns = Collections.unmodifiableMap(new LinkedHashMap<>(attributeColumns));
        this.defaultType = defaultType;
    }

    public String getFileName() { return fileName; }
    public char getDelimiter() { return delimiter; }
    public String getIdColumn() { return idColumn; }
    public Map<String, String> getAttributeColumns() { return attributeColumns; }
    public String getDefaultType() { return defaultType; }

    public boolean declares(String attribute) {
        return "asset_id".equals(attribute) || attributeColumns.containsKey(attribute)
                || ("type".equals(attribute) && defaultType != null);
    }
}
