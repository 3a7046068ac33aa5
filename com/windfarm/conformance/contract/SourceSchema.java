package com.windfarm.conformance.contract;

import com.windfarm.conformance.model.SourceType;

import java.io.Serializable;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单个时序数据源的契约声明
 */
public final class SourceSchema implements Serializable {
    private final String name;
    private final SourceType type;
    /** 相对数据目录的文件名；多个数据源可共享同一文件 */
    private final String fileName;
    private final char delimiter;
    private final String timeColumn;
    /** 资产标识列，电站级数据源为null */
    private final String entityColumn;
    /** 声明的采样周期 */
    private final Duration samplingPeriod;
    /** 原始时间戳不带偏移时假定的UTC偏移 */
    private final ZoneOffset assumedOffset;
    /** 再分析风速分量的参考高度（m），可为null */
    private final Double referenceHeight;
    private final Map<String, FieldSpec> fields;

    public SourceSchema(String name, SourceType type, String fileName, char delimiter,
                        String timeColumn, String entityColumn, Duration samplingPeriod,
                        ZoneOffset assumedOffset, Double referenceHeight, List<FieldSpec> fields) {
        this.name = name;
        this.type = type;
        this.fileName = fileName;
        this.delimiter = delimiter;
        this.timeColumn = timeColumn;
        this.entityColumn = entityColumn;
        this.samplingPeriod = samplingPeriod;
        this.assumedOffset = assumedOffset != null ? assumedOffset : ZoneOffset.UTC;
        this.referenceHeight = referenceHeight;
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            byName.put(field.getName(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public String getName() { return name; }
    public SourceType getType() { return type; }
    public String getFileName() { return fileName; }
    public char getDelimiter() { return delimiter; }
    public String getTimeColumn() { return timeColumn; }
    public String getEntityColumn() { return entityColumn; }
    public Duration getSamplingPeriod() { return samplingPeriod; }
    public ZoneOffset getAssumedOffset() { return assumedOffset; }
    public Double getReferenceHeight() { return referenceHeight; }

    public List<FieldSpec> getFields() {
        return new ArrayList<>(fields.values());
    }

    public FieldSpec getField(String name) {
        return fields.get(name);
    }

    public boolean declares(String fieldName) {
        return fields.containsKey(fieldName);
    }

    @Override
    public String toString() {
        return "SourceSchema{" + name + ", " + type + ", file=" + fileName
                + ", period=" + samplingPeriod + ", fields=" + fields.values() + "}";
    }
}
