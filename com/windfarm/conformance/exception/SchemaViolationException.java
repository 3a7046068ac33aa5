package com.windfarm.conformance.exception;

/**
 * 数据源不满足元数据契约：必选字段缺失、单位不符、采样周期不符或列名冲突无法解决。
 */
public class SchemaViolationException extends ConformanceException {

    private final String fieldName;

    public SchemaViolationException(String sourceName, String fieldName, String detail) {
        super(sourceName, "Schema violation in source '" + sourceName + "', field '"
                + fieldName + "': " + detail);
        this.fieldName = fieldName;
    }

    public String getFieldName() { return fieldName; }
}
