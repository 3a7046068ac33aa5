package com.windfarm.conformance.contract;

import java.io.Serializable;
import java.util.Objects;

/**
 * 契约中单个字段的声明：规范名、原始列名、单位、是否必选、非法值策略。
 * rawColumn为null表示该字段由流水线派生，不来自原始文件。
 */
public final class FieldSpec implements Serializable {
    private final String name;
    private final String rawColumn;
    private final String unit;
    private final boolean required;
    private final InvalidValuePolicy policy;

    public FieldSpec(String name, String rawColumn, String unit, boolean required, InvalidValuePolicy policy) {
        this.name = Objects.requireNonNull(name, "name");
        this.rawColumn = rawColumn;
        this.unit = unit;
        this.required = required;
        this.policy = policy != null ? policy : InvalidValuePolicy.NULL_CELL;
    }

    public String getName() { return name; }
    public String getRawColumn() { return rawColumn; }
    public String getUnit() { return unit; }
    public boolean isRequired() { return required; }
    public InvalidValuePolicy getPolicy() { return policy; }
    public boolean isDerived() { return rawColumn == null; }

    @Override
    public String toString() {
        return name + (rawColumn != null ? "<-" + rawColumn : "(derived)")
                + (unit != null ? "[" + unit + "]" : "") + (required ? "*" : "");
    }
}
