package com.windfarm.conformance.model;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 算子参数定义。
 * 由算子在元数据中声明，流水线启动前用于校验管道配置。
 */
public class ParameterDefinition {

    public enum Type { NUMBER, STRING, ENUM, LIST }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String description;
    private Object defaultValue;
    /** 数值参数下限（含） */
    private Double minValue;
    /** 数值参数上限（含） */
    private Double maxValue;
    /** 枚举参数的可选值，大写 */
    private List<String> enumValues;

    private ParameterDefinition(String name, Type type, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
    }

    public static ParameterDefinition of(String name, Type type, boolean required, String description) {
        return new ParameterDefinition(name, type, required, description);
    }

    public ParameterDefinition withDefault(Object value) {
        this.defaultValue = value;
        return this;
    }

    public ParameterDefinition withMin(double min) {
        this.minValue = min;
        return this;
    }

    public ParameterDefinition withMax(double max) {
        this.maxValue = max;
        return this;
    }

    public ParameterDefinition withEnumValues(List<String> values) {
        this.enumValues = List.copyOf(values);
        return this;
    }

    /**
     * 校验一个已给出的参数值，不合规时向result追加错误。
     * 列表参数可以是集合，也可以是逗号分隔的字符串。
     */
    public void check(Object value, ValidationResult result) {
        switch (type) {
            case NUMBER:
                checkNumber(value, result);
                break;
            case STRING:
                if (!(value instanceof String)) {
                    result.error("parameter '" + name + "' expects STRING, got " + value.getClass().getSimpleName());
                }
                break;
            case ENUM:
                if (!(value instanceof String)) {
                    result.error("parameter '" + name + "' expects ENUM, got " + value.getClass().getSimpleName());
                } else if (enumValues != null && !enumValues.contains(((String) value).toUpperCase(Locale.ROOT))) {
                    result.error("parameter '" + name + "' value '" + value + "' is not one of " + enumValues);
                }
                break;
            case LIST:
                if (!(value instanceof Collection) && !(value instanceof String)) {
                    result.error("parameter '" + name + "' expects LIST, got " + value.getClass().getSimpleName());
                } else if (required && value instanceof Collection && ((Collection<?>) value).isEmpty()) {
                    result.error("required parameter '" + name + "' must not be an empty list");
                }
                break;
            default:
                throw new IllegalStateException("Unhandled parameter type " + type);
        }
    }

    private void checkNumber(Object value, ValidationResult result) {
        if (!(value instanceof Number)) {
            result.error("parameter '" + name + "' expects NUMBER, got " + value.getClass().getSimpleName());
            return;
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number)) {
            result.error("parameter '" + name + "' must not be NaN");
            return;
        }
        if (minValue != null && number < minValue) {
            result.error("parameter '" + name + "' value " + number + " is below minimum " + minValue);
        }
        if (maxValue != null && number > maxValue) {
            result.error("parameter '" + name + "' value " + number + " exceeds maximum " + maxValue);
        }
    }

    public String getName() { return name; }
    public Type getType() { return type; }
    public boolean isRequired() { return required; }
    public String getDescription() { return description; }
    public Object getDefaultValue() { return defaultValue; }
    public Double getMinValue() { return minValue; }
    public Double getMaxValue() { return maxValue; }
    public List<String> getEnumValues() { return enumValues; }
}
