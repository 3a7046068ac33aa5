package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 算子上下文默认实现。
 * 封装单个算子在管道中执行时所需的全部环境信息。
 * 支持管道串联，后一个算子的输入来自前一个算子的输出。
 */
public class DefaultOperatorContext implements OperatorContext {

    private final SourceSchema sourceSchema;
    private final Map<String, Object> parameters;
    private final QualityReport qualityReport;

    /** 前一个算子的上下文（用于管道串联），为null表示管道第一个算子 */
    private final DefaultOperatorContext previousContext;

    /** 管道第一个算子的输入 */
    private final ObservationStream initialInput;

    /** 当前算子的输出，未设置时透传输入 */
    private ObservationStream outputStream;

    public DefaultOperatorContext(SourceSchema sourceSchema,
                                  Map<String, Object> parameters,
                                  QualityReport qualityReport,
                                  DefaultOperatorContext previousContext,
                                  ObservationStream initialInput) {
        this.sourceSchema = sourceSchema;
        this.parameters = parameters != null ? parameters : Map.of();
        this.qualityReport = qualityReport;
        this.previousContext = previousContext;
        this.initialInput = initialInput;
    }

    @Override
    public ObservationStream getInputStream() {
        if (previousContext != null) {
            return previousContext.getOutputStream();
        }
        return initialInput;
    }

    @Override
    public void setOutputStream(ObservationStream stream) {
        this.outputStream = stream;
    }

    /** 获取当前算子的输出（供下一个算子读取） */
    ObservationStream getOutputStream() {
        return outputStream != null ? outputStream : getInputStream();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getParameter(String paramName, T defaultValue) {
        Object value = parameters.get(paramName);
        if (value == null) {
            return defaultValue;
        }

        try {
            if (defaultValue != null) {
                Class<?> targetType = defaultValue.getClass();
                // 数值类型转换
                if (targetType == Double.class && value instanceof Number) {
                    return (T) Double.valueOf(((Number) value).doubleValue());
                }
                if (targetType == Integer.class && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                }
                if (targetType == Long.class && value instanceof Number) {
                    return (T) Long.valueOf(((Number) value).longValue());
                }
                if (targetType == Boolean.class && value instanceof String) {
                    return (T) Boolean.valueOf((String) value);
                }
                // 列表参数允许逗号分隔的字符串
                if (defaultValue instanceof List) {
                    return (T) toStringList(value);
                }
                if (!targetType.isInstance(value)) {
                    return defaultValue;
                }
            }
            return (T) value;
        } catch (ClassCastException e) {
            return defaultValue;
        }
    }

    @Override
    public SourceSchema getSourceSchema() {
        return sourceSchema;
    }

    @Override
    public void recordQuality(String metric, long count) {
        if (qualityReport != null) {
            qualityReport.increment(sourceSchema.getName(), metric, count);
        }
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
