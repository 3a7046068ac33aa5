package com.windfarm.conformance.exception;

import java.util.List;

/**
 * 算子管道或契约配置不合法，在读取任何数据之前被拦截。
 */
public class PipelineConfigurationException extends ConformanceException {

    private final List<String> errors;

    public PipelineConfigurationException(String sourceName, List<String> errors) {
        super(sourceName, "Invalid pipeline configuration"
                + (sourceName != null ? " for source '" + sourceName + "'" : "") + ": " + errors);
        this.errors = List.copyOf(errors);
    }

    public PipelineConfigurationException(String message) {
        this(null, List.of(message));
    }

    public List<String> getErrors() { return errors; }
}
