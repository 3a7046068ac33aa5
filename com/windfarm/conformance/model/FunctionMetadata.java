package com.windfarm.conformance.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 算子元数据：标识、版本、适用的数据源类型和参数定义。
 * 未调用 {@link #appliesTo} 时算子适用于全部数据源类型。
 */
public class FunctionMetadata {

    private final String functionId;
    private final String version;
    private final String description;
    private Set<SourceType> applicableTypes = EnumSet.allOf(SourceType.class);
    private List<ParameterDefinition> parameterDefinitions = List.of();

    public FunctionMetadata(String functionId, String version, String description) {
        this.functionId = functionId;
        this.version = version;
        this.description = description;
    }

    public FunctionMetadata appliesTo(SourceType first, SourceType... rest) {
        this.applicableTypes = EnumSet.of(first, rest);
        return this;
    }

    public FunctionMetadata withParameters(ParameterDefinition... definitions) {
        return withParameters(Arrays.asList(definitions));
    }

    public FunctionMetadata withParameters(List<ParameterDefinition> definitions) {
        this.parameterDefinitions = List.copyOf(definitions);
        return this;
    }

    public boolean isApplicableTo(SourceType type) {
        return applicableTypes.contains(type);
    }

    public String getFunctionId() { return functionId; }
    public String getVersion() { return version; }
    public String getDescription() { return description; }
    public Set<SourceType> getApplicableTypes() { return Collections.unmodifiableSet(applicableTypes); }
    public List<ParameterDefinition> getParameterDefinitions() { return parameterDefinitions; }
}
