package com.windfarm.conformance.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单个数据源的清洗管道配置
 */
public class SourcePipelineConfig implements Serializable {
    /** 数据源名称（与元数据契约一致） */
    private final String sourceName;
    /** 算子管道配置，按order排序执行 */
    private final List<OperatorConfig> operatorPipeline = new ArrayList<>();

    public SourcePipelineConfig(String sourceName) {
        this.sourceName = sourceName;
    }

    /** 追加算子，order按追加顺序递增 */
    public SourcePipelineConfig then(String functionId, Map<String, Object> parameters) {
        operatorPipeline.add(new OperatorConfig(functionId, operatorPipeline.size() + 1, parameters));
        return this;
    }

    public String getSourceName() { return sourceName; }
    public List<OperatorConfig> getOperatorPipeline() { return operatorPipeline; }
}
