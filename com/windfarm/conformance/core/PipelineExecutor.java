package com.windfarm.conformance.core;

import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.SourcePipelineConfig;
import com.windfarm.conformance.model.SourceType;

/**
 * 管道执行器接口：驱动单个数据源的算子管道。
 *
 * 执行是同步的：每个算子消费前一个算子的完整输出，按order顺序串联。
 */
public interface PipelineExecutor {

    /**
     * 检查管道中各算子是否已注册、是否适用于该数据源类型、参数是否合规。
     *
     * @param config     数据源管道配置
     * @param sourceType 数据源类型
     * @throws com.windfarm.conformance.exception.PipelineConfigurationException 配置不合规时抛出
     */
    void checkOperatorParameters(SourcePipelineConfig config, SourceType sourceType);

    /**
     * 执行数据源的算子管道。
     *
     * @param config 数据源管道配置
     * @param input  组装后的原始数据流
     * @param schema 数据源契约
     * @param report 质量报告，各算子的质量指标写入其中
     * @return 最后一个算子的输出
     */
    ObservationStream execute(SourcePipelineConfig config, ObservationStream input,
                              SourceSchema schema, QualityReport report);
}
