package com.windfarm.conformance.core;

import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.model.ObservationStream;

/**
 * 算子上下文接口：算子与流水线交互的唯一桥梁。
 *
 * 为算子提供四个核心能力：
 * 1. 获取输入数据流（前一个算子的输出）
 * 2. 输出清洗结果
 * 3. 读取配置参数与数据源契约
 * 4. 记录数据质量指标
 */
public interface OperatorContext {

    /**
     * 获取完整的输入数据流。
     * 管道第一个算子读到组装后的原始数据流，后续算子读到前一个算子的输出。
     * 流水线独占中间数据流，算子可以原地修改后再输出。
     *
     * @return 输入数据流，非null
     */
    ObservationStream getInputStream();

    /**
     * 设置当前算子的输出数据流。未设置时视为原样透传输入。
     *
     * @param stream 输出数据流
     */
    void setOutputStream(ObservationStream stream);

    /**
     * 获取指定名称的算子参数，支持泛型类型安全转换。
     *
     * @param paramName    参数名称
     * @param defaultValue 参数不存在时的默认值，同时用于推断返回类型
     * @param <T>          参数值类型
     * @return 参数值；参数不存在时返回defaultValue
     */
    <T> T getParameter(String paramName, T defaultValue);

    /**
     * 当前数据源在元数据契约中的声明（采样周期、字段策略等）。
     *
     * @return 数据源契约
     */
    SourceSchema getSourceSchema();

    /**
     * 记录数据质量指标，计入本次运行的质量报告。
     *
     * @param metric 指标名，如 deduplication.removed
     * @param count  数量
     */
    void recordQuality(String metric, long count);
}
