package com.windfarm.conformance.core;

import com.windfarm.conformance.model.FunctionMetadata;

/**
 * 清洗算子。每个算子对单个数据源的完整数据流做一次整表变换，
 * 按顺序串联成该数据源的算子管道。
 *
 * 每次管道执行依次调用 initialize、execute、cleanup，cleanup 在 execute 抛出异常时同样会被调用。
 * 同一实例会以不同参数出现在多个管道位置，因此参数只在 initialize 中读取。
 * 单元格级问题置空或删行并经 context 计数，结构性问题抛出
 * {@link com.windfarm.conformance.exception.ConformanceException} 的子类。
 */
public interface UFunction {

    /** 读取本次执行的参数 */
    void initialize(OperatorContext context);

    /** 从context读取输入流，并把结果流写回context */
    void execute(OperatorContext context);

    void cleanup();

    /** 算子标识、适用的数据源类型和参数定义，用于注册和执行前校验 */
    FunctionMetadata getMetadata();
}
