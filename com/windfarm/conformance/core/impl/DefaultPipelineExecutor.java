package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.core.FunctionManager;
import com.windfarm.conformance.core.PipelineExecutor;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.OperatorConfig;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.SourcePipelineConfig;
import com.windfarm.conformance.model.SourceType;
import com.windfarm.conformance.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 管道执行器默认实现。
 * 在调用线程上同步驱动算子管道，每个算子消费前一个算子的完整输出。
 */
public class DefaultPipelineExecutor implements PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineExecutor.class);

    private final FunctionManager functionManager;

    public DefaultPipelineExecutor(FunctionManager functionManager) {
        this.functionManager = functionManager;
    }

    @Override
    public void checkOperatorParameters(SourcePipelineConfig config, SourceType sourceType) {
        List<String> errors = new ArrayList<>();
        for (OperatorConfig opConfig : config.getOperatorPipeline()) {
            ValidationResult result = functionManager.validateFunction(
                    opConfig.getFunctionId(), opConfig.getParameters(), sourceType);
            for (String warning : result.getWarnings()) {
                log.warn("Source '{}': {}", config.getSourceName(), warning);
            }
            errors.addAll(result.getErrors());
        }
        if (!errors.isEmpty()) {
            log.error("Operator validation failed for source '{}': {}", config.getSourceName(), errors);
            throw new PipelineConfigurationException(config.getSourceName(), errors);
        }
    }

    @Override
    public ObservationStream execute(SourcePipelineConfig config, ObservationStream input,
                                     SourceSchema schema, QualityReport report) {
        List<OperatorConfig> pipeline = new ArrayList<>(config.getOperatorPipeline());
        pipeline.sort(Comparator.comparingInt(OperatorConfig::getOrder));

        // 第一个算子读取组装后的原始数据流，后续算子读取前一个算子的输出
        DefaultOperatorContext previousContext = null;
        long pipelineStart = System.currentTimeMillis();

        for (OperatorConfig opConfig : pipeline) {
            UFunction function = functionManager.getFunction(opConfig.getFunctionId());
            if (function == null) {
                throw new PipelineConfigurationException(config.getSourceName(),
                        List.of("Operator not found: " + opConfig.getFunctionId()));
            }

            DefaultOperatorContext context = new DefaultOperatorContext(
                    schema, opConfig.getParameters(), report, previousContext, input);

            long start = System.currentTimeMillis();
            function.initialize(context);
            try {
                function.execute(context);
            } finally {
                function.cleanup();
            }
            log.debug("Source '{}': operator '{}' done in {}ms, {} rows",
                    config.getSourceName(), opConfig.getFunctionId(),
                    System.currentTimeMillis() - start, context.getOutputStream().size());

            previousContext = context;
        }

        ObservationStream output = previousContext != null ? previousContext.getOutputStream() : input;
        log.info("Source '{}': {} operators applied in {}ms, {} -> {} rows",
                config.getSourceName(), pipeline.size(), System.currentTimeMillis() - pipelineStart,
                input.size(), output.size());
        return output;
    }
}
