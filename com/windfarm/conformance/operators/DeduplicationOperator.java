package com.windfarm.conformance.operators;

import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.AbstractMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 去重算子。
 * 以(资产, 时间)为键，保留第一次出现的记录，后续重复记录全部丢弃。
 * 重复执行结果不变。
 */
public class DeduplicationOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationOperator.class);

    public static final String FUNCTION_ID = "deduplication";

    @Override
    public void initialize(OperatorContext context) {
        // 无参数
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream input = context.getInputStream();
        ObservationStream output = input.emptyCopy();
        Set<Map.Entry<String, LocalDateTime>> seen = new HashSet<>();

        for (Observation obs : input.getObservations()) {
            if (seen.add(new AbstractMap.SimpleImmutableEntry<>(obs.getEntityId(), obs.getTimestamp()))) {
                output.add(obs);
            }
        }

        int removed = input.size() - output.size();
        if (removed > 0) {
            log.warn("Source '{}': {} duplicate (entity, timestamp) rows removed", input.getSourceName(), removed);
            context.recordQuality("deduplication.removed", removed);
        }
        context.setOutputStream(output);
    }

    @Override
    public void cleanup() {
        // 无需清理
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "按(资产, 时间)去除重复记录，首条优先");
    }
}
