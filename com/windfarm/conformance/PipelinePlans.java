package com.windfarm.conformance;

import com.windfarm.conformance.AppConfig.StuckDetectorSettings;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.model.SourcePipelineConfig;
import com.windfarm.conformance.operators.AngleNormalizationOperator;
import com.windfarm.conformance.operators.DeduplicationOperator;
import com.windfarm.conformance.operators.DerivedFeatureOperator;
import com.windfarm.conformance.operators.EnergyIntegrationOperator;
import com.windfarm.conformance.operators.RangeFilterOperator;
import com.windfarm.conformance.operators.RangeFilterOperator.RangeRule;
import com.windfarm.conformance.operators.StuckSensorOperator;
import com.windfarm.conformance.operators.TimeNormalizationOperator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 按数据源类型生成固定的算子管道：
 * <pre>
 * SCADA        时间归一化 → 去重 → 范围过滤 → 卡滞检测(逐个检测器) → 角度归一化 → 电量积分
 * 电表 / 限电   时间归一化 → 去重 → 范围过滤
 * 再分析        时间归一化 → 去重 → 派生特征
 * </pre>
 */
public final class PipelinePlans {

    private PipelinePlans() {}

    public static SourcePipelineConfig planFor(SourceSchema schema, AppConfig config) {
        SourcePipelineConfig plan = new SourcePipelineConfig(schema.getName())
                .then(TimeNormalizationOperator.FUNCTION_ID, Map.of())
                .then(DeduplicationOperator.FUNCTION_ID, Map.of());

        switch (schema.getType()) {
            case SCADA:
                plan.then(RangeFilterOperator.FUNCTION_ID, rangeParams(config));
                for (StuckDetectorSettings detector : config.getStuckDetectors()) {
                    Map<String, Object> params = new LinkedHashMap<>();
                    params.put("signal", detector.getSignal());
                    params.put("window", detector.getWindow());
                    params.put("group", detector.getGroup());
                    plan.then(StuckSensorOperator.FUNCTION_ID, params);
                }
                plan.then(AngleNormalizationOperator.FUNCTION_ID, Map.of("fields", config.getAngleFields()));
                Map<String, Object> energy = new LinkedHashMap<>();
                energy.put("powerField", config.getEnergyPowerField());
                energy.put("energyField", config.getEnergyField());
                energy.put("powerUnitWatts", config.getPowerUnitWatts());
                energy.put("energyUnitWattHours", config.getEnergyUnitWattHours());
                plan.then(EnergyIntegrationOperator.FUNCTION_ID, energy);
                break;

            case METER:
            case CURTAILMENT:
                plan.then(RangeFilterOperator.FUNCTION_ID, rangeParams(config));
                break;

            case REANALYSIS:
                plan.then(DerivedFeatureOperator.FUNCTION_ID, Map.of("features", config.getDerivedFeatures()));
                break;

            default:
                break;
        }
        return plan;
    }

    private static Map<String, Object> rangeParams(AppConfig config) {
        List<String> rules = new ArrayList<>();
        for (RangeRule rule : config.getRangeRules().values()) {
            rules.add(rule.toString());
        }
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("rules", rules);
        if (!config.getEntityIdPattern().isEmpty()) {
            params.put("entityIdPattern", config.getEntityIdPattern());
        }
        return params;
    }
}
