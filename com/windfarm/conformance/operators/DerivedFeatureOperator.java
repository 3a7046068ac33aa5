package com.windfarm.conformance.operators;

import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import com.windfarm.conformance.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 派生特征算子。
 * 对再分析数据逐行计算派生量，结果只写入目标列中为空的单元格：
 * - direction: 由参考高度风速分量u、v计算风向，(180 + atan2(u, v)·180/π) mod 360
 * - speed: 风速 sqrt(u² + v²)
 * - density: 空气密度 p / (R·T)，R = 287.05 J/(kg·K)
 * 输入任一为空时结果为空；输入列不存在时跳过该特征。
 *
 * 参数：
 * - features: 启用的特征 (LIST, 默认 direction,speed,density)
 * - uField / vField / temperatureField / pressureField: 输入字段 (STRING)
 * - directionField / speedField / densityField: 输出字段 (STRING)
 */
public class DerivedFeatureOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(DerivedFeatureOperator.class);

    public static final String FUNCTION_ID = "derived_features";

    /** 干空气比气体常数 J/(kg·K) */
    public static final double DRY_AIR_GAS_CONSTANT = 287.05;

    private static final List<String> FIELD_PARAMETERS = List.of("uField", "vField", "temperatureField",
            "pressureField", "directionField", "speedField", "densityField");

    private List<String> features;
    private String uField;
    private String vField;
    private String temperatureField;
    private String pressureField;
    private String directionField;
    private String speedField;
    private String densityField;

    @Override
    public void initialize(OperatorContext context) {
        this.features = context.getParameter("features",
                new ArrayList<>(List.of("direction", "speed", "density")));
        this.uField = context.getParameter("uField", "WMETR_HorWdSpdU");
        this.vField = context.getParameter("vField", "WMETR_HorWdSpdV");
        this.temperatureField = context.getParameter("temperatureField", "WMETR_EnvTmp");
        this.pressureField = context.getParameter("pressureField", "WMETR_EnvPres");
        this.directionField = context.getParameter("directionField", "WMETR_HorWdDir");
        this.speedField = context.getParameter("speedField", "WMETR_HorWdSpd");
        this.densityField = context.getParameter("densityField", "WMETR_AirDen");
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream stream = context.getInputStream();

        for (String feature : features) {
            switch (feature) {
                case "direction":
                    derive(context, stream, uField, vField, directionField, DerivedFeatureOperator::windDirection);
                    break;
                case "speed":
                    derive(context, stream, uField, vField, speedField, DerivedFeatureOperator::windSpeed);
                    break;
                case "density":
                    derive(context, stream, pressureField, temperatureField, densityField, DerivedFeatureOperator::airDensity);
                    break;
                default:
                    log.warn("Source '{}': unknown derived feature '{}' ignored", stream.getSourceName(), feature);
            }
        }
        context.setOutputStream(stream);
    }

    private void derive(OperatorContext context, ObservationStream stream, String firstField, String secondField,
                        String targetField, Formula formula) {
        int first = stream.columnIndex(firstField);
        int second = stream.columnIndex(secondField);
        if (first < 0 || second < 0) {
            log.debug("Source '{}': inputs {}/{} not present, '{}' not derived",
                    stream.getSourceName(), firstField, secondField, targetField);
            return;
        }

        int target = stream.addColumn(targetField);
        long filled = 0;
        for (int row = 0; row < stream.size(); row++) {
            if (stream.get(row).getValue(target) != null) {
                continue;
            }
            Double a = stream.get(row).getValue(first);
            Double b = stream.get(row).getValue(second);
            if (a == null || b == null) {
                continue;
            }
            Double value = formula.apply(a, b);
            if (value != null) {
                stream.setValue(row, target, value);
                filled++;
            }
        }
        log.debug("Source '{}': derived {} values of '{}'", stream.getSourceName(), filled, targetField);
        context.recordQuality("derived_features." + targetField, filled);
    }

    /** 风向（度，[0, 360)），风的来向 */
    public static Double windDirection(double u, double v) {
        double direction = (180.0 + Math.toDegrees(Math.atan2(u, v))) % 360.0;
        return direction >= 360.0 ? 0.0 : direction;
    }

    public static Double windSpeed(double u, double v) {
        return Math.sqrt(u * u + v * v);
    }

    /** 空气密度（kg/m³），温度非正时无意义 */
    public static Double airDensity(double pressurePa, double temperatureK) {
        if (temperatureK <= 0) {
            return null;
        }
        return pressurePa / (DRY_AIR_GAS_CONSTANT * temperatureK);
    }

    @FunctionalInterface
    private interface Formula {
        Double apply(double a, double b);
    }

    @Override
    public void cleanup() {
        this.features = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        List<ParameterDefinition> defs = new ArrayList<>();
        defs.add(ParameterDefinition.of("features", Type.LIST, false, "启用的派生特征：direction, speed, density"));
        for (String name : FIELD_PARAMETERS) {
            defs.add(ParameterDefinition.of(name, Type.STRING, false, "字段名"));
        }
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "由风速分量、温度和气压计算风向、风速和空气密度")
                .appliesTo(SourceType.REANALYSIS)
                .withParameters(defs);
    }
}
