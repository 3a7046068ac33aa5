package com.windfarm.conformance.operators;

import com.windfarm.conformance.contract.SamplingPeriods;
import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import com.windfarm.conformance.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * 电量积分算子。
 * 按采样周期把平均功率折算为周期电量：
 * energy = power × powerUnitWatts × 周期小时数 / energyUnitWattHours。
 * 功率为空时电量为空。
 *
 * 参数：
 * - powerField: 功率字段 (STRING, 默认 WTUR_W)
 * - energyField: 电量字段 (STRING, 默认 WTUR_SupWh)
 * - powerUnitWatts: 功率单位对应的瓦数 (NUMBER, 默认1000，即kW)
 * - energyUnitWattHours: 电量单位对应的瓦时数 (NUMBER, 默认1000，即kWh)
 */
public class EnergyIntegrationOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(EnergyIntegrationOperator.class);

    public static final String FUNCTION_ID = "energy_integration";

    private String powerField;
    private String energyField;
    private double powerUnitWatts;
    private double energyUnitWattHours;

    @Override
    public void initialize(OperatorContext context) {
        this.powerField = context.getParameter("powerField", "WTUR_W");
        this.energyField = context.getParameter("energyField", "WTUR_SupWh");
        this.powerUnitWatts = context.getParameter("powerUnitWatts", 1000.0);
        this.energyUnitWattHours = context.getParameter("energyUnitWattHours", 1000.0);
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream stream = context.getInputStream();
        int powerColumn = stream.columnIndex(powerField);
        if (powerColumn < 0) {
            log.warn("Source '{}': power field '{}' not present, energy not integrated",
                    stream.getSourceName(), powerField);
            context.setOutputStream(stream);
            return;
        }

        double hours = SamplingPeriods.hours(stream.getSamplingPeriod());
        int energyColumn = stream.addColumn(energyField);
        long computed = 0;

        for (int row = 0; row < stream.size(); row++) {
            Double energy = toEnergy(stream.get(row).getValue(powerColumn), hours, powerUnitWatts, energyUnitWattHours);
            stream.setValue(row, energyColumn, energy);
            if (energy != null) {
                computed++;
            }
        }

        log.debug("Source '{}': {} -> {} over {}h periods, {} values",
                stream.getSourceName(), powerField, energyField, hours, computed);
        context.recordQuality("energy_integration.computed", computed);
        context.setOutputStream(stream);
    }

    public static Double toEnergy(Double power, double hours, double powerUnitWatts, double energyUnitWattHours) {
        if (power == null) {
            return null;
        }
        return power * powerUnitWatts * hours / energyUnitWattHours;
    }

    @Override
    public void cleanup() {
        this.powerField = null;
        this.energyField = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "按采样周期将平均功率折算为周期电量")
                .appliesTo(SourceType.SCADA)
                .withParameters(
                        ParameterDefinition.of("powerField", Type.STRING, false, "功率字段").withDefault("WTUR_W"),
                        ParameterDefinition.of("energyField", Type.STRING, false, "电量字段").withDefault("WTUR_SupWh"),
                        ParameterDefinition.of("powerUnitWatts", Type.NUMBER, false, "功率单位对应的瓦数")
                                .withDefault(1000.0).withMin(Double.MIN_VALUE),
                        ParameterDefinition.of("energyUnitWattHours", Type.NUMBER, false, "电量单位对应的瓦时数")
                                .withDefault(1000.0).withMin(Double.MIN_VALUE));
    }
}
