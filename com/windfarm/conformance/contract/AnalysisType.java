package com.windfarm.conformance.contract;

import com.windfarm.conformance.model.SourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 下游分析类型及其对一致化数据集的字段需求。
 * 分析算法本身不在本模块范围内，这里只声明它们读取哪些规范字段。
 */
public enum AnalysisType {

    MONTE_CARLO_AEP("MonteCarloAEP",
            Map.of(SourceType.METER, List.of("MMTR_SupWh"),
                    SourceType.CURTAILMENT, List.of("IAVL_DnWh", "IAVL_ExtPwrDnWh"),
                    SourceType.REANALYSIS, List.of("WMETR_HorWdSpd", "WMETR_AirDen")),
            List.of()),

    TURBINE_LONG_TERM_GROSS_ENERGY("TurbineLongTermGrossEnergy",
            Map.of(SourceType.SCADA, List.of("WTUR_W", "WMET_HorWdSpd"),
                    SourceType.REANALYSIS, List.of("WMETR_HorWdSpd", "WMETR_HorWdDir", "WMETR_AirDen")),
            List.of()),

    ELECTRICAL_LOSSES("ElectricalLosses",
            Map.of(SourceType.SCADA, List.of("WTUR_SupWh"),
                    SourceType.METER, List.of("MMTR_SupWh")),
            List.of()),

    EYA_GAP_ANALYSIS("EYAGapAnalysis", Map.of(), List.of()),

    WAKE_LOSSES("WakeLosses",
            Map.of(SourceType.SCADA, List.of("WTUR_W", "WMET_HorWdSpd", "WMET_HorWdDir"),
                    SourceType.REANALYSIS, List.of("WMETR_HorWdSpd", "WMETR_HorWdDir")),
            List.of("latitude", "longitude", "rated_power")),

    STATIC_YAW_MISALIGNMENT("StaticYawMisalignment",
            Map.of(SourceType.SCADA, List.of("WTUR_W", "WMET_HorWdSpd", "WROT_BlPthAngVal", "WMET_HorWdDirRel")),
            List.of());

    private final String analysisName;
    private final Map<SourceType, List<String>> requiredFields;
    private final List<String> requiredAssetAttributes;

    AnalysisType(String analysisName, Map<SourceType, List<String>> requiredFields,
                 List<String> requiredAssetAttributes) {
        this.analysisName = analysisName;
        this.requiredFields = requiredFields.isEmpty()
                ? Collections.emptyMap() : new EnumMap<>(requiredFields);
        this.requiredAssetAttributes = requiredAssetAttributes;
    }

    public String getAnalysisName() { return analysisName; }
    public List<String> getRequiredAssetAttributes() { return requiredAssetAttributes; }

    public List<String> requiredFields(SourceType type) {
        return requiredFields.getOrDefault(type, Collections.emptyList());
    }

    /** 按分析名（如 MonteCarloAEP）或枚举名解析 */
    public static AnalysisType fromName(String name) {
        String trimmed = name.trim();
        for (AnalysisType type : values()) {
            if (type.analysisName.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown analysis type: " + name);
    }
}
