package com.windfarm.conformance.contract;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 规范字段目录：每个规范字段名（IEC 61400-25风格）对应的期望单位。
 * 契约中声明的单位必须与目录一致，目录未收录的字段不做单位校验。
 */
public final class FieldCatalog {

    private static final Map<String, String> EXPECTED_UNITS = new LinkedHashMap<>();
    private static final Map<String, String> UNIT_ALIASES = new HashMap<>();

    static {
        // SCADA
        EXPECTED_UNITS.put("WTUR_W", "kW");
        EXPECTED_UNITS.put("WTUR_SupWh", "kWh");
        EXPECTED_UNITS.put("WMET_HorWdSpd", "m/s");
        EXPECTED_UNITS.put("WMET_HorWdDir", "deg");
        EXPECTED_UNITS.put("WMET_HorWdDirRel", "deg");
        EXPECTED_UNITS.put("WMET_EnvTmp", "C");
        EXPECTED_UNITS.put("WROT_BlPthAngVal", "deg");
        EXPECTED_UNITS.put("WYAW_YwAng", "deg");
        // 电表与限电
        EXPECTED_UNITS.put("MMTR_SupWh", "kWh");
        EXPECTED_UNITS.put("IAVL_DnWh", "kWh");
        EXPECTED_UNITS.put("IAVL_ExtPwrDnWh", "kWh");
        // 再分析
        EXPECTED_UNITS.put("WMETR_HorWdSpdU", "m/s");
        EXPECTED_UNITS.put("WMETR_HorWdSpdV", "m/s");
        EXPECTED_UNITS.put("WMETR_HorWdSpd", "m/s");
        EXPECTED_UNITS.put("WMETR_HorWdDir", "deg");
        EXPECTED_UNITS.put("WMETR_EnvTmp", "K");
        EXPECTED_UNITS.put("WMETR_EnvPres", "Pa");
        EXPECTED_UNITS.put("WMETR_AirDen", "kg/m^3");

        UNIT_ALIASES.put("degrees", "deg");
        UNIT_ALIASES.put("degree", "deg");
        UNIT_ALIASES.put("°", "deg");
        UNIT_ALIASES.put("degc", "c");
        UNIT_ALIASES.put("°c", "c");
        UNIT_ALIASES.put("celsius", "c");
        UNIT_ALIASES.put("kelvin", "k");
        UNIT_ALIASES.put("m s-1", "m/s");
        UNIT_ALIASES.put("kg/m3", "kg/m^3");
        UNIT_ALIASES.put("kg m-3", "kg/m^3");
    }

    private FieldCatalog() {}

    /** 期望单位，未收录时返回null */
    public static String expectedUnit(String fieldName) {
        return EXPECTED_UNITS.get(fieldName);
    }

    public static Map<String, String> expectedUnits() {
        return Collections.unmodifiableMap(EXPECTED_UNITS);
    }

    /** 单位是否等价（忽略大小写，识别常见别名） */
    public static boolean unitsMatch(String declared, String expected) {
        if (declared == null || expected == null) {
            return declared == null && expected == null;
        }
        return canonicalUnit(declared).equals(canonicalUnit(expected));
    }

    private static String canonicalUnit(String unit) {
        String lower = unit.trim().toLowerCase(Locale.ROOT);
        return UNIT_ALIASES.getOrDefault(lower, lower);
    }
}
