package com.windfarm.conformance;

import com.windfarm.conformance.alignment.ColumnCollisionPolicy;
import com.windfarm.conformance.contract.AnalysisType;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.operators.RangeFilterOperator.RangeRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数，每一项都有默认值。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DEFAULT_CONTRACT_RESOURCE = "plant-meta.properties";

    // ---- 数据 ----
    private String dataRoot = "data/la_haute_borne";
    private boolean archiveExtract = true;
    /** 为空时使用类路径中的默认契约 */
    private String metaContractPath = "";
    private List<AnalysisType> analysisTypes = List.of(AnalysisType.MONTE_CARLO_AEP);

    // ---- 范围过滤 ----
    private Map<String, RangeRule> rangeRules = defaultRangeRules();
    private String entityIdPattern = "";

    // ---- 卡滞检测 ----
    private List<StuckDetectorSettings> stuckDetectors = defaultStuckDetectors();

    // ---- 角度与电量 ----
    private List<String> angleFields = List.of("WROT_BlPthAngVal");
    private String energyPowerField = "WTUR_W";
    private String energyField = "WTUR_SupWh";
    private double powerUnitWatts = 1000.0;
    private double energyUnitWattHours = 1000.0;

    // ---- 再分析派生特征 ----
    private List<String> derivedFeatures = List.of("direction", "speed", "density");

    // ---- 同名列冲突 ----
    private ColumnCollisionPolicy collisionDefault = ColumnCollisionPolicy.KEEP_FIRST;
    /** "数据源.列名" -> 策略 */
    private Map<String, ColumnCollisionPolicy> collisionPolicies = Collections.emptyMap();

    // ---- 缓存 ----
    private boolean cacheEnabled = true;

    /**
     * 从配置文件加载。文件无法读取时使用默认配置并给出警告；
     * 文件中的取值不合法时抛出 {@link PipelineConfigurationException}。
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(Path.of(configPath), StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.toString());
            return new AppConfig();
        }
        log.info("Loaded configuration from {}", configPath);
        return fromProperties(props);
    }

    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        List<String> errors = new ArrayList<>();

        config.dataRoot = props.getProperty("data.root", config.dataRoot).trim();
        config.archiveExtract = Boolean.parseBoolean(props.getProperty("data.archive.extract", "true").trim());
        config.metaContractPath = props.getProperty("meta.contract.path", "").trim();
        config.entityIdPattern = props.getProperty("entity.id.pattern", "").trim();
        config.cacheEnabled = Boolean.parseBoolean(props.getProperty("cache.enabled", "true").trim());

        String analyses = props.getProperty("dataset.analysis.types");
        if (analyses != null) {
            List<AnalysisType> types = new ArrayList<>();
            for (String name : splitList(analyses)) {
                try {
                    types.add(AnalysisType.fromName(name));
                } catch (IllegalArgumentException e) {
                    errors.add(e.getMessage());
                }
            }
            config.analysisTypes = List.copyOf(types);
        }

        config.rangeRules = parseRangeRules(props, errors);
        config.stuckDetectors = parseStuckDetectors(props, errors);

        if (props.getProperty("angle.fields") != null) {
            config.angleFields = splitList(props.getProperty("angle.fields"));
        }
        config.energyPowerField = props.getProperty("energy.power.field", config.energyPowerField).trim();
        config.energyField = props.getProperty("energy.field", config.energyField).trim();
        config.powerUnitWatts = parsePositive(props, "energy.power.unit.watts", config.powerUnitWatts, errors);
        config.energyUnitWattHours = parsePositive(props, "energy.unit.watthours", config.energyUnitWattHours, errors);
        if (props.getProperty("derived.features") != null) {
            config.derivedFeatures = splitList(props.getProperty("derived.features"));
        }

        try {
            config.collisionDefault = ColumnCollisionPolicy.parse(props.getProperty("collision.default", "KEEP_FIRST"));
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        Map<String, ColumnCollisionPolicy> policies = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (key.startsWith("collision.") && !"collision.default".equals(key)) {
                try {
                    policies.put(key.substring("collision.".length()), ColumnCollisionPolicy.parse(props.getProperty(key)));
                } catch (IllegalArgumentException e) {
                    errors.add(key + ": " + e.getMessage());
                }
            }
        }
        config.collisionPolicies = Collections.unmodifiableMap(policies);

        if (!errors.isEmpty()) {
            throw new PipelineConfigurationException("configuration", errors);
        }
        return config;
    }

    // ==================== 解析辅助 ====================

    private static Map<String, RangeRule> defaultRangeRules() {
        Map<String, RangeRule> rules = new LinkedHashMap<>();
        rules.put("WMET_EnvTmp", new RangeRule("WMET_EnvTmp", -15.0, 45.0, null));
        return Collections.unmodifiableMap(rules);
    }

    private static List<StuckDetectorSettings> defaultStuckDetectors() {
        return List.of(
                new StuckDetectorSettings("reference", "WMET_HorWdDirRel", 3,
                        List.of("WROT_BlPthAngVal", "WTUR_W", "WMET_HorWdSpd", "WMET_HorWdDirRel",
                                "WMET_EnvTmp", "WYAW_YwAng", "WMET_HorWdDir")),
                new StuckDetectorSettings("temperature", "WMET_EnvTmp", 20, List.of("WMET_EnvTmp")));
    }

    /** range.&lt;field&gt;.min|max|policy，配置中出现的字段覆盖同名默认规则 */
    private static Map<String, RangeRule> parseRangeRules(Properties props, List<String> errors) {
        Map<String, RangeRule> rules = new LinkedHashMap<>(defaultRangeRules());
        TreeSet<String> fields = new TreeSet<>();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith("range.")) {
                int dot = key.lastIndexOf('.');
                if (dot > "range.".length()) {
                    fields.add(key.substring("range.".length(), dot));
                }
            }
        }
        for (String field : fields) {
            String prefix = "range." + field + ".";
            String text = field + ":" + props.getProperty(prefix + "min", "").trim()
                    + ":" + props.getProperty(prefix + "max", "").trim()
                    + ":" + props.getProperty(prefix + "policy", "").trim();
            try {
                rules.put(field, RangeRule.parse(text));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        return Collections.unmodifiableMap(rules);
    }

    /** stuck.detectors 列出检测器名称，stuck.&lt;name&gt;.signal|window|group 描述每个检测器 */
    private static List<StuckDetectorSettings> parseStuckDetectors(Properties props, List<String> errors) {
        String names = props.getProperty("stuck.detectors");
        Map<String, StuckDetectorSettings> defaults = new LinkedHashMap<>();
        for (StuckDetectorSettings settings : defaultStuckDetectors()) {
            defaults.put(settings.getName(), settings);
        }
        List<String> selected = names != null ? splitList(names) : new ArrayList<>(defaults.keySet());

        List<StuckDetectorSettings> detectors = new ArrayList<>();
        for (String name : selected) {
            StuckDetectorSettings base = defaults.get(name);
            String prefix = "stuck." + name + ".";
            String signal = props.getProperty(prefix + "signal", base != null ? base.getSignal() : "").trim();
            if (signal.isEmpty()) {
                errors.add("Stuck detector '" + name + "' has no signal (" + prefix + "signal)");
                continue;
            }
            int window;
            try {
                window = Integer.parseInt(props.getProperty(prefix + "window",
                        String.valueOf(base != null ? base.getWindow() : 3)).trim());
            } catch (NumberFormatException e) {
                errors.add("Invalid " + prefix + "window: " + e.getMessage());
                continue;
            }
            if (window < 2) {
                errors.add("Stuck detector '" + name + "' window must be at least 2, got " + window);
                continue;
            }
            String groupText = props.getProperty(prefix + "group");
            List<String> group = groupText != null ? splitList(groupText)
                    : (base != null ? base.getGroup() : List.of(signal));
            detectors.add(new StuckDetectorSettings(name, signal, window, group));
        }
        return List.copyOf(detectors);
    }

    private static double parsePositive(Properties props, String key, double defaultValue, List<String> errors) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (!(parsed > 0) || Double.isInfinite(parsed)) {
                errors.add(key + " must be a positive number, got " + value);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            errors.add("Invalid " + key + ": " + value);
            return defaultValue;
        }
    }

    static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    /**
     * 生效配置的规范化属性表，作为数据集指纹的一部分
     */
    public Properties toProperties() {
        Properties props = new Properties();
        props.setProperty("data.root", dataRoot);
        props.setProperty("meta.contract.path", metaContractPath);
        List<String> analysisNames = new ArrayList<>();
        for (AnalysisType type : analysisTypes) {
            analysisNames.add(type.getAnalysisName());
        }
        props.setProperty("dataset.analysis.types", String.join(",", analysisNames));
        rangeRules.forEach((field, rule) -> props.setProperty("range." + field, rule.toString()));
        props.setProperty("entity.id.pattern", entityIdPattern);
        for (StuckDetectorSettings detector : stuckDetectors) {
            props.setProperty("stuck." + detector.getName(), detector.toString());
        }
        props.setProperty("angle.fields", String.join(",", angleFields));
        props.setProperty("energy.power.field", energyPowerField);
        props.setProperty("energy.field", energyField);
        props.setProperty("energy.power.unit.watts", String.valueOf(powerUnitWatts));
        props.setProperty("energy.unit.watthours", String.valueOf(energyUnitWattHours));
        props.setProperty("derived.features", String.join(",", derivedFeatures));
        props.setProperty("collision.default", collisionDefault.toString());
        collisionPolicies.forEach((key, policy) -> props.setProperty("collision." + key, policy.toString()));
        return props;
    }

    // ---- Getters ----
    public String getDataRoot() { return dataRoot; }
    public boolean isArchiveExtract() { return archiveExtract; }
    public String getMetaContractPath() { return metaContractPath; }
    public List<AnalysisType> getAnalysisTypes() { return analysisTypes; }
    public Map<String, RangeRule> getRangeRules() { return rangeRules; }
    public String getEntityIdPattern() { return entityIdPattern; }
    public List<StuckDetectorSettings> getStuckDetectors() { return stuckDetectors; }
    public List<String> getAngleFields() { return angleFields; }
    public String getEnergyPowerField() { return energyPowerField; }
    public String getEnergyField() { return energyField; }
    public double getPowerUnitWatts() { return powerUnitWatts; }
    public double getEnergyUnitWattHours() { return energyUnitWattHours; }
    public List<String> getDerivedFeatures() { return derivedFeatures; }
    public ColumnCollisionPolicy getCollisionDefault() { return collisionDefault; }
    public Map<String, ColumnCollisionPolicy> getCollisionPolicies() { return collisionPolicies; }
    public boolean isCacheEnabled() { return cacheEnabled; }

    @Override
    public String toString() {
        return "AppConfig{dataRoot='" + dataRoot + "'"
                + ", contract='" + (metaContractPath.isEmpty() ? "classpath:" + DEFAULT_CONTRACT_RESOURCE : metaContractPath) + "'"
                + ", analyses=" + analysisTypes
                + ", rangeRules=" + rangeRules.values()
                + ", stuckDetectors=" + stuckDetectors
                + ", cache=" + cacheEnabled + "}";
    }

    /**
     * 单个卡滞检测器的配置
     */
    public static final class StuckDetectorSettings {
        private final String name;
        private final String signal;
        private final int window;
        private final List<String> group;

        public StuckDetectorSettings(String name, String signal, int window, List<String> group) {
            this.name = name;
            this.signal = signal;
            this.window = window;
            this.group = List.copyOf(group);
        }

        public String getName() { return name; }
        public String getSignal() { return signal; }
        public int getWindow() { return window; }
        public List<String> getGroup() { return group; }

        @Override
        public String toString() {
            return name + "{" + signal + ", w=" + window + ", group=" + group + "}";
        }
    }
}
