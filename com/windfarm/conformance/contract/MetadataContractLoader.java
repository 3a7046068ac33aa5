package com.windfarm.conformance.contract;

import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.exception.SourceReadException;
import com.windfarm.conformance.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 元数据契约加载器。
 *
 * 契约文件为properties格式，示例：
 * <pre>
 * sources=scada,meter
 * source.scada.type=SCADA
 * source.scada.file=scada.csv
 * source.scada.time=Date_time
 * source.scada.entity=Wind_turbine_name
 * source.scada.frequency=10min
 * source.scada.fields=WTUR_W,WMET_EnvTmp
 * source.scada.field.WTUR_W.column=P_avg
 * source.scada.field.WTUR_W.unit=kW
 * source.scada.field.WTUR_W.required=true
 * source.scada.field.WMET_EnvTmp.policy=NULL_CELL
 * asset.file=assets.csv
 * asset.id=Wind_turbine_name
 * asset.attribute.latitude=Latitude
 * asset.type.default=turbine
 * </pre>
 */
public final class MetadataContractLoader {

    private static final Logger log = LoggerFactory.getLogger(MetadataContractLoader.class);

    private static final String[] ASSET_ATTRIBUTES = {
            "type", "latitude", "longitude", "rated_power", "hub_height", "rotor_diameter", "elevation"
    };

    private MetadataContractLoader() {}

    public static MetadataContract load(Path path) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new SourceReadException(path, "Failed to read metadata contract", e);
        }
        log.info("Loading metadata contract from {}", path);
        return fromProperties(props);
    }

    /** 从类路径加载，用于内置的默认契约 */
    public static MetadataContract loadResource(String resource) {
        Properties props = new Properties();
        try (InputStream in = MetadataContractLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new PipelineConfigurationException("Metadata contract resource not found: " + resource);
            }
            props.load(in);
        } catch (IOException e) {
            throw new SourceReadException(Path.of(resource), "Failed to read metadata contract resource", e);
        }
        return fromProperties(props);
    }

    public static MetadataContract fromProperties(Properties props) {
        List<String> errors = new ArrayList<>();
        List<SourceSchema> sources = new ArrayList<>();

        for (String sourceName : splitList(props.getProperty("sources"))) {
            try {
                sources.add(parseSource(props, sourceName));
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (sources.isEmpty() && errors.isEmpty()) {
            errors.add("No sources declared (key 'sources')");
        }

        AssetSchema assetSchema = null;
        try {
            assetSchema = parseAsset(props);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new PipelineConfigurationException("metadata-contract", errors);
        }

        MetadataContract contract = new MetadataContract(sources, assetSchema);
        log.info("Metadata contract loaded: {} sources {}", sources.size(), contract.getSources().keySet());
        return contract;
    }

    private static SourceSchema parseSource(Properties props, String name) {
        String prefix = "source." + name + ".";
        String typeText = require(props, prefix + "type");
        SourceType type;
        try {
            type = SourceType.valueOf(typeText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown type '" + typeText + "' for source '" + name + "'");
        }

        String file = require(props, prefix + "file");
        String time = require(props, prefix + "time");
        String entity = props.getProperty(prefix + "entity");
        if (type.isEntityKeyed() && (entity == null || entity.isBlank())) {
            throw new IllegalArgumentException("Source '" + name + "' of type " + type
                    + " requires an entity column (" + prefix + "entity)");
        }

        Duration period = SamplingPeriods.parse(require(props, prefix + "frequency"));
        ZoneOffset offset;
        try {
            offset = ZoneOffset.of(props.getProperty(prefix + "utc.offset", "Z").trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid UTC offset for source '" + name + "': " + e.getMessage());
        }
        String height = props.getProperty(prefix + "reference.height");
        Double referenceHeight = (height != null && !height.isBlank()) ? Double.valueOf(height.trim()) : null;

        List<FieldSpec> fields = new ArrayList<>();
        for (String field : splitList(props.getProperty(prefix + "fields"))) {
            String fieldPrefix = prefix + "field." + field + ".";
            String column = props.getProperty(fieldPrefix + "column");
            String unit = props.getProperty(fieldPrefix + "unit");
            boolean required = Boolean.parseBoolean(props.getProperty(fieldPrefix + "required", "false"));
            String policyText = props.getProperty(fieldPrefix + "policy", InvalidValuePolicy.NULL_CELL.name());
            InvalidValuePolicy policy;
            try {
                policy = InvalidValuePolicy.valueOf(policyText.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown policy '" + policyText + "' for " + fieldPrefix + "policy");
            }
            fields.add(new FieldSpec(field, blankToNull(column), blankToNull(unit), required, policy));
        }

        return new SourceSchema(name, type, file, delimiter(props.getProperty(prefix + "delimiter")),
                time, blankToNull(entity), period, offset, referenceHeight, fields);
    }

    private static AssetSchema parseAsset(Properties props) {
        String file = props.getProperty("asset.file");
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("Missing asset table declaration (asset.file)");
        }
        String idColumn = require(props, "asset.id");
        Map<String, String> attributes = new LinkedHashMap<>();
        for (String attribute : ASSET_ATTRIBUTES) {
            String column = props.getProperty("asset.attribute." + attribute);
            if (column != null && !column.isBlank()) {
                attributes.put(attribute, column.trim());
            }
        }
        return new AssetSchema(file.trim(), delimiter(props.getProperty("asset.delimiter")), idColumn,
                attributes, blankToNull(props.getProperty("asset.type.default")));
    }

    private static String require(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required contract key '" + key + "'");
        }
        return value.trim();
    }

    private static char delimiter(String value) {
        if (value == null || value.isEmpty()) {
            return ',';
        }
        if ("\\t".equals(value) || "tab".equalsIgnoreCase(value)) {
            return '\t';
        }
        return value.charAt(0);
    }

    static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                result.add(part.trim());
            }
        }
        return result;
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
