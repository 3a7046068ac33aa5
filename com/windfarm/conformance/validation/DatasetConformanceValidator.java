package com.windfarm.conformance.validation;

import com.windfarm.conformance.alignment.CrossSourceAligner;
import com.windfarm.conformance.contract.AnalysisType;
import com.windfarm.conformance.contract.AssetSchema;
import com.windfarm.conformance.contract.FieldCatalog;
import com.windfarm.conformance.contract.FieldSpec;
import com.windfarm.conformance.contract.MetadataContract;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.exception.EntityReconciliationException;
import com.windfarm.conformance.exception.SchemaViolationException;
import com.windfarm.conformance.model.AssetTable;
import com.windfarm.conformance.model.ConformedDataset;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 数据集一致性校验器。
 *
 * 对每个数据源依次校验：
 * 1. 必选字段存在（契约声明 + 已配置分析类型的字段需求）
 * 2. 声明单位与规范字段目录一致
 * 3. 对齐后的采样间隔等于声明周期
 * 然后做资产核对：资产标识唯一，数据流引用的资产都在资产表中。
 * 全部通过后组装并冻结 {@link ConformedDataset}。
 */
public class DatasetConformanceValidator {

    private static final Logger log = LoggerFactory.getLogger(DatasetConformanceValidator.class);

    static final String ASSET_SOURCE = "assets";

    private final Set<AnalysisType> analysisTypes;

    public DatasetConformanceValidator(Collection<AnalysisType> analysisTypes) {
        this.analysisTypes = analysisTypes.isEmpty()
                ? EnumSet.noneOf(AnalysisType.class) : EnumSet.copyOf(analysisTypes);
    }

    public ConformedDataset validate(MetadataContract contract, Map<String, ObservationStream> streams,
                                     AssetTable assets, QualityReport report) {
        for (SourceSchema schema : contract.getSources().values()) {
            ObservationStream stream = streams.get(schema.getName());
            if (stream == null) {
                throw fail(new SchemaViolationException(schema.getName(), schema.getTimeColumn(),
                        "declared source produced no stream"));
            }
            checkRequiredFields(schema, stream);
            checkUnits(schema);
            checkCadence(schema, stream);
        }
        checkAssetAttributes(contract.getAssetSchema());

        Set<String> referenced = reconcileEntities(streams, assets);
        boolean anyEntityKeyed = streams.values().stream().anyMatch(ObservationStream::isEntityKeyed);
        AssetTable entityTable = anyEntityKeyed ? assets.restrictTo(referenced) : assets;

        Map<String, ObservationStream> ordered = new LinkedHashMap<>();
        for (String name : contract.getSources().keySet()) {
            ordered.put(name, streams.get(name));
        }
        ConformedDataset dataset = new ConformedDataset(entityTable, ordered, contract, report);
        log.info("Conformed dataset validated: {} assets, {} streams, analyses {}",
                entityTable.size(), ordered.size(), analysisTypes);
        return dataset;
    }

    private void checkRequiredFields(SourceSchema schema, ObservationStream stream) {
        Set<String> required = new LinkedHashSet<>();
        for (FieldSpec field : schema.getFields()) {
            if (field.isRequired()) {
                required.add(field.getName());
            }
        }
        for (AnalysisType analysis : analysisTypes) {
            required.addAll(analysis.requiredFields(schema.getType()));
        }
        for (String field : required) {
            if (!stream.hasColumn(field)) {
                String origin = schema.declares(field) ? "declared required" : "required by configured analyses";
                throw fail(new SchemaViolationException(schema.getName(), field, "field " + origin + " is missing"));
            }
        }
    }

    private static void checkUnits(SourceSchema schema) {
        for (FieldSpec field : schema.getFields()) {
            String expected = FieldCatalog.expectedUnit(field.getName());
            if (field.getUnit() != null && expected != null && !FieldCatalog.unitsMatch(field.getUnit(), expected)) {
                throw fail(new SchemaViolationException(schema.getName(), field.getName(),
                        "declared unit '" + field.getUnit() + "' does not match expected '" + expected + "'"));
            }
        }
    }

    private static void checkCadence(SourceSchema schema, ObservationStream stream) {
        if (!schema.getSamplingPeriod().equals(stream.getSamplingPeriod())
                || !CrossSourceAligner.isRegular(stream, schema.getSamplingPeriod())) {
            throw fail(new SchemaViolationException(schema.getName(), schema.getTimeColumn(),
                    "sampling cadence differs from declared period " + schema.getSamplingPeriod()));
        }
    }

    private void checkAssetAttributes(AssetSchema assetSchema) {
        for (AnalysisType analysis : analysisTypes) {
            for (String attribute : analysis.getRequiredAssetAttributes()) {
                if (assetSchema == null || !assetSchema.declares(attribute)) {
                    throw fail(new SchemaViolationException(ASSET_SOURCE, attribute,
                            "asset attribute required by " + analysis.getAnalysisName() + " is not declared"));
                }
            }
        }
    }

    /** 返回实体键数据流引用的全部资产标识 */
    private static Set<String> reconcileEntities(Map<String, ObservationStream> streams, AssetTable assets) {
        Set<String> duplicates = assets.findDuplicateIds();
        if (!duplicates.isEmpty()) {
            throw fail(new EntityReconciliationException(ASSET_SOURCE, duplicates.iterator().next(),
                    "asset id declared more than once"));
        }

        Set<String> referenced = new LinkedHashSet<>();
        for (ObservationStream stream : streams.values()) {
            if (!stream.isEntityKeyed()) {
                continue;
            }
            for (String entityId : stream.entityIds()) {
                if (!assets.contains(entityId)) {
                    throw fail(new EntityReconciliationException(stream.getSourceName(), entityId,
                            "referenced entity is not in the asset table"));
                }
                referenced.add(entityId);
            }
        }
        return referenced;
    }

    private static <E extends RuntimeException> E fail(E e) {
        log.error(e.getMessage());
        return e;
    }
}
