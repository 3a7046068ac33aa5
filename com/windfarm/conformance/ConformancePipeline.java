package com.windfarm.conformance;

import com.windfarm.conformance.alignment.ColumnCollisionResolver;
import com.windfarm.conformance.alignment.CrossSourceAligner;
import com.windfarm.conformance.contract.AssetSchema;
import com.windfarm.conformance.contract.MetadataContract;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.core.FunctionManager;
import com.windfarm.conformance.core.PipelineExecutor;
import com.windfarm.conformance.core.SourceReader;
import com.windfarm.conformance.core.impl.DefaultPipelineExecutor;
import com.windfarm.conformance.exception.SourceReadException;
import com.windfarm.conformance.model.AssetTable;
import com.windfarm.conformance.model.ConformedDataset;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.RawTable;
import com.windfarm.conformance.model.SourcePipelineConfig;
import com.windfarm.conformance.source.AssetTableParser;
import com.windfarm.conformance.source.StreamAssembler;
import com.windfarm.conformance.validation.DatasetConformanceValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 一致化流水线。
 *
 * 单线程同步执行，阶段顺序固定：
 * 校验算子配置 → 读取原始文件 → 组装数据流 → 逐源执行算子管道 → 跨源对齐 → 校验并组装数据集。
 * 流水线本身不保存任何运行状态，同一实例可重复运行。
 */
public class ConformancePipeline {

    private static final Logger log = LoggerFactory.getLogger(ConformancePipeline.class);

    private final AppConfig config;
    private final MetadataContract contract;
    private final SourceReader sourceReader;
    private final PipelineExecutor executor;
    private final Map<String, SourcePipelineConfig> plans = new LinkedHashMap<>();

    private final StreamAssembler assembler = new StreamAssembler();
    private final AssetTableParser assetParser = new AssetTableParser();

    public ConformancePipeline(AppConfig config, MetadataContract contract,
                               FunctionManager functionManager, SourceReader sourceReader) {
        this.config = config;
        this.contract = contract;
        this.sourceReader = sourceReader;
        this.executor = new DefaultPipelineExecutor(functionManager);
        for (SourceSchema schema : contract.getSources().values()) {
            plans.put(schema.getName(), PipelinePlans.planFor(schema, config));
        }
    }

    /**
     * 校验全部数据源的算子管道配置，在读取任何数据之前调用。
     */
    public void checkConfiguration() {
        for (SourceSchema schema : contract.getSources().values()) {
            executor.checkOperatorParameters(plans.get(schema.getName()), schema.getType());
        }
        log.info("Operator pipelines validated for {} sources", plans.size());
    }

    /** 本次运行需要读取的全部文件（去重，契约声明顺序） */
    public List<Path> inputFiles(Path dataDir) {
        Set<Path> files = new LinkedHashSet<>();
        for (String fileName : fileNames()) {
            files.add(dataDir.resolve(fileName));
        }
        return List.copyOf(files);
    }

    public ConformedDataset run(Path dataDir) {
        checkConfiguration();

        // 同一文件只读取一次（电表与限电可共享一个文件）
        Map<String, RawTable> tables = new LinkedHashMap<>();
        for (String fileName : fileNames()) {
            char delimiter = delimiterOf(fileName);
            tables.put(fileName, sourceReader.read(dataDir.resolve(fileName), delimiter));
        }
        return conform(tables);
    }

    /**
     * 在已读入的原始表格上执行流水线。
     *
     * @param tablesByFile 文件名 -> 原始表格
     */
    public ConformedDataset process(Map<String, RawTable> tablesByFile) {
        checkConfiguration();
        return conform(tablesByFile);
    }

    private ConformedDataset conform(Map<String, RawTable> tablesByFile) {
        long start = System.currentTimeMillis();
        QualityReport report = new QualityReport();

        AssetSchema assetSchema = contract.getAssetSchema();
        AssetTable assets = assetParser.parse(assetSchema, requireTable(tablesByFile, assetSchema.getFileName()));

        Map<String, ObservationStream> cleaned = new LinkedHashMap<>();
        for (SourceSchema schema : contract.getSources().values()) {
            RawTable table = requireTable(tablesByFile, schema.getFileName());
            ObservationStream stream = assembler.assemble(schema, table, report);
            cleaned.put(schema.getName(), executor.execute(plans.get(schema.getName()), stream, schema, report));
        }

        CrossSourceAligner aligner = new CrossSourceAligner(
                new ColumnCollisionResolver(config.getCollisionDefault(), config.getCollisionPolicies()));
        Map<String, ObservationStream> aligned = aligner.align(cleaned, report);

        ConformedDataset dataset = new DatasetConformanceValidator(config.getAnalysisTypes())
                .validate(contract, aligned, assets, report);
        log.info("Conformance pipeline finished in {}ms: {}", System.currentTimeMillis() - start, dataset);
        log.info("Quality report: {}", dataset.getQualityReport());
        return dataset;
    }

    public Map<String, SourcePipelineConfig> getPlans() {
        return plans;
    }

    private Set<String> fileNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(contract.getAssetSchema().getFileName());
        for (SourceSchema schema : contract.getSources().values()) {
            names.add(schema.getFileName());
        }
        return names;
    }

    private char delimiterOf(String fileName) {
        AssetSchema assetSchema = contract.getAssetSchema();
        if (assetSchema.getFileName().equals(fileName)) {
            return assetSchema.getDelimiter();
        }
        for (SourceSchema schema : contract.getSources().values()) {
            if (schema.getFileName().equals(fileName)) {
                return schema.getDelimiter();
            }
        }
        return ',';
    }

    private static RawTable requireTable(Map<String, RawTable> tables, String fileName) {
        RawTable table = tables.get(fileName);
        if (table == null) {
            throw new SourceReadException(Path.of(fileName), "No table provided for declared file");
        }
        return table;
    }
}
