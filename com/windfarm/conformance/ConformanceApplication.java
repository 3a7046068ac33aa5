package com.windfarm.conformance;

import com.windfarm.conformance.contract.MetadataContract;
import com.windfarm.conformance.contract.MetadataContractLoader;
import com.windfarm.conformance.core.FunctionManager;
import com.windfarm.conformance.core.impl.ConformedDatasetCache;
import com.windfarm.conformance.core.impl.DatasetFingerprint;
import com.windfarm.conformance.core.impl.DefaultFunctionManager;
import com.windfarm.conformance.model.ConformedDataset;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.operators.AngleNormalizationOperator;
import com.windfarm.conformance.operators.DeduplicationOperator;
import com.windfarm.conformance.operators.DerivedFeatureOperator;
import com.windfarm.conformance.operators.EnergyIntegrationOperator;
import com.windfarm.conformance.operators.RangeFilterOperator;
import com.windfarm.conformance.operators.StuckSensorOperator;
import com.windfarm.conformance.operators.TimeNormalizationOperator;
import com.windfarm.conformance.source.ArchiveExtractor;
import com.windfarm.conformance.source.DelimitedFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：加载配置与契约、注册算子、解压数据、运行流水线。
 *
 * 用法：java -jar wind-plant-conformance.jar [配置文件路径]
 */
public class ConformanceApplication {

    private static final Logger log = LoggerFactory.getLogger(ConformanceApplication.class);

    private final AppConfig config;
    private final MetadataContract contract;
    private final ConformancePipeline pipeline;
    private final ArchiveExtractor extractor = new ArchiveExtractor();
    /** 由编排层持有；未启用时每次都重新构建 */
    private final ConformedDatasetCache cache;

    public ConformanceApplication(AppConfig config) {
        this.config = config;
        this.contract = loadContract(config);

        DefaultFunctionManager functionManager = new DefaultFunctionManager();
        registerBuiltinOperators(functionManager);

        this.pipeline = new ConformancePipeline(config, contract, functionManager, new DelimitedFileReader());
        this.cache = config.isCacheEnabled() ? new ConformedDatasetCache() : null;
    }

    /**
     * 生成一致化数据集。输入文件与生效配置不变时直接返回缓存结果。
     */
    public ConformedDataset conform() {
        Path dataDir = Path.of(config.getDataRoot());
        // 配置错误在解压和读取之前拦截
        pipeline.checkConfiguration();
        if (config.isArchiveExtract()) {
            extractor.extractIfMissing(dataDir);
        }
        if (cache == null) {
            return pipeline.run(dataDir);
        }

        List<Path> fingerprintFiles = new ArrayList<>(pipeline.inputFiles(dataDir));
        if (!config.getMetaContractPath().isEmpty()) {
            fingerprintFiles.add(Path.of(config.getMetaContractPath()));
        }
        DatasetFingerprint fingerprint = DatasetFingerprint.of(fingerprintFiles, config.toProperties());
        return cache.getOrBuild(fingerprint, () -> pipeline.run(dataDir));
    }

    public ConformedDatasetCache getCache() { return cache; }
    public MetadataContract getContract() { return contract; }

    static MetadataContract loadContract(AppConfig config) {
        if (config.getMetaContractPath().isEmpty()) {
            return MetadataContractLoader.loadResource(AppConfig.DEFAULT_CONTRACT_RESOURCE);
        }
        return MetadataContractLoader.load(Path.of(config.getMetaContractPath()));
    }

    /**
     * 注册系统预置的七类算子
     */
    static void registerBuiltinOperators(FunctionManager functionManager) {
        functionManager.registerFunction(new TimeNormalizationOperator());
        functionManager.registerFunction(new DeduplicationOperator());
        functionManager.registerFunction(new RangeFilterOperator());
        functionManager.registerFunction(new StuckSensorOperator());
        functionManager.registerFunction(new AngleNormalizationOperator());
        functionManager.registerFunction(new EnergyIntegrationOperator());
        functionManager.registerFunction(new DerivedFeatureOperator());

        log.info("Registered built-in operators: {}", functionManager.getFunctionIds());
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/conformance.properties";

        log.info("=== Wind Plant Data Conformance Pipeline ===");
        AppConfig config = AppConfig.load(configPath);
        log.info("Starting with config: {}", config);

        ConformedDataset dataset = new ConformanceApplication(config).conform();

        log.info("Assets: {}", dataset.getAssetTable().getAssetIds());
        for (ObservationStream stream : dataset.getStreams().values()) {
            log.info("  {}", stream);
        }
        log.info("=== Conformed dataset ready ===");
    }
}
