package com.windfarm.conformance.model;

import com.windfarm.conformance.contract.MetadataContract;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一致化数据集：流水线的最终产物，供下游各分析模块只读共享。
 *
 * 所有数据流均已冻结；需要修改数据的分析须先对相应数据流调用
 * {@link ObservationStream#copy()}。
 */
public final class ConformedDataset implements Serializable {
    private final AssetTable assetTable;
    /** 数据源名称 -> 数据流，保持契约声明顺序 */
    private final Map<String, ObservationStream> streams;
    private final MetadataContract contract;
    private final QualityReport qualityReport;

    public ConformedDataset(AssetTable assetTable, Map<String, ObservationStream> streams,
                            MetadataContract contract, QualityReport qualityReport) {
        this.assetTable = assetTable;
        Map<String, ObservationStream> copy = new LinkedHashMap<>();
        streams.forEach((name, stream) -> copy.put(name, stream.freeze()));
        this.streams = Collections.unmodifiableMap(copy);
        this.contract = contract;
        this.qualityReport = qualityReport.freeze();
    }

    public AssetTable getAssetTable() { return assetTable; }
    public MetadataContract getContract() { return contract; }
    public QualityReport getQualityReport() { return qualityReport; }
    public Map<String, ObservationStream> getStreams() { return streams; }

    public ObservationStream getStream(String sourceName) {
        return streams.get(sourceName);
    }

    /** 第一个SCADA数据流，按(风机, 时间)索引 */
    public ObservationStream getScada() {
        return firstOfType(SourceType.SCADA);
    }

    public ObservationStream getMeter() {
        return firstOfType(SourceType.METER);
    }

    public ObservationStream getCurtailment() {
        return firstOfType(SourceType.CURTAILMENT);
    }

    /** 再分析产品名 -> 规则化后的数据流 */
    public Map<String, ObservationStream> getReanalysis() {
        return ofType(SourceType.REANALYSIS);
    }

    public Map<String, ObservationStream> ofType(SourceType type) {
        Map<String, ObservationStream> result = new LinkedHashMap<>();
        streams.forEach((name, stream) -> {
            if (stream.getSourceType() == type) {
                result.put(name, stream);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private ObservationStream firstOfType(SourceType type) {
        for (ObservationStream stream : streams.values()) {
            if (stream.getSourceType() == type) {
                return stream;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "ConformedDataset{assets=" + assetTable.size() + ", streams=" + streams.values() + "}";
    }
}
