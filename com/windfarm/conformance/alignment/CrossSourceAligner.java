package com.windfarm.conformance.alignment;

import com.windfarm.conformance.exception.UnalignableSourceException;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 跨源对齐器。
 *
 * 每个数据源按其声明的采样周期重建严格规则的时间轴：
 * 1. 按策略表消解同名列
 * 2. 校验每个资产的时间戳在流内严格递增，否则抛出 {@link UnalignableSourceException}
 * 3. 以数据源的最早时间戳为锚点、按周期展开时间轴，覆盖首末时间，同一数据源的所有资产共用同一时间轴
 * 4. 缺失的时间槽补为全空行
 *
 * 不落在时间轴上的样本无法对齐，抛出 {@link UnalignableSourceException}。
 * 不做重采样和插值，不产生任何推测值。
 */
public class CrossSourceAligner {

    private static final Logger log = LoggerFactory.getLogger(CrossSourceAligner.class);

    private final ColumnCollisionResolver collisionResolver;

    public CrossSourceAligner(ColumnCollisionResolver collisionResolver) {
        this.collisionResolver = collisionResolver;
    }

    /**
     * 对齐全部数据源。
     *
     * @param streams 数据源名称 -> 清洗后的数据流
     * @param report  质量报告
     * @return 数据源名称 -> 规则化后的数据流，保持输入顺序
     */
    public Map<String, ObservationStream> align(Map<String, ObservationStream> streams, QualityReport report) {
        Map<String, ObservationStream> aligned = new LinkedHashMap<>();
        for (Map.Entry<String, ObservationStream> entry : streams.entrySet()) {
            aligned.put(entry.getKey(), alignSource(entry.getValue(), report));
        }
        return aligned;
    }

    public ObservationStream alignSource(ObservationStream stream, QualityReport report) {
        String source = stream.getSourceName();
        collisionResolver.resolve(stream, report);
        checkMonotonic(stream);

        ObservationStream output = stream.emptyCopy();
        if (stream.isEmpty()) {
            log.warn("Source '{}' is empty, nothing to align", source);
            return output;
        }

        long period = stream.getSamplingPeriod().getSeconds();
        long gridStart = Long.MAX_VALUE;
        long gridEnd = Long.MIN_VALUE;
        for (Observation obs : stream.getObservations()) {
            long epoch = obs.getTimestamp().toEpochSecond(ZoneOffset.UTC);
            gridStart = Math.min(gridStart, epoch);
            gridEnd = Math.max(gridEnd, epoch);
        }

        Map<String, Map<LocalDateTime, Observation>> onGridByEntity = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> group : stream.rowsByEntity().entrySet()) {
            Map<LocalDateTime, Observation> onGrid = new HashMap<>();
            for (int row : group.getValue()) {
                Observation obs = stream.get(row);
                if (!isOnGrid(obs.getTimestamp(), gridStart, period)) {
                    LocalDateTime anchor = LocalDateTime.ofEpochSecond(gridStart, 0, ZoneOffset.UTC);
                    log.error("Source '{}' entity '{}': timestamp {} is off the {} grid anchored at {}",
                            source, obs.getEntityId(), obs.getTimestamp(), stream.getSamplingPeriod(), anchor);
                    throw UnalignableSourceException.offGrid(source, obs.getEntityId(), anchor,
                            obs.getTimestamp(), stream.getSamplingPeriod());
                }
                onGrid.put(obs.getTimestamp(), obs);
            }
            onGridByEntity.put(group.getKey(), onGrid);
        }

        long inserted = 0;
        int width = stream.getColumns().size();
        for (Map.Entry<String, Map<LocalDateTime, Observation>> group : onGridByEntity.entrySet()) {
            for (long slot = gridStart; slot <= gridEnd; slot += period) {
                LocalDateTime timestamp = LocalDateTime.ofEpochSecond(slot, 0, ZoneOffset.UTC);
                Observation obs = group.getValue().get(timestamp);
                if (obs == null) {
                    obs = new Observation(null, timestamp, group.getKey(), new Double[width]);
                    inserted++;
                }
                output.add(obs);
            }
        }

        log.info("Source '{}' aligned to {} grid: {} slots x {} entities, {} gap rows inserted",
                source, stream.getSamplingPeriod(), (gridEnd - gridStart) / period + 1,
                onGridByEntity.size(), inserted);
        report.increment(source, "alignment.gapRowsInserted", inserted);
        return output;
    }

    /** 每个资产的时间戳在流内必须严格递增 */
    static void checkMonotonic(ObservationStream stream) {
        Map<String, LocalDateTime> lastSeen = new HashMap<>();
        for (Observation obs : stream.getObservations()) {
            LocalDateTime previous = lastSeen.get(obs.getEntityId());
            if (previous != null && !obs.getTimestamp().isAfter(previous)) {
                log.error("Source '{}' entity '{}': timestamp {} does not follow {}",
                        stream.getSourceName(), obs.getEntityId(), obs.getTimestamp(), previous);
                throw new UnalignableSourceException(stream.getSourceName(), obs.getEntityId(),
                        previous, obs.getTimestamp());
            }
            lastSeen.put(obs.getEntityId(), obs.getTimestamp());
        }
    }

    static boolean isOnGrid(LocalDateTime timestamp, long anchorEpochSecond, long periodSeconds) {
        return timestamp.getNano() == 0
                && Math.floorMod(timestamp.toEpochSecond(ZoneOffset.UTC) - anchorEpochSecond, periodSeconds) == 0;
    }

    /** 对齐后的时间轴是否严格规则：同一资产相邻时间戳之差恒等于周期 */
    public static boolean isRegular(ObservationStream stream, Duration period) {
        Map<String, LocalDateTime> lastSeen = new HashMap<>();
        for (Observation obs : stream.getObservations()) {
            LocalDateTime previous = lastSeen.put(obs.getEntityId(), obs.getTimestamp());
            if (previous != null && !Duration.between(previous, obs.getTimestamp()).equals(period)) {
                return false;
            }
        }
        return true;
    }
}
