package com.windfarm.conformance.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 数据质量报告：按数据源、按指标记录各阶段置空、删除、插入的数量。
 * 指标名约定为 "阶段.动作"，如 deduplication.removed。
 */
public class QualityReport implements Serializable {
    private final Map<String, Map<String, Long>> counters = new LinkedHashMap<>();
    private boolean frozen;

    public void increment(String sourceName, String metric, long delta) {
        if (frozen) {
            throw new IllegalStateException("Quality report is frozen");
        }
        if (delta == 0) {
            return;
        }
        counters.computeIfAbsent(sourceName, k -> new LinkedHashMap<>())
                .merge(metric, delta, Long::sum);
    }

    public long get(String sourceName, String metric) {
        Map<String, Long> metrics = counters.get(sourceName);
        if (metrics == null) {
            return 0L;
        }
        return metrics.getOrDefault(metric, 0L);
    }

    public Map<String, Long> getMetrics(String sourceName) {
        Map<String, Long> metrics = counters.get(sourceName);
        return metrics != null ? Collections.unmodifiableMap(metrics) : Collections.emptyMap();
    }

    public Set<String> getSources() {
        return Collections.unmodifiableSet(counters.keySet());
    }

    public QualityReport freeze() {
        this.frozen = true;
        return this;
    }

    @Override
    public String toString() {
        return "QualityReport" + counters;
    }
}
