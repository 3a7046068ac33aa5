package com.windfarm.conformance.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 观测数据流：单个数据源的有序观测记录集合。
 *
 * 列名按顺序保存，合并来源时允许暂时出现同名列，由跨源对齐阶段按冲突策略消解。
 * 清洗阶段由流水线独占并可原地修改；调用 {@link #freeze()} 后数据流只读，
 * 任何写操作都会抛出 {@link IllegalStateException}。需要私有工作副本的下游分析
 * 应调用 {@link #copy()}。
 */
public class ObservationStream implements Serializable {
    private final String sourceName;
    private final SourceType sourceType;
    /** 声明的采样周期 */
    private final Duration samplingPeriod;
    private final List<String> columns;
    private final List<Observation> observations = new ArrayList<>();
    private boolean frozen;

    /** (资产, 时间) -> 行号，按需构建，写操作后失效 */
    private transient Map<Key, Integer> keyIndex;

    public ObservationStream(String sourceName, SourceType sourceType,
                             Duration samplingPeriod, List<String> columns) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.sourceType = Objects.requireNonNull(sourceType, "sourceType");
        this.samplingPeriod = samplingPeriod;
        this.columns = new ArrayList<>(columns);
    }

    public String getSourceName() { return sourceName; }
    public SourceType getSourceType() { return sourceType; }
    public Duration getSamplingPeriod() { return samplingPeriod; }
    public boolean isEntityKeyed() { return sourceType.isEntityKeyed(); }
    public boolean isFrozen() { return frozen; }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** 返回列名第一次出现的位置，不存在时返回-1 */
    public int columnIndex(String column) {
        return columns.indexOf(column);
    }

    public List<Observation> getObservations() {
        return Collections.unmodifiableList(observations);
    }

    public Observation get(int row) {
        return observations.get(row);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    // ==================== 读取 ====================

    public Double getValue(int row, String column) {
        int idx = requireColumn(column);
        return observations.get(row).getValue(idx);
    }

    /** 按(资产, 时间)定位记录，不存在时返回null */
    public Observation find(String entityId, LocalDateTime timestamp) {
        if (keyIndex == null) {
            Map<Key, Integer> index = new HashMap<>();
            for (int i = 0; i < observations.size(); i++) {
                Observation o = observations.get(i);
                index.putIfAbsent(new Key(o.getEntityId(), o.getTimestamp()), i);
            }
            keyIndex = index;
        }
        Integer row = keyIndex.get(new Key(entityId, timestamp));
        return row != null ? observations.get(row) : null;
    }

    /** 出现过的全部资产标识，保持首次出现顺序 */
    public Set<String> entityIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Observation o : observations) {
            if (o.getEntityId() != null) {
                ids.add(o.getEntityId());
            }
        }
        return ids;
    }

    /** 按资产分组的行号列表，组内保持原顺序；电站级数据源只有一个null分组 */
    public Map<String, List<Integer>> rowsByEntity() {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < observations.size(); i++) {
            groups.computeIfAbsent(observations.get(i).getEntityId(), k -> new ArrayList<>()).add(i);
        }
        return groups;
    }

    // ==================== 写入 ====================

    public void add(Observation observation) {
        checkWritable();
        if (observation.width() != columns.size()) {
            throw new IllegalArgumentException("Observation width " + observation.width()
                    + " does not match " + columns.size() + " columns of source '" + sourceName + "'");
        }
        observations.add(observation);
        keyIndex = null;
    }

    public void setValue(int row, String column, Double value) {
        setValue(row, requireColumn(column), value);
    }

    public void setValue(int row, int columnIndex, Double value) {
        checkWritable();
        observations.get(row).setValue(columnIndex, value);
    }

    public void setTimestamp(int row, LocalDateTime timestamp) {
        checkWritable();
        observations.get(row).setTimestamp(timestamp);
        keyIndex = null;
    }

    /** 追加一列（全部置空），列已存在时返回原位置 */
    public int addColumn(String column) {
        int existing = columns.indexOf(column);
        if (existing >= 0) {
            return existing;
        }
        checkWritable();
        columns.add(column);
        for (Observation o : observations) {
            o.appendColumn();
        }
        return columns.size() - 1;
    }

    public void removeColumnAt(int columnIndex) {
        checkWritable();
        columns.remove(columnIndex);
        for (Observation o : observations) {
            o.removeColumn(columnIndex);
        }
    }

    public void renameColumnAt(int columnIndex, String newName) {
        checkWritable();
        columns.set(columnIndex, newName);
    }

    // ==================== 复制与冻结 ====================

    /** 相同结构、不含记录的新数据流 */
    public ObservationStream emptyCopy() {
        return new ObservationStream(sourceName, sourceType, samplingPeriod, columns);
    }

    /** 可写的工作副本，记录逐条复制 */
    public ObservationStream copy() {
        ObservationStream copy = emptyCopy();
        for (Observation o : observations) {
            copy.observations.add(o.copy());
        }
        return copy;
    }

    public ObservationStream freeze() {
        this.frozen = true;
        return this;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Stream '" + sourceName + "' is frozen and cannot be modified");
        }
    }

    private int requireColumn(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Column '" + column + "' not found in source '" + sourceName + "'");
        }
        return idx;
    }

    @Override
    public String toString() {
        return "ObservationStream{source='" + sourceName + "', type=" + sourceType
                + ", period=" + samplingPeriod + ", columns=" + columns
                + ", rows=" + observations.size() + (frozen ? ", frozen" : "") + "}";
    }

    private static final class Key {
        private final String entityId;
        private final LocalDateTime timestamp;

        Key(String entityId, LocalDateTime timestamp) {
            this.entityId = entityId;
            this.timestamp = timestamp;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key other = (Key) o;
            return Objects.equals(entityId, other.entityId) && Objects.equals(timestamp, other.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(entityId, timestamp);
        }
    }
}
