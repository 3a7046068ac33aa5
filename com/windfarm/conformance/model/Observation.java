package com.windfarm.conformance.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Arrays;

/**
 * 单条观测记录：时间戳 + 资产标识 + 各字段取值。
 *
 * 字段取值按所属 {@link ObservationStream} 的列顺序存放，缺失值为null。
 * 记录本身只对外暴露读方法，所有修改都经由所属数据流完成，
 * 以便数据流冻结后拒绝任何写入。
 */
public class Observation implements Serializable {
    /** 原始时间戳文本，时间归一化之前使用 */
    private final String rawTimestamp;
    /** 归一化后的无时区UTC时间 */
    private LocalDateTime timestamp;
    /** 资产标识；电站级数据源为null */
    private final String entityId;
    private Double[] values;

    public Observation(String rawTimestamp, LocalDateTime timestamp, String entityId, Double[] values) {
        this.rawTimestamp = rawTimestamp;
        this.timestamp = timestamp;
        this.entityId = entityId;
        this.values = Arrays.copyOf(values, values.length);
    }

    public String getRawTimestamp() { return rawTimestamp; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public String getEntityId() { return entityId; }
    public int width() { return values.length; }

    public Double getValue(int columnIndex) {
        return values[columnIndex];
    }

    /** 返回取值数组的副本 */
    public Double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    void setValue(int columnIndex, Double value) {
        values[columnIndex] = value;
    }

    void appendColumn() {
        values = Arrays.copyOf(values, values.length + 1);
    }

    void removeColumn(int columnIndex) {
        Double[] next = new Double[values.length - 1];
        System.arraycopy(values, 0, next, 0, columnIndex);
        System.arraycopy(values, columnIndex + 1, next, columnIndex, values.length - columnIndex - 1);
        values = next;
    }

    Observation copy() {
        return new Observation(rawTimestamp, timestamp, entityId, values);
    }

    @Override
    public String toString() {
        return "Observation{" + (entityId != null ? entityId + "@" : "")
                + (timestamp != null ? timestamp : rawTimestamp)
                + ", values=" + Arrays.toString(values) + "}";
    }
}
