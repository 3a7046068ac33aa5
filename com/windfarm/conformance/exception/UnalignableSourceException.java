package com.windfarm.conformance.exception;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 数据源无法对齐到规则时间轴：去重后时间戳仍非单调递增，或样本不落在按采样周期展开的时间轴上。
 * 后一种情况下 previous 为时间轴锚点。
 */
public class UnalignableSourceException extends ConformanceException {

    private final String entityId;
    private final LocalDateTime previous;
    private final LocalDateTime current;

    public UnalignableSourceException(String sourceName, String entityId,
                                      LocalDateTime previous, LocalDateTime current) {
        this(sourceName, entityId, previous, current, "Source '" + sourceName + "' is not monotonic"
                + forEntity(entityId) + ": " + current + " follows " + previous);
    }

    private UnalignableSourceException(String sourceName, String entityId,
                                       LocalDateTime previous, LocalDateTime current, String message) {
        super(sourceName, message);
        this.entityId = entityId;
        this.previous = previous;
        this.current = current;
    }

    public static UnalignableSourceException offGrid(String sourceName, String entityId,
                                                     LocalDateTime anchor, LocalDateTime timestamp, Duration period) {
        return new UnalignableSourceException(sourceName, entityId, anchor, timestamp,
                "Source '" + sourceName + "' timestamp " + timestamp + forEntity(entityId)
                        + " is off the " + period + " grid anchored at " + anchor);
    }

    private static String forEntity(String entityId) {
        return entityId != null ? " for entity '" + entityId + "'" : "";
    }

    public String getEntityId() { return entityId; }
    public LocalDateTime getPrevious() { return previous; }
    public LocalDateTime getCurrent() { return current; }
}
