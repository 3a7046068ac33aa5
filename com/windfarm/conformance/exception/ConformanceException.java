package com.windfarm.conformance.exception;

/**
 * 数据一致化流程中所有结构性错误的基类。
 *
 * 单元格级的质量问题（越界、卡滞、无法解析的可选字段）只会被置空，不会抛出异常；
 * 抛出本类异常意味着整次运行失败，不会产生任何部分数据集。
 */
public class ConformanceException extends RuntimeException {

    /** 出错的数据源名称，可能为null */
    private final String sourceName;

    public ConformanceException(String sourceName, String message) {
        super(message);
        this.sourceName = sourceName;
    }

    public ConformanceException(String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() { return sourceName; }
}
