package com.windfarm.conformance.exception;

/**
 * 时间戳无法解析。
 */
public class MalformedTimestampException extends ConformanceException {

    private final int rowIndex;
    private final String rawValue;

    public MalformedTimestampException(String sourceName, int rowIndex, String rawValue, Throwable cause) {
        super(sourceName, "Malformed timestamp '" + rawValue + "' in source '" + sourceName
                + "' at row " + rowIndex, cause);
        this.rowIndex = rowIndex;
        this.rawValue = rawValue;
    }

    public int getRowIndex() { return rowIndex; }
    public String getRawValue() { return rawValue; }
}
