package com.windfarm.conformance.exception;

import java.nio.file.Path;

/**
 * 原始文件或压缩包读取失败。
 */
public class SourceReadException extends ConformanceException {

    private final Path path;

    public SourceReadException(Path path, String message, Throwable cause) {
        super(null, message + ": " + path, cause);
        this.path = path;
    }

    public SourceReadException(Path path, String message) {
        this(path, message, null);
    }

    public Path getPath() { return path; }
}
