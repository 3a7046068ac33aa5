package com.windfarm.conformance.core;

import com.windfarm.conformance.model.RawTable;

import java.nio.file.Path;

/**
 * 原始数据读取接口：流水线与文件系统之间的唯一边界。
 *
 * 读取在流水线运行之前一次性完成，读取结果为完整的原始表格。
 */
public interface SourceReader {

    /**
     * 读取整个分隔符文件。
     *
     * @param file      文件路径
     * @param delimiter 字段分隔符
     * @return 原始表格
     * @throws com.windfarm.conformance.exception.SourceReadException 读取失败时抛出
     */
    RawTable read(Path file, char delimiter);
}
