package com.windfarm.conformance.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分隔符文件读取后的原始表格：表头 + 字符串单元格行，不做任何类型解析。
 * 表头允许重名列。
 */
public class RawTable implements Serializable {
    private final String name;
    private final List<String> header;
    private final List<String[]> rows = new ArrayList<>();

    public RawTable(String name, List<String> header) {
        this.name = name;
        this.header = List.copyOf(header);
    }

    public String getName() { return name; }
    public List<String> getHeader() { return header; }

    public List<String[]> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public void addRow(String[] cells) {
        rows.add(cells);
    }

    /** 返回列名所有出现位置 */
    public List<Integer> indicesOf(String column) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).equals(column)) {
                result.add(i);
            }
        }
        return result;
    }

    public int indexOf(String column) {
        return header.indexOf(column);
    }

    /** 取单元格，行长度不足时返回null */
    public static String cell(String[] row, int index) {
        return (index >= 0 && index < row.length) ? row[index] : null;
    }

    public int size() {
        return rows.size();
    }
}
