package com.windfarm.conformance.source;

import com.windfarm.conformance.core.SourceReader;
import com.windfarm.conformance.exception.SourceReadException;
import com.windfarm.conformance.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 分隔符文件读取器。
 *
 * 第一条记录为表头。支持双引号包裹的字段（字段内可含分隔符、换行，"" 表示一个引号），
 * 跳过UTF-8 BOM和空行。单元格保持原始文本，不做类型解析。
 */
public class DelimitedFileReader implements SourceReader {

    private static final Logger log = LoggerFactory.getLogger(DelimitedFileReader.class);

    @Override
    public RawTable read(Path file, char delimiter) {
        if (!Files.isRegularFile(file)) {
            throw new SourceReadException(file, "Source file not found");
        }
        long start = System.currentTimeMillis();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            RawTable table = parse(file.getFileName().toString(), reader, delimiter);
            log.info("Read {} rows x {} columns from {} in {}ms", table.size(), table.getHeader().size(),
                    file, System.currentTimeMillis() - start);
            return table;
        } catch (IOException e) {
            throw new SourceReadException(file, "Failed to read source file", e);
        }
    }

    /**
     * 解析任意字符流。
     *
     * @throws IOException 读取失败
     */
    public static RawTable parse(String name, Reader reader, char delimiter) throws IOException {
        List<String> header = null;
        RawTable table = null;

        List<String> record;
        RecordScanner scanner = new RecordScanner(
                reader.markSupported() ? reader : new BufferedReader(reader), delimiter);
        while ((record = scanner.next()) != null) {
            if (record.size() == 1 && record.get(0).isEmpty()) {
                continue;
            }
            if (header == null) {
                header = new ArrayList<>();
                for (String column : record) {
                    header.add(column.trim());
                }
                table = new RawTable(name, header);
                continue;
            }
            table.addRow(record.toArray(new String[0]));
        }
        if (table == null) {
            table = new RawTable(name, List.of());
        }
        return table;
    }

    /**
     * 逐条记录的字符扫描器
     */
    private static final class RecordScanner {
        private final Reader reader;
        private final char delimiter;
        private boolean first = true;
        private boolean eof;

        RecordScanner(Reader reader, char delimiter) {
            this.reader = reader;
            this.delimiter = delimiter;
        }

        List<String> next() throws IOException {
            if (eof) {
                return null;
            }
            List<String> fields = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuotes = false;
            boolean any = false;

            int c;
            while ((c = reader.read()) != -1) {
                if (first) {
                    first = false;
                    if (c == '\uFEFF') {
                        continue;
                    }
                }
                any = true;
                char ch = (char) c;
                if (inQuotes) {
                    if (ch == '"') {
                        reader.mark(1);
                        int peek = reader.read();
                        if (peek == '"') {
                            current.append('"');
                        } else {
                            inQuotes = false;
                            if (peek != -1) {
                                reader.reset();
                            }
                        }
                    } else {
                        current.append(ch);
                    }
                } else if (ch == '"' && current.length() == 0) {
                    inQuotes = true;
                } else if (ch == delimiter) {
                    fields.add(current.toString());
                    current.setLength(0);
                } else if (ch == '\n') {
                    fields.add(stripCarriageReturn(current));
                    return fields;
                } else {
                    current.append(ch);
                }
            }
            eof = true;
            if (!any) {
                return null;
            }
            fields.add(stripCarriageReturn(current));
            return fields;
        }

        private static String stripCarriageReturn(StringBuilder sb) {
            int len = sb.length();
            if (len > 0 && sb.charAt(len - 1) == '\r') {
                sb.setLength(len - 1);
            }
            return sb.toString();
        }
    }
}
