package com.windfarm.conformance.source;

import com.windfarm.conformance.contract.FieldSpec;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.exception.SchemaViolationException;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.RawTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 将原始表格按契约映射为规范列名的观测数据流。
 *
 * - 只映射契约声明且非派生的字段；原始列缺失时该字段不出现，由校验器判定是否违规
 * - 原始表中同名列重复出现时逐个保留，交由跨源对齐阶段按冲突策略消解
 * - 空白、NA、NaN、null 视为缺失；其余无法解析的数值置空并计数
 * - 时间戳保持原始文本，由时间归一化算子解析
 */
public class StreamAssembler {

    private static final Logger log = LoggerFactory.getLogger(StreamAssembler.class);

    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "nan", "n/a", "null", "none", "#n/a");

    public ObservationStream assemble(SourceSchema schema, RawTable table, QualityReport report) {
        String source = schema.getName();

        int timeIndex = table.indexOf(schema.getTimeColumn());
        if (timeIndex < 0) {
            throw new SchemaViolationException(source, schema.getTimeColumn(),
                    "time column missing from " + table.getName());
        }
        int entityIndex = -1;
        if (schema.getEntityColumn() != null) {
            entityIndex = table.indexOf(schema.getEntityColumn());
            if (entityIndex < 0) {
                throw new SchemaViolationException(source, schema.getEntityColumn(),
                        "entity column missing from " + table.getName());
            }
        }

        List<String> columns = new ArrayList<>();
        List<Integer> rawIndices = new ArrayList<>();
        for (FieldSpec field : schema.getFields()) {
            if (field.isDerived()) {
                continue;
            }
            List<Integer> at = table.indicesOf(field.getRawColumn());
            if (at.isEmpty()) {
                log.warn("Source '{}': raw column '{}' for field '{}' not found in {}",
                        source, field.getRawColumn(), field.getName(), table.getName());
                continue;
            }
            for (int index : at) {
                columns.add(field.getName());
                rawIndices.add(index);
            }
        }

        ObservationStream stream = new ObservationStream(source, schema.getType(), schema.getSamplingPeriod(), columns);
        long unparseable = 0;
        for (String[] row : table.getRows()) {
            Double[] values = new Double[columns.size()];
            for (int c = 0; c < values.length; c++) {
                String cell = RawTable.cell(row, rawIndices.get(c));
                if (isMissing(cell)) {
                    continue;
                }
                try {
                    values[c] = Double.valueOf(cell.trim());
                } catch (NumberFormatException e) {
                    unparseable++;
                    log.debug("Source '{}': unparseable value '{}' for '{}' nulled", source, cell, columns.get(c));
                }
            }
            String entity = entityIndex >= 0 ? trimToNull(RawTable.cell(row, entityIndex)) : null;
            stream.add(new Observation(RawTable.cell(row, timeIndex), null, entity, values));
        }

        if (unparseable > 0) {
            log.warn("Source '{}': {} unparseable numeric cells nulled", source, unparseable);
        }
        report.increment(source, "assembly.rows", stream.size());
        report.increment(source, "assembly.unparseableCells", unparseable);
        log.info("Assembled source '{}' ({}): {} rows, columns {}", source, schema.getType(), stream.size(), columns);
        return stream;
    }

    static boolean isMissing(String cell) {
        return cell == null || MISSING_TOKENS.contains(cell.trim().toLowerCase(Locale.ROOT));
    }

    private static String trimToNull(String value) {
        return (value == null || value.isBlank()) ? null : value.trim();
    }
}
