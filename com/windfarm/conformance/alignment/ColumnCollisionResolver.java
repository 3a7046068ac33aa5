package com.windfarm.conformance.alignment;

import com.windfarm.conformance.exception.SchemaViolationException;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 同名列冲突消解器。
 *
 * 策略表以 "数据源.列名" 为键，未配置的列使用默认策略。
 * 每次消解都会记录日志并计入质量报告。
 */
public class ColumnCollisionResolver {

    private static final Logger log = LoggerFactory.getLogger(ColumnCollisionResolver.class);

    private final ColumnCollisionPolicy defaultPolicy;
    private final Map<String, ColumnCollisionPolicy> policies;

    public ColumnCollisionResolver() {
        this(ColumnCollisionPolicy.KEEP_FIRST, Collections.emptyMap());
    }

    public ColumnCollisionResolver(ColumnCollisionPolicy defaultPolicy, Map<String, ColumnCollisionPolicy> policies) {
        this.defaultPolicy = defaultPolicy != null ? defaultPolicy : ColumnCollisionPolicy.KEEP_FIRST;
        this.policies = new LinkedHashMap<>(policies);
    }

    public ColumnCollisionPolicy policyFor(String sourceName, String column) {
        return policies.getOrDefault(sourceName + "." + column, defaultPolicy);
    }

    /**
     * 原地消解数据流中的全部同名列。
     *
     * @return 消解的冲突数
     * @throws SchemaViolationException 策略为FAIL，或重命名目标已存在
     */
    public int resolve(ObservationStream stream, QualityReport report) {
        String source = stream.getSourceName();
        Map<String, List<Integer>> positions = new LinkedHashMap<>();
        List<String> columns = stream.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            positions.computeIfAbsent(columns.get(i), k -> new ArrayList<>()).add(i);
        }

        List<Integer> toRemove = new ArrayList<>();
        int resolved = 0;
        for (Map.Entry<String, List<Integer>> entry : positions.entrySet()) {
            List<Integer> at = entry.getValue();
            if (at.size() < 2) {
                continue;
            }
            String column = entry.getKey();
            ColumnCollisionPolicy policy = policyFor(source, column);
            switch (policy.getAction()) {
                case KEEP_FIRST:
                    toRemove.addAll(at.subList(1, at.size()));
                    break;
                case KEEP_LAST:
                    toRemove.addAll(at.subList(0, at.size() - 1));
                    break;
                case RENAME:
                    renameDuplicates(stream, column, at, policy.getRenameTo());
                    break;
                default:
                    log.error("Source '{}': column '{}' appears {} times and policy is FAIL",
                            source, column, at.size());
                    throw new SchemaViolationException(source, column,
                            "column appears " + at.size() + " times and collision policy is FAIL");
            }
            resolved++;
            log.warn("Source '{}': column '{}' appears {} times, resolved with {}", source, column, at.size(), policy);
            report.increment(source, "alignment.columnCollisions", 1);
        }

        // 从后往前删除，避免位置偏移
        toRemove.sort(Collections.reverseOrder());
        for (int index : toRemove) {
            stream.removeColumnAt(index);
        }
        return resolved;
    }

    private static void renameDuplicates(ObservationStream stream, String column, List<Integer> at, String target) {
        for (int k = 1; k < at.size(); k++) {
            String newName = k == 1 ? target : target + "_" + k;
            if (stream.hasColumn(newName)) {
                throw new SchemaViolationException(stream.getSourceName(), column,
                        "rename target '" + newName + "' already exists");
            }
            stream.renameColumnAt(at.get(k), newName);
        }
    }
}
