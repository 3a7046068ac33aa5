package com.windfarm.conformance.operators;

import com.windfarm.conformance.contract.FieldSpec;
import com.windfarm.conformance.contract.InvalidValuePolicy;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 范围过滤算子。
 * 按字段配置闭区间[min, max]，区间外的取值按字段策略处理：
 * NULL_CELL 置空单元格；DROP_ROW 删除整行（取值缺失同样删除）。
 * 按资产组织的数据源还会删除资产标识为空或不符合标识格式的行。
 *
 * 参数：
 * - rules: 规则列表 (LIST, 必选)，每项格式 "字段:下限:上限[:策略]"，上下限留空表示不设限
 * - entityIdPattern: 资产标识正则 (STRING, 可选)
 */
public class RangeFilterOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(RangeFilterOperator.class);

    public static final String FUNCTION_ID = "range_filter";

    private List<RangeRule> rules;
    private Pattern entityIdPattern;

    @Override
    public void initialize(OperatorContext context) {
        String source = context.getSourceSchema().getName();
        List<String> ruleTexts = context.getParameter("rules", new ArrayList<String>());
        this.rules = new ArrayList<>();
        for (String text : ruleTexts) {
            try {
                rules.add(RangeRule.parse(text));
            } catch (IllegalArgumentException e) {
                throw new PipelineConfigurationException(source, List.of(e.getMessage()));
            }
        }

        String pattern = context.getParameter("entityIdPattern", "");
        try {
            this.entityIdPattern = pattern.isBlank() ? null : Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new PipelineConfigurationException(source, List.of("Invalid entityIdPattern: " + e.getMessage()));
        }
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream input = context.getInputStream();
        SourceSchema schema = context.getSourceSchema();

        // 逐条规则确定列位置与生效策略
        List<int[]> nullCellRules = new ArrayList<>();
        List<int[]> dropRowRules = new ArrayList<>();
        for (int i = 0; i < rules.size(); i++) {
            RangeRule rule = rules.get(i);
            int column = input.columnIndex(rule.getField());
            if (column < 0) {
                log.debug("Source '{}': range rule field '{}' not present, skipped",
                        input.getSourceName(), rule.getField());
                continue;
            }
            InvalidValuePolicy policy = effectivePolicy(rule, schema);
            (policy == InvalidValuePolicy.DROP_ROW ? dropRowRules : nullCellRules).add(new int[]{i, column});
        }

        ObservationStream output = input.emptyCopy();
        long nulled = 0;
        long droppedRows = 0;
        long invalidEntities = 0;

        for (int row = 0; row < input.size(); row++) {
            Observation obs = input.get(row);

            if (input.isEntityKeyed() && !isValidEntity(obs.getEntityId())) {
                invalidEntities++;
                continue;
            }

            boolean drop = false;
            for (int[] ruleAndColumn : dropRowRules) {
                Double value = obs.getValue(ruleAndColumn[1]);
                if (value == null || !rules.get(ruleAndColumn[0]).contains(value)) {
                    drop = true;
                    break;
                }
            }
            if (drop) {
                droppedRows++;
                continue;
            }

            output.add(obs);
            int outRow = output.size() - 1;
            for (int[] ruleAndColumn : nullCellRules) {
                Double value = obs.getValue(ruleAndColumn[1]);
                if (value != null && !rules.get(ruleAndColumn[0]).contains(value)) {
                    output.setValue(outRow, ruleAndColumn[1], null);
                    nulled++;
                }
            }
        }

        if (nulled > 0 || droppedRows > 0 || invalidEntities > 0) {
            log.warn("Source '{}': range filter nulled {} cells, dropped {} rows out of range and {} rows with invalid entity id",
                    input.getSourceName(), nulled, droppedRows, invalidEntities);
        }
        context.recordQuality("range_filter.nulledCells", nulled);
        context.recordQuality("range_filter.droppedRows", droppedRows);
        context.recordQuality("range_filter.invalidEntityRows", invalidEntities);
        context.setOutputStream(output);
    }

    private boolean isValidEntity(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            return false;
        }
        return entityIdPattern == null || entityIdPattern.matcher(entityId).matches();
    }

    /** 规则显式指定的策略优先，其次是契约中的字段策略，默认置空单元格 */
    private static InvalidValuePolicy effectivePolicy(RangeRule rule, SourceSchema schema) {
        if (rule.getPolicy() != null) {
            return rule.getPolicy();
        }
        FieldSpec field = schema != null ? schema.getField(rule.getField()) : null;
        return field != null ? field.getPolicy() : InvalidValuePolicy.NULL_CELL;
    }

    @Override
    public void cleanup() {
        this.rules = null;
        this.entityIdPattern = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "按闭区间过滤不可能的取值，并剔除资产标识无效的行")
                .withParameters(
                        ParameterDefinition.of("rules", Type.LIST, true,
                                "范围规则，格式 字段:下限:上限[:NULL_CELL|DROP_ROW]"),
                        ParameterDefinition.of("entityIdPattern", Type.STRING, false, "资产标识须匹配的正则"));
    }

    /**
     * 单个字段的范围规则
     */
    public static final class RangeRule {
        private final String field;
        private final double min;
        private final double max;
        /** 为null时使用契约中的字段策略 */
        private final InvalidValuePolicy policy;

        public RangeRule(String field, double min, double max, InvalidValuePolicy policy) {
            if (min > max) {
                throw new IllegalArgumentException("Range rule for '" + field + "' has min " + min + " > max " + max);
            }
            this.field = field;
            this.min = min;
            this.max = max;
            this.policy = policy;
        }

        public static RangeRule parse(String text) {
            String[] parts = text.split(":", -1);
            if (parts.length < 3 || parts.length > 4 || parts[0].isBlank()) {
                throw new IllegalArgumentException("Malformed range rule '" + text + "', expected field:min:max[:policy]");
            }
            try {
                double min = parts[1].isBlank() ? Double.NEGATIVE_INFINITY : Double.parseDouble(parts[1].trim());
                double max = parts[2].isBlank() ? Double.POSITIVE_INFINITY : Double.parseDouble(parts[2].trim());
                InvalidValuePolicy policy = (parts.length == 4 && !parts[3].isBlank())
                        ? InvalidValuePolicy.valueOf(parts[3].trim().toUpperCase(Locale.ROOT)) : null;
                return new RangeRule(parts[0].trim(), min, max, policy);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Malformed range rule '" + text + "': " + e.getMessage(), e);
            }
        }

        /** NaN不在任何区间内 */
        public boolean contains(double value) {
            return value >= min && value <= max;
        }

        public String getField() { return field; }
        public double getMin() { return min; }
        public double getMax() { return max; }
        public InvalidValuePolicy getPolicy() { return policy; }

        @Override
        public String toString() {
            String text = field + ":" + (Double.isInfinite(min) ? "" : min) + ":" + (Double.isInfinite(max) ? "" : max);
            return policy != null ? text + ":" + policy : text;
        }
    }
}
