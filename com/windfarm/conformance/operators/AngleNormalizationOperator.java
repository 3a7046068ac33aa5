package com.windfarm.conformance.operators;

import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import com.windfarm.conformance.model.SourceType;

import java.util.ArrayList;
import java.util.List;

/**
 * 角度归一化算子。
 * 将角度字段映射到(-180, 180]：先对360取模落入[0, 360)，大于180的再减去360。
 * 空值保持为空，非有限值原样保留。
 *
 * 参数：
 * - fields: 需要归一化的字段列表 (LIST, 默认 WROT_BlPthAngVal)
 */
public class AngleNormalizationOperator implements UFunction {

    public static final String FUNCTION_ID = "angle_normalization";

    private List<String> fields;

    @Override
    public void initialize(OperatorContext context) {
        this.fields = context.getParameter("fields", new ArrayList<>(List.of("WROT_BlPthAngVal")));
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream stream = context.getInputStream();
        long changed = 0;

        for (String field : fields) {
            int column = stream.columnIndex(field);
            if (column < 0) {
                continue;
            }
            for (int row = 0; row < stream.size(); row++) {
                Double value = stream.get(row).getValue(column);
                Double normalized = normalize(value);
                if (value != null && !value.equals(normalized)) {
                    stream.setValue(row, column, normalized);
                    changed++;
                }
            }
        }

        context.recordQuality("angle_normalization.adjusted", changed);
        context.setOutputStream(stream);
    }

    /** 映射到(-180, 180]，-180映射为180 */
    public static Double normalize(Double angle) {
        if (angle == null || !Double.isFinite(angle)) {
            return angle;
        }
        // 已在规范区间内的取值原样返回，保证重复执行不变
        if (angle > -180.0 && angle <= 180.0) {
            return angle == 0.0 ? 0.0 : angle;
        }
        double wrapped = angle % 360.0;
        if (wrapped < 0) {
            wrapped += 360.0;
        }
        if (wrapped > 180.0) {
            wrapped -= 360.0;
        }
        return wrapped == 0.0 ? 0.0 : wrapped;
    }

    @Override
    public void cleanup() {
        this.fields = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "将桨距角等角度字段统一到(-180, 180]区间")
                .appliesTo(SourceType.SCADA)
                .withParameters(ParameterDefinition.of("fields", Type.LIST, false, "需要归一化的角度字段"));
    }
}
