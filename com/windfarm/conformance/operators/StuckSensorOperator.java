package com.windfarm.conformance.operators;

import com.windfarm.conformance.core.OperatorContext;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.ParameterDefinition.Type;
import com.windfarm.conformance.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 卡滞传感器检测算子。
 * 逐个资产按时间顺序扫描参考信号，连续出现的相同非空取值构成一段游程，
 * 长度不小于window的游程全部标记为卡滞，被标记的行将失效组内所有字段置空。
 * 空值打断游程；长度不足window的游程不标记。
 *
 * 先完成全部检测再统一置空，参考信号自身位于失效组中不影响检测结果。
 *
 * 参数：
 * - signal: 参考信号字段 (STRING, 必选)
 * - window: 最小游程长度 (NUMBER, 必选, 不小于2)
 * - group: 失效组字段列表 (LIST, 可选，默认只含参考信号)
 */
public class StuckSensorOperator implements UFunction {

    private static final Logger log = LoggerFactory.getLogger(StuckSensorOperator.class);

    public static final String FUNCTION_ID = "stuck_sensor";

    private String signal;
    private int window;
    private List<String> group;

    @Override
    public void initialize(OperatorContext context) {
        this.signal = context.getParameter("signal", "");
        this.window = context.getParameter("window", 3);
        List<String> configured = context.getParameter("group", new ArrayList<String>());
        this.group = configured.isEmpty() ? List.of(signal) : configured;
    }

    @Override
    public void execute(OperatorContext context) {
        ObservationStream stream = context.getInputStream();
        int signalIndex = stream.columnIndex(signal);
        if (signalIndex < 0) {
            log.debug("Source '{}': stuck-sensor signal '{}' not present, skipped", stream.getSourceName(), signal);
            context.setOutputStream(stream);
            return;
        }

        BitSet flagged = new BitSet(stream.size());
        for (Map.Entry<String, List<Integer>> entry : stream.rowsByEntity().entrySet()) {
            List<Integer> rows = new ArrayList<>(entry.getValue());
            // 稳定排序，同一时间保持输入顺序
            rows.sort(Comparator.comparing(row -> stream.get(row).getTimestamp(),
                    Comparator.nullsLast(Comparator.naturalOrder())));
            int before = flagged.cardinality();
            markRuns(stream, rows, signalIndex, window, flagged);
            if (flagged.cardinality() > before) {
                log.debug("Source '{}', entity '{}': {} rows flagged stuck on '{}'",
                        stream.getSourceName(), entry.getKey(), flagged.cardinality() - before, signal);
            }
        }

        List<Integer> groupColumns = new ArrayList<>();
        for (String field : group) {
            int idx = stream.columnIndex(field);
            if (idx >= 0) {
                groupColumns.add(idx);
            }
        }

        long nulledCells = 0;
        for (int row = flagged.nextSetBit(0); row >= 0; row = flagged.nextSetBit(row + 1)) {
            for (int column : groupColumns) {
                if (stream.get(row).getValue(column) != null) {
                    stream.setValue(row, column, null);
                    nulledCells++;
                }
            }
        }

        if (!flagged.isEmpty()) {
            log.info("Source '{}': {} rows stuck on '{}' (window {}), {} cells nulled across {} fields",
                    stream.getSourceName(), flagged.cardinality(), signal, window, nulledCells, groupColumns.size());
        }
        context.recordQuality("stuck_sensor." + signal + ".flaggedRows", flagged.cardinality());
        context.recordQuality("stuck_sensor." + signal + ".nulledCells", nulledCells);
        context.setOutputStream(stream);
    }

    /**
     * 在已按时间排序的行序列上标记长度不小于window的相同值游程。
     */
    static void markRuns(ObservationStream stream, List<Integer> orderedRows, int column, int window, BitSet flagged) {
        int runStart = 0;
        for (int i = 1; i <= orderedRows.size(); i++) {
            boolean continues = i < orderedRows.size()
                    && sameNonNull(stream.get(orderedRows.get(i - 1)).getValue(column),
                    stream.get(orderedRows.get(i)).getValue(column));
            if (continues) {
                continue;
            }
            // 游程 [runStart, i)
            if (i - runStart >= window && stream.get(orderedRows.get(runStart)).getValue(column) != null) {
                for (int k = runStart; k < i; k++) {
                    flagged.set(orderedRows.get(k));
                }
            }
            runStart = i;
        }
    }

    /** 两个取值均非空且位模式完全相同 */
    private static boolean sameNonNull(Double a, Double b) {
        return a != null && b != null && Double.doubleToRawLongBits(a) == Double.doubleToRawLongBits(b);
    }

    @Override
    public void cleanup() {
        this.signal = null;
        this.group = null;
    }

    @Override
    public FunctionMetadata getMetadata() {
        return new FunctionMetadata(FUNCTION_ID, "1.0.0", "检测参考信号的恒值游程，并置空失效组的字段")
                .appliesTo(SourceType.SCADA)
                .withParameters(
                        ParameterDefinition.of("signal", Type.STRING, true, "参考信号字段"),
                        ParameterDefinition.of("window", Type.NUMBER, true, "判定卡滞的最小游程长度").withMin(2.0),
                        ParameterDefinition.of("group", Type.LIST, false, "一并置空的字段，默认只含参考信号"));
    }
}
