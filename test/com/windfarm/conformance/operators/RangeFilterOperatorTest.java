package com.windfarm.conformance.operators;

import com.windfarm.conformance.contract.FieldSpec;
import com.windfarm.conformance.contract.InvalidValuePolicy;
import com.windfarm.conformance.contract.SourceSchema;
import com.windfarm.conformance.core.impl.DefaultOperatorContext;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.SourceType;
import com.windfarm.conformance.operators.RangeFilterOperator.RangeRule;
import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.windfarm.conformance.TestStreams.column;
import static com.windfarm.conformance.TestStreams.context;
import static com.windfarm.conformance.TestStreams.row;
import static com.windfarm.conformance.TestStreams.scada;
import static com.windfarm.conformance.TestStreams.schema;
import static com.windfarm.conformance.operators.DeduplicationOperatorTest.outputOf;
import static org.assertj.core.api.Assertions.*;

class RangeFilterOperatorTest {

    private static final SourceSchema SCHEMA = schema("scada", SourceType.SCADA, Duration.ofMinutes(10),
            "WMET_EnvTmp", "WTUR_W");

    @Test
    void nullsOutOfRangeCellsAndKeepsRow() {
        ObservationStream stream = scada("WMET_EnvTmp", "WTUR_W");
        row(stream, "R80711", 0, -20.0, 100.0);
        row(stream, "R80711", 10, 45.0, 200.0);
        row(stream, "R80711", 20, (Double) null, 300.0);
        QualityReport report = new QualityReport();

        ObservationStream output = filter(stream, SCHEMA, Map.of("rules", List.of("WMET_EnvTmp:-15:45")), report);

        assertThat(output.size()).isEqualTo(3);
        assertThat(column(output, "WMET_EnvTmp")).containsExactly(null, 45.0, null);
        assertThat(column(output, "WTUR_W")).containsExactly(100.0, 200.0, 300.0);
        assertThat(report.get("scada", "range_filter.nulledCells")).isEqualTo(1);
    }

    @Test
    void dropRowPolicyRemovesRowsWithInvalidOrMissingValue() {
        ObservationStream stream = scada("WMET_EnvTmp", "WTUR_W");
        row(stream, "R80711", 0, -20.0, 100.0);
        row(stream, "R80711", 10, 10.0, 200.0);
        row(stream, "R80711", 20, (Double) null, 300.0);
        QualityReport report = new QualityReport();

        ObservationStream output = filter(stream, SCHEMA,
                Map.of("rules", List.of("WMET_EnvTmp:-15:45:DROP_ROW")), report);

        assertThat(column(output, "WTUR_W")).containsExactly(200.0);
        assertThat(report.get("scada", "range_filter.droppedRows")).isEqualTo(2);
    }

    @Test
    void contractPolicyAppliesWhenRuleHasNone() {
        SourceSchema schema = schema("scada", SourceType.SCADA, Duration.ofMinutes(10), List.of(
                new FieldSpec("WMET_EnvTmp", "Ot_avg", "C", false, InvalidValuePolicy.DROP_ROW)));
        ObservationStream stream = scada("WMET_EnvTmp");
        row(stream, "R80711", 0, 99.0);
        row(stream, "R80711", 10, 9.0);

        ObservationStream output = filter(stream, schema, Map.of("rules", "WMET_EnvTmp:-15:45"), new QualityReport());

        assertThat(column(output, "WMET_EnvTmp")).containsExactly(9.0);
    }

    @Test
    void dropsRowsWithBlankOrMalformedEntityId() {
        ObservationStream stream = scada("WMET_EnvTmp", "WTUR_W");
        row(stream, "R80711", 0, 10.0, 1.0);
        row(stream, null, 0, 10.0, 2.0);
        row(stream, "TEST-1", 0, 10.0, 3.0);
        QualityReport report = new QualityReport();

        Map<String, Object> params = new HashMap<>();
        params.put("rules", List.of("WMET_EnvTmp:-15:45"));
        params.put("entityIdPattern", "R80\\d{3}");
        ObservationStream output = filter(stream, SCHEMA, params, report);

        assertThat(output.entityIds()).containsExactly("R80711");
        assertThat(report.get("scada", "range_filter.invalidEntityRows")).isEqualTo(2);
    }

    @Test
    void missingRuleFieldIsSkipped() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "R80711", 0, -5000.0);

        ObservationStream output = filter(stream, SCHEMA, Map.of("rules", List.of("WMET_EnvTmp:-15:45")),
                new QualityReport());

        assertThat(column(output, "WTUR_W")).containsExactly(-5000.0);
    }

    @Test
    void malformedRuleIsConfigurationError() {
        DefaultOperatorContext ctx = context(SCHEMA, Map.of("rules", List.of("WMET_EnvTmp:45:-15")),
                new QualityReport(), scada("WMET_EnvTmp"));

        assertThatThrownBy(() -> new RangeFilterOperator().initialize(ctx))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("min");
    }

    @Test
    void ruleParsingSupportsOpenBounds() {
        RangeRule rule = RangeRule.parse("WTUR_W::3000");

        assertThat(rule.contains(-1e9)).isTrue();
        assertThat(rule.contains(3000.5)).isFalse();
        assertThat(rule.contains(Double.NaN)).isFalse();
        assertThat(RangeRule.parse(rule.toString()).getMax()).isEqualTo(3000.0);
        assertThatThrownBy(() -> RangeRule.parse("WTUR_W:0")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RangeRule.parse("WTUR_W:0:1:SOMETIMES")).isInstanceOf(IllegalArgumentException.class);
    }

    @Property(tries = 100)
    void everyRemainingValueLiesInRange(
            @ForAll @Size(max = 50) List<@DoubleRange(min = -100, max = 100) Double> temperatures) {
        ObservationStream stream = scada("WMET_EnvTmp", "WTUR_W");
        for (int i = 0; i < temperatures.size(); i++) {
            row(stream, "R80711", i * 10L, temperatures.get(i), (double) i);
        }

        ObservationStream output = filter(stream, SCHEMA, Map.of("rules", List.of("WMET_EnvTmp:-15:45")),
                new QualityReport());

        assertThat(output.size()).isEqualTo(temperatures.size());
        for (Double value : column(output, "WMET_EnvTmp")) {
            if (value != null) {
                assertThat(value).isBetween(-15.0, 45.0);
            }
        }
        // 区间内的取值原样保留
        for (int i = 0; i < temperatures.size(); i++) {
            double t = temperatures.get(i);
            if (t >= -15 && t <= 45) {
                assertThat(output.getValue(i, "WMET_EnvTmp")).isEqualTo(t);
            }
        }
    }

    private static ObservationStream filter(ObservationStream stream, SourceSchema schema,
                                            Map<String, Object> params, QualityReport report) {
        DefaultOperatorContext ctx = context(schema, params, report, stream);
        RangeFilterOperator operator = new RangeFilterOperator();
        operator.initialize(ctx);
        operator.execute(ctx);
        operator.cleanup();
        return outputOf(ctx);
    }
}
