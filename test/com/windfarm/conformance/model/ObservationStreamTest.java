package com.windfarm.conformance.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.windfarm.conformance.TestStreams.T0;
import static com.windfarm.conformance.TestStreams.row;
import static com.windfarm.conformance.TestStreams.scada;
import static org.assertj.core.api.Assertions.*;

class ObservationStreamTest {

    @Test
    void frozenStreamRejectsEveryWrite() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "R80711", 0, 100.0);
        stream.freeze();

        assertThat(stream.isFrozen()).isTrue();
        assertThatThrownBy(() -> stream.setValue(0, "WTUR_W", 1.0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> row(stream, "R80711", 10, 1.0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stream.addColumn("WTUR_SupWh")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stream.removeColumnAt(0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> stream.setTimestamp(0, T0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copyOfFrozenStreamIsIndependentAndWritable() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "R80711", 0, 100.0);
        stream.freeze();

        ObservationStream copy = stream.copy();
        copy.setValue(0, "WTUR_W", 5.0);

        assertThat(copy.isFrozen()).isFalse();
        assertThat(copy.getValue(0, "WTUR_W")).isEqualTo(5.0);
        assertThat(stream.getValue(0, "WTUR_W")).isEqualTo(100.0);
    }

    @Test
    void addColumnExtendsRowsWithNulls() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "R80711", 0, 100.0);

        int index = stream.addColumn("WTUR_SupWh");

        assertThat(index).isEqualTo(1);
        assertThat(stream.getColumns()).containsExactly("WTUR_W", "WTUR_SupWh");
        assertThat(stream.getValue(0, "WTUR_SupWh")).isNull();
        assertThat(stream.addColumn("WTUR_W")).isZero();
    }

    @Test
    void rejectsObservationOfWrongWidth() {
        ObservationStream stream = scada("WTUR_W", "WMET_HorWdSpd");

        assertThatThrownBy(() -> row(stream, "R80711", 0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("width");
    }

    @Test
    void findsByEntityAndTimestampAfterTimestampChange() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "R80711", 0, 1.0);
        row(stream, "R80721", 0, 2.0);

        assertThat(stream.find("R80721", T0).getValue(0)).isEqualTo(2.0);

        stream.setTimestamp(1, T0.plusMinutes(10));
        assertThat(stream.find("R80721", T0)).isNull();
        assertThat(stream.find("R80721", T0.plusMinutes(10))).isNotNull();
    }

    @Test
    void groupsRowsByEntityInFirstSeenOrder() {
        ObservationStream stream = scada("WTUR_W");
        row(stream, "B", 0, 1.0);
        row(stream, "A", 0, 2.0);
        row(stream, "B", 10, 3.0);

        assertThat(stream.rowsByEntity()).containsExactly(
                entry("B", List.of(0, 2)),
                entry("A", List.of(1)));
        assertThat(stream.entityIds()).containsExactly("B", "A");
    }
}
