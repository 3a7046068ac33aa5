package com.windfarm.conformance.contract;

import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.model.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

class MetadataContractLoaderTest {

    private static Properties minimal() {
        Properties props = new Properties();
        props.setProperty("sources", "scada");
        props.setProperty("source.scada.type", "scada");
        props.setProperty("source.scada.file", "scada.csv");
        props.setProperty("source.scada.time", "Date_time");
        props.setProperty("source.scada.entity", "Wind_turbine_name");
        props.setProperty("source.scada.frequency", "10min");
        props.setProperty("source.scada.fields", "WTUR_W, WTUR_SupWh");
        props.setProperty("source.scada.field.WTUR_W.column", "P_avg");
        props.setProperty("source.scada.field.WTUR_W.unit", "kW");
        props.setProperty("source.scada.field.WTUR_W.required", "true");
        props.setProperty("source.scada.field.WTUR_W.policy", "drop_row");
        props.setProperty("asset.file", "assets.csv");
        props.setProperty("asset.id", "Wind_turbine_name");
        props.setProperty("asset.attribute.rated_power", "Rated_power");
        return props;
    }

    @Test
    void parsesSourcesFieldsAndAssetSchema() {
        MetadataContract contract = MetadataContractLoader.fromProperties(minimal());

        SourceSchema scada = contract.getSource("scada");
        assertThat(scada.getType()).isEqualTo(SourceType.SCADA);
        assertThat(scada.getSamplingPeriod()).isEqualTo(Duration.ofMinutes(10));
        assertThat(scada.getAssumedOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(scada.getDelimiter()).isEqualTo(',');

        FieldSpec power = scada.getField("WTUR_W");
        assertThat(power.getRawColumn()).isEqualTo("P_avg");
        assertThat(power.isRequired()).isTrue();
        assertThat(power.getPolicy()).isEqualTo(InvalidValuePolicy.DROP_ROW);
        assertThat(scada.getField("WTUR_SupWh").isDerived()).isTrue();

        AssetSchema assets = contract.getAssetSchema();
        assertThat(assets.getAttributeColumns()).containsEntry("rated_power", "Rated_power");
        assertThat(assets.declares("rated_power")).isTrue();
        assertThat(assets.declares("latitude")).isFalse();
    }

    @Test
    void collectsAllErrorsBeforeFailing() {
        Properties props = minimal();
        props.remove("source.scada.entity");
        props.setProperty("source.scada.frequency", "often");
        props.remove("asset.file");

        assertThatThrownBy(() -> MetadataContractLoader.fromProperties(props))
                .isInstanceOfSatisfying(PipelineConfigurationException.class,
                        e -> assertThat(e.getErrors()).hasSize(2)
                                .anySatisfy(msg -> assertThat(msg).contains("entity column"))
                                .anySatisfy(msg -> assertThat(msg).contains("asset.file")));
    }

    @Test
    void rejectsUnknownSourceType() {
        Properties props = minimal();
        props.setProperty("source.scada.type", "LIDAR");

        assertThatThrownBy(() -> MetadataContractLoader.fromProperties(props))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("LIDAR");
    }

    @Test
    void readsDelimiterAndOffset() {
        Properties props = minimal();
        props.setProperty("source.scada.delimiter", "tab");
        props.setProperty("source.scada.utc.offset", "+01:00");

        SourceSchema scada = MetadataContractLoader.fromProperties(props).getSource("scada");

        assertThat(scada.getDelimiter()).isEqualTo('\t');
        assertThat(scada.getAssumedOffset()).isEqualTo(ZoneOffset.ofHours(1));
    }

    @Test
    void builtInContractDeclaresLaHauteBorneSources() {
        MetadataContract contract = MetadataContractLoader.loadResource("plant-meta.properties");

        assertThat(contract.getSources()).containsOnlyKeys("scada", "meter", "curtail", "era5", "merra2");
        assertThat(contract.getSourcesOfType(SourceType.REANALYSIS)).hasSize(2);
        assertThat(contract.getSource("era5").getReferenceHeight()).isEqualTo(100.0);
        assertThat(contract.getSource("meter").getFileName())
                .isEqualTo(contract.getSource("curtail").getFileName());
    }
}
