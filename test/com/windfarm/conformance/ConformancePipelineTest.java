package com.windfarm.conformance;

import com.windfarm.conformance.contract.MetadataContract;
import com.windfarm.conformance.contract.MetadataContractLoader;
import com.windfarm.conformance.core.impl.DefaultFunctionManager;
import com.windfarm.conformance.exception.EntityReconciliationException;
import com.windfarm.conformance.exception.MalformedTimestampException;
import com.windfarm.conformance.exception.PipelineConfigurationException;
import com.windfarm.conformance.exception.SourceReadException;
import com.windfarm.conformance.exception.UnalignableSourceException;
import com.windfarm.conformance.model.ConformedDataset;
import com.windfarm.conformance.model.Observation;
import com.windfarm.conformance.model.ObservationStream;
import com.windfarm.conformance.model.QualityReport;
import com.windfarm.conformance.model.RawTable;
import com.windfarm.conformance.source.DelimitedFileReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static com.windfarm.conformance.TestStreams.T0;
import static com.windfarm.conformance.TestStreams.column;
import static org.assertj.core.api.Assertions.*;

class ConformancePipelineTest {

    static final String SCADA_HEADER = "Date_time,Wind_turbine_name,Ba_avg,P_avg,Va_avg,Ot_avg\n";

    static final String SCADA = SCADA_HEADER
            + "2014-01-01T01:00:00+01:00,R80711,-1,600,1.5,5\n"
            + "2014-01-01T01:10:00+01:00,R80711,370,300,2.5,60\n"
            + "2014-01-01T01:10:00+01:00,R80711,0,999,9.5,9\n"
            + "2014-01-01T01:30:00+01:00,R80711,0,-6,3.5,6\n"
            + "2014-01-01T01:40:00+01:00,R80711,1,100,4.5,7\n"
            + "2014-01-01T01:50:00+01:00,R80711,1,200,5.5,8\n"
            + "2014-01-01T02:00:00+01:00,R80711,1,300,6.5,9\n"
            + "2014-01-01T01:00:00+01:00,R80721,2,120,3.0,7\n"
            + "2014-01-01T01:10:00+01:00,R80721,2,120,4.0,8\n"
            + "2014-01-01T01:20:00+01:00,R80721,2,120,4.0,9\n"
            + "2014-01-01T01:30:00+01:00,R80721,2,120,4.0,10\n"
            + "2014-01-01T01:40:00+01:00,R80721,2,120,4.0,11\n"
            + "2014-01-01T01:50:00+01:00,R80721,2,120,4.0,12\n"
            + "2014-01-01T02:00:00+01:00,R80721,2,300,5.0,13\n"
            + "2014-01-01T01:30:00+01:00,,2,300,5.0,10\n";

    static final String PLANT = "time_utc;net_energy_kwh;availability_kwh;curtailment_kwh\n"
            + "2014-01-01T00:00:00Z;100;1;0\n"
            + "2014-01-01T00:10:00Z;NA;2;0\n"
            + "2014-01-01T00:30:00Z;120;0;3\n";

    static final String ERA5 = "datetime,u_100,v_100,t_2m,surf_pres\n"
            + "2014-01-01 00:00:00,0,-5,280,100000\n"
            + "2014-01-01 01:00:00,3,4,280,100000\n";

    static final String ASSETS = "Wind_turbine_name,Latitude,Longitude,Rated_power\n"
            + "R80711,48.4569,5.5847,2050\n"
            + "R80721,48.4497,5.5869,2050\n"
            + "R80736,48.4461,5.5925,2050\n";

    @TempDir
    Path dataDir;

    private MetadataContract contract;
    private AppConfig config;

    @BeforeEach
    void setUp() {
        contract = MetadataContractLoader.loadResource("test-plant.properties");
        config = AppConfig.fromProperties(new Properties());
    }

    static void writeFixtures(Path dir, String scada) throws IOException {
        Files.writeString(dir.resolve("scada.csv"), scada);
        Files.writeString(dir.resolve("plant.csv"), PLANT);
        Files.writeString(dir.resolve("era5.csv"), ERA5);
        Files.writeString(dir.resolve("assets.csv"), ASSETS);
    }

    private ConformancePipeline pipeline() {
        DefaultFunctionManager functionManager = new DefaultFunctionManager();
        ConformanceApplication.registerBuiltinOperators(functionManager);
        return new ConformancePipeline(config, contract, functionManager, new DelimitedFileReader());
    }

    @Test
    void conformsScadaStream() throws IOException {
        writeFixtures(dataDir, SCADA);

        ConformedDataset dataset = pipeline().run(dataDir);

        assertThat(dataset.getStreams().keySet()).containsExactly("scada", "meter", "curtail", "era5");
        assertThat(dataset.getAssetTable().getAssetIds()).containsExactly("R80711", "R80721");

        ObservationStream scada = dataset.getScada();
        assertThat(scada.getColumns()).containsExactly(
                "WROT_BlPthAngVal", "WTUR_W", "WMET_HorWdDirRel", "WMET_EnvTmp", "WTUR_SupWh");
        assertThat(scada.size()).isEqualTo(14);
        assertThat(scada.get(0).getEntityId()).isEqualTo("R80711");
        assertThat(scada.get(0).getTimestamp()).isEqualTo(T0);
        assertThat(scada.get(7).getEntityId()).isEqualTo("R80721");
        assertThat(scada.get(13).getTimestamp()).isEqualTo(T0.plusHours(1));

        // R80711: 去重保留首行，温度越界置空，00:20补空行，角度归一化
        // R80721: 风向偏差00:10至00:50连续五个相同取值，失效组整行置空，前后两行保留
        assertThat(column(scada, "WROT_BlPthAngVal")).containsExactly(
                -1.0, 10.0, null, 0.0, 1.0, 1.0, 1.0,
                2.0, null, null, null, null, null, 2.0);
        assertThat(column(scada, "WTUR_W")).containsExactly(
                600.0, 300.0, null, -6.0, 100.0, 200.0, 300.0,
                120.0, null, null, null, null, null, 300.0);
        assertThat(column(scada, "WMET_HorWdDirRel")).containsExactly(
                1.5, 2.5, null, 3.5, 4.5, 5.5, 6.5,
                3.0, null, null, null, null, null, 5.0);
        assertThat(column(scada, "WMET_EnvTmp")).containsExactly(
                5.0, null, null, 6.0, 7.0, 8.0, 9.0,
                7.0, null, null, null, null, null, 13.0);

        List<Double> energy = column(scada, "WTUR_SupWh");
        assertThat(energy.get(0)).isCloseTo(100.0, within(1e-9));
        assertThat(energy.get(1)).isCloseTo(50.0, within(1e-9));
        assertThat(energy.get(3)).isCloseTo(-1.0, within(1e-9));
        assertThat(energy.get(6)).isCloseTo(50.0, within(1e-9));
        assertThat(energy.get(7)).isCloseTo(20.0, within(1e-9));
        assertThat(energy.get(13)).isCloseTo(50.0, within(1e-9));
        assertThat(energy.get(2)).isNull();
        assertThat(energy.subList(8, 13)).containsOnlyNulls();
    }

    @Test
    void longConstantTemperatureRunNullsOnlyTemperature() throws IOException {
        StringBuilder scada = new StringBuilder(SCADA_HEADER);
        for (int i = 0; i <= 20; i++) {
            scada.append(String.format("2014-01-01T%s,R80711,1,%d,%d.5,%d\n",
                    scadaLocalTime(i), 100 + i, i, i < 20 ? 12 : 13));
        }
        for (int i = 0; i <= 19; i++) {
            scada.append(String.format("2014-01-01T%s,R80721,1,%d,%d.5,%d\n",
                    scadaLocalTime(i), 100 + i, i, i < 19 ? 14 : 15));
        }
        writeFixtures(dataDir, scada.toString());

        ConformedDataset dataset = pipeline().run(dataDir);

        ObservationStream stream = dataset.getScada();
        for (int i = 0; i < 20; i++) {
            Observation stuck = stream.find("R80711", T0.plusMinutes(10L * i));
            assertThat(stuck.getValue(stream.columnIndex("WMET_EnvTmp"))).isNull();
            assertThat(stuck.getValue(stream.columnIndex("WTUR_W"))).isEqualTo(100.0 + i);
            assertThat(stuck.getValue(stream.columnIndex("WMET_HorWdDirRel"))).isEqualTo(i + 0.5);
            assertThat(stuck.getValue(stream.columnIndex("WROT_BlPthAngVal"))).isEqualTo(1.0);
        }
        assertThat(stream.find("R80711", T0.plusMinutes(200)).getValue(stream.columnIndex("WMET_EnvTmp")))
                .isEqualTo(13.0);
        // R80721 只有19个相同取值，不足窗口长度
        assertThat(stream.find("R80721", T0).getValue(stream.columnIndex("WMET_EnvTmp"))).isEqualTo(14.0);

        QualityReport report = dataset.getQualityReport();
        assertThat(report.get("scada", "stuck_sensor.WMET_EnvTmp.flaggedRows")).isEqualTo(20);
        assertThat(report.get("scada", "stuck_sensor.WMET_EnvTmp.nulledCells")).isEqualTo(20);
        assertThat(report.get("scada", "stuck_sensor.WMET_HorWdDirRel.flaggedRows")).isZero();
    }

    /** 第i个十分钟时槽的本地时间(+01:00)，T0为UTC 00:00 */
    private static String scadaLocalTime(int slot) {
        LocalDateTime local = T0.plusHours(1).plusMinutes(10L * slot);
        return String.format("%02d:%02d:00+01:00", local.getHour(), local.getMinute());
    }

    @Test
    void conformsPlantLevelAndReanalysisStreams() throws IOException {
        writeFixtures(dataDir, SCADA);

        ConformedDataset dataset = pipeline().run(dataDir);

        ObservationStream meter = dataset.getMeter();
        assertThat(meter.getObservations()).extracting(o -> o.getTimestamp())
                .containsExactly(T0, T0.plusMinutes(10), T0.plusMinutes(20), T0.plusMinutes(30));
        assertThat(column(meter, "MMTR_SupWh")).containsExactly(100.0, null, null, 120.0);
        assertThat(column(dataset.getCurtailment(), "IAVL_ExtPwrDnWh")).containsExactly(0.0, 0.0, null, 3.0);

        ObservationStream era5 = dataset.getReanalysis().get("era5");
        assertThat(era5.getSamplingPeriod()).hasHours(1);
        List<Double> speed = column(era5, "WMETR_HorWdSpd");
        List<Double> direction = column(era5, "WMETR_HorWdDir");
        List<Double> density = column(era5, "WMETR_AirDen");
        assertThat(speed.get(0)).isCloseTo(5.0, within(1e-9));
        assertThat(speed.get(1)).isCloseTo(5.0, within(1e-9));
        assertThat(direction.get(0)).isCloseTo(0.0, within(1e-9));
        assertThat(direction.get(1)).isCloseTo(180.0 + Math.toDegrees(Math.atan2(3, 4)), within(1e-9));
        assertThat(density.get(0)).isCloseTo(100000 / (287.05 * 280), within(1e-12));
    }

    @Test
    void recordsQualityCounters() throws IOException {
        writeFixtures(dataDir, SCADA);

        QualityReport report = pipeline().run(dataDir).getQualityReport();

        assertThat(report.get("scada", "assembly.rows")).isEqualTo(15);
        assertThat(report.get("scada", "deduplication.removed")).isEqualTo(1);
        assertThat(report.get("scada", "range_filter.invalidEntityRows")).isEqualTo(1);
        assertThat(report.get("scada", "range_filter.nulledCells")).isEqualTo(1);
        assertThat(report.get("scada", "stuck_sensor.WMET_HorWdDirRel.flaggedRows")).isEqualTo(5);
        assertThat(report.get("scada", "stuck_sensor.WMET_HorWdDirRel.nulledCells")).isEqualTo(20);
        assertThat(report.get("scada", "stuck_sensor.WMET_EnvTmp.flaggedRows")).isZero();
        assertThat(report.get("scada", "angle_normalization.adjusted")).isEqualTo(1);
        assertThat(report.get("scada", "alignment.gapRowsInserted")).isEqualTo(1);
        assertThat(report.get("meter", "alignment.gapRowsInserted")).isEqualTo(1);
        assertThat(report.get("era5", "derived_features.WMETR_HorWdSpd")).isEqualTo(2);
    }

    @Test
    void pipelineCanRunAgainWithSameResult() throws IOException {
        writeFixtures(dataDir, SCADA);
        ConformancePipeline pipeline = pipeline();

        ConformedDataset first = pipeline.run(dataDir);
        ConformedDataset second = pipeline.run(dataDir);

        assertThat(column(second.getScada(), "WTUR_W")).isEqualTo(column(first.getScada(), "WTUR_W"));
        assertThat(second.getQualityReport().getMetrics("scada"))
                .isEqualTo(first.getQualityReport().getMetrics("scada"));
    }

    @Test
    void processAcceptsPreloadedTables() throws IOException {
        writeFixtures(dataDir, SCADA);
        DelimitedFileReader reader = new DelimitedFileReader();
        Map<String, RawTable> tables = Map.of(
                "scada.csv", reader.read(dataDir.resolve("scada.csv"), ','),
                "plant.csv", reader.read(dataDir.resolve("plant.csv"), ';'),
                "era5.csv", reader.read(dataDir.resolve("era5.csv"), ','),
                "assets.csv", reader.read(dataDir.resolve("assets.csv"), ','));

        ConformedDataset dataset = pipeline().process(tables);

        assertThat(dataset.getScada().size()).isEqualTo(14);
    }

    @Test
    void malformedTimestampAbortsRun() throws IOException {
        writeFixtures(dataDir, SCADA_HEADER
                + "2014-01-01T01:00:00+01:00,R80711,0,600,1.5,5\n"
                + "01/01/2014 01:10,R80711,0,600,2.5,5\n");

        assertThatThrownBy(() -> pipeline().run(dataDir))
                .isInstanceOfSatisfying(MalformedTimestampException.class, e -> {
                    assertThat(e.getSourceName()).isEqualTo("scada");
                    assertThat(e.getRowIndex()).isEqualTo(1);
                    assertThat(e.getRawValue()).isEqualTo("01/01/2014 01:10");
                });
    }

    @Test
    void unknownTurbineAbortsRun() throws IOException {
        writeFixtures(dataDir, SCADA + "2014-01-01T01:00:00+01:00,R80799,0,600,1.5,5\n");

        assertThatThrownBy(() -> pipeline().run(dataDir))
                .isInstanceOfSatisfying(EntityReconciliationException.class,
                        e -> assertThat(e.getAssetId()).isEqualTo("R80799"));
    }

    @Test
    void outOfOrderTimestampsAreUnalignable() throws IOException {
        writeFixtures(dataDir, SCADA_HEADER
                + "2014-01-01T01:10:00+01:00,R80711,0,600,1.5,5\n"
                + "2014-01-01T01:00:00+01:00,R80711,0,600,2.5,5\n");

        assertThatThrownBy(() -> pipeline().run(dataDir))
                .isInstanceOfSatisfying(UnalignableSourceException.class, e -> {
                    assertThat(e.getEntityId()).isEqualTo("R80711");
                    assertThat(e.getPrevious()).isEqualTo(LocalDateTime.of(2014, 1, 1, 0, 10));
                });
    }

    @Test
    void meterRowOffTheTenMinuteGridAbortsRun() throws IOException {
        writeFixtures(dataDir, SCADA);
        Files.writeString(dataDir.resolve("plant.csv"), "time_utc;net_energy_kwh;availability_kwh;curtailment_kwh\n"
                + "2014-01-01T00:00:00Z;100;1;0\n"
                + "2014-01-01T00:25:00Z;5;0;0\n"
                + "2014-01-01T00:30:00Z;120;0;3\n");

        assertThatThrownBy(() -> pipeline().run(dataDir))
                .isInstanceOfSatisfying(UnalignableSourceException.class, e -> {
                    assertThat(e.getSourceName()).isEqualTo("meter");
                    assertThat(e.getCurrent()).isEqualTo(T0.plusMinutes(25));
                });
    }

    @Test
    void missingSourceFileAbortsRun() throws IOException {
        writeFixtures(dataDir, SCADA);
        Files.delete(dataDir.resolve("era5.csv"));

        assertThatThrownBy(() -> pipeline().run(dataDir))
                .isInstanceOfSatisfying(SourceReadException.class,
                        e -> assertThat(e.getPath()).isEqualTo(dataDir.resolve("era5.csv")));
    }

    @Test
    void unregisteredOperatorIsRejectedBeforeReading() {
        ConformancePipeline pipeline = new ConformancePipeline(config, contract,
                new DefaultFunctionManager(), new DelimitedFileReader());

        assertThatThrownBy(() -> pipeline.run(dataDir))
                .isInstanceOfSatisfying(PipelineConfigurationException.class,
                        e -> assertThat(e.getErrors()).anyMatch(error -> error.contains("not registered")));
    }

    @Test
    void listsEachInputFileOnce() {
        assertThat(pipeline().inputFiles(dataDir)).containsExactly(
                dataDir.resolve("assets.csv"), dataDir.resolve("scada.csv"),
                dataDir.resolve("plant.csv"), dataDir.resolve("era5.csv"));
    }
}
