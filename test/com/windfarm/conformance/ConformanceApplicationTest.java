package com.windfarm.conformance;

import com.windfarm.conformance.core.impl.DefaultFunctionManager;
import com.windfarm.conformance.model.ConformedDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.*;

class ConformanceApplicationTest {

    @TempDir
    Path dir;

    private Path dataDir;
    private Path contractFile;

    @BeforeEach
    void setUp() throws IOException {
        dataDir = Files.createDirectory(dir.resolve("plant"));
        ConformancePipelineTest.writeFixtures(dataDir, ConformancePipelineTest.SCADA);
        contractFile = dir.resolve("test-plant.properties");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("test-plant.properties")) {
            Files.copy(in, contractFile);
        }
    }

    private AppConfig config(boolean cacheEnabled) {
        Properties props = new Properties();
        props.setProperty("data.root", dataDir.toString());
        props.setProperty("meta.contract.path", contractFile.toString());
        props.setProperty("cache.enabled", String.valueOf(cacheEnabled));
        return AppConfig.fromProperties(props);
    }

    @Test
    void secondConformIsServedFromCache() {
        ConformanceApplication app = new ConformanceApplication(config(true));

        ConformedDataset first = app.conform();
        ConformedDataset second = app.conform();

        assertThat(second).isSameAs(first);
        assertThat(app.getCache().getMissCount()).isEqualTo(1);
        assertThat(app.getCache().getHitCount()).isEqualTo(1);
    }

    @Test
    void changedInputFileRebuildsDataset() throws IOException {
        ConformanceApplication app = new ConformanceApplication(config(true));
        ConformedDataset first = app.conform();

        Files.writeString(dataDir.resolve("plant.csv"),
                "time_utc;net_energy_kwh;availability_kwh;curtailment_kwh\n2014-01-01T00:00:00Z;90;0;0\n");
        ConformedDataset second = app.conform();

        assertThat(second).isNotSameAs(first);
        assertThat(second.getMeter().size()).isEqualTo(1);
        assertThat(app.getCache().getMissCount()).isEqualTo(2);
    }

    @Test
    void disabledCacheAlwaysRebuilds() {
        ConformanceApplication app = new ConformanceApplication(config(false));

        assertThat(app.getCache()).isNull();
        assertThat(app.conform()).isNotSameAs(app.conform());
    }

    @Test
    void extractsArchiveOnFirstRun() throws IOException {
        Path archiveDir = dir.resolve("zipped");
        Files.createDirectory(archiveDir);
        ConformancePipelineTest.writeFixtures(archiveDir, ConformancePipelineTest.SCADA);
        Path zip = dir.resolve("la_haute_borne.zip");
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(zip))) {
            for (String name : new String[]{"scada.csv", "plant.csv", "era5.csv", "assets.csv"}) {
                out.putNextEntry(new ZipEntry(name));
                out.write(Files.readAllBytes(archiveDir.resolve(name)));
                out.closeEntry();
            }
        }
        Properties props = new Properties();
        props.setProperty("data.root", dir.resolve("la_haute_borne").toString());
        props.setProperty("meta.contract.path", contractFile.toString());

        ConformedDataset dataset = new ConformanceApplication(AppConfig.fromProperties(props)).conform();

        assertThat(dir.resolve("la_haute_borne").resolve("scada.csv")).exists();
        assertThat(dataset.getScada().size()).isEqualTo(14);
    }

    @Test
    void defaultContractDescribesLaHauteBorne() {
        AppConfig defaults = AppConfig.fromProperties(new Properties());

        assertThat(ConformanceApplication.loadContract(defaults).getSources())
                .containsKeys("scada", "meter", "curtail", "era5", "merra2");
    }

    @Test
    void registersAllBuiltinOperators() {
        DefaultFunctionManager functionManager = new DefaultFunctionManager();

        ConformanceApplication.registerBuiltinOperators(functionManager);

        assertThat(functionManager.getFunctionIds()).hasSize(7);
    }
}
