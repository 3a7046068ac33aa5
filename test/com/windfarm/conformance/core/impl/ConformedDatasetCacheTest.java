package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.model.AssetTable;
import com.windfarm.conformance.model.ConformedDataset;
import com.windfarm.conformance.model.QualityReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

class ConformedDatasetCacheTest {

    @TempDir
    Path dir;

    private static ConformedDataset emptyDataset() {
        return new ConformedDataset(new AssetTable(List.of()), Map.of(), null, new QualityReport());
    }

    @Test
    void buildsOncePerFingerprint() throws IOException {
        Path input = Files.writeString(dir.resolve("scada.csv"), "Date_time\n");
        DatasetFingerprint fingerprint = DatasetFingerprint.of(List.of(input), new Properties());
        ConformedDatasetCache cache = new ConformedDatasetCache();
        AtomicInteger builds = new AtomicInteger();

        ConformedDataset first = cache.getOrBuild(fingerprint, () -> {
            builds.incrementAndGet();
            return emptyDataset();
        });
        ConformedDataset second = cache.getOrBuild(fingerprint, () -> {
            builds.incrementAndGet();
            return emptyDataset();
        });

        assertThat(second).isSameAs(first);
        assertThat(builds).hasValue(1);
        assertThat(cache.getMissCount()).isEqualTo(1);
        assertThat(cache.getHitCount()).isEqualTo(1);
    }

    @Test
    void failedBuildIsNotCached() throws IOException {
        Path input = Files.writeString(dir.resolve("scada.csv"), "Date_time\n");
        DatasetFingerprint fingerprint = DatasetFingerprint.of(List.of(input), new Properties());
        ConformedDatasetCache cache = new ConformedDatasetCache();

        assertThatThrownBy(() -> cache.getOrBuild(fingerprint, () -> {
            throw new IllegalStateException("unreadable");
        })).hasMessage("unreadable");

        assertThat(cache.size()).isZero();
        assertThat(cache.get(fingerprint)).isNull();
    }

    @Test
    void buildDoesNotBlockOtherFingerprints() throws Exception {
        DatasetFingerprint slow = DatasetFingerprint.of(
                List.of(Files.writeString(dir.resolve("slow.csv"), "a\n")), new Properties());
        DatasetFingerprint fast = DatasetFingerprint.of(
                List.of(Files.writeString(dir.resolve("fast.csv"), "b\n")), new Properties());
        ConformedDatasetCache cache = new ConformedDatasetCache();
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger slowBuilds = new AtomicInteger();
        ConformedDataset slowDataset = emptyDataset();
        Supplier<ConformedDataset> slowBuilder = () -> {
            slowBuilds.incrementAndGet();
            building.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return slowDataset;
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<ConformedDataset> builder = executor.submit(() -> cache.getOrBuild(slow, slowBuilder));
            assertThat(building.await(10, TimeUnit.SECONDS)).isTrue();
            Future<ConformedDataset> waiter = executor.submit(() -> cache.getOrBuild(slow, slowBuilder));

            ConformedDataset other = cache.getOrBuild(fast, ConformedDatasetCacheTest::emptyDataset);
            assertThat(other).isNotNull();
            assertThat(cache.get(slow)).isNull();

            release.countDown();
            assertThat(builder.get(10, TimeUnit.SECONDS)).isSameAs(slowDataset);
            assertThat(waiter.get(10, TimeUnit.SECONDS)).isSameAs(slowDataset);
            assertThat(slowBuilds).hasValue(1);
            assertThat(cache.get(slow)).isSameAs(slowDataset);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void invalidateAndClear() throws IOException {
        Path input = Files.writeString(dir.resolve("scada.csv"), "Date_time\n");
        DatasetFingerprint fingerprint = DatasetFingerprint.of(List.of(input), new Properties());
        ConformedDatasetCache cache = new ConformedDatasetCache();
        cache.getOrBuild(fingerprint, ConformedDatasetCacheTest::emptyDataset);

        assertThat(cache.invalidate(fingerprint)).isTrue();
        assertThat(cache.invalidate(fingerprint)).isFalse();

        cache.getOrBuild(fingerprint, ConformedDatasetCacheTest::emptyDataset);
        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
