package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.model.ConformedDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 一致化数据集缓存，按数据集指纹索引。
 *
 * 由编排层持有，流水线本身不保存任何状态。数据集不可变，
 * 可以在多个分析之间直接共享。
 */
public class ConformedDatasetCache {

    private static final Logger log = LoggerFactory.getLogger(ConformedDatasetCache.class);

    /** 指纹 -> 数据集，构建中的条目尚未完成 */
    private final ConcurrentHashMap<DatasetFingerprint, CompletableFuture<ConformedDataset>> datasets =
            new ConcurrentHashMap<>();

    // ---- 统计 ----
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * 返回指纹对应的数据集；不存在时在调用线程上执行builder，同一指纹在进程内最多构建一次。
     * 同一指纹的其他调用者等待该次构建，其他指纹不受影响。
     * 构建失败时异常原样抛给所有等待者，不缓存任何结果。
     */
    public ConformedDataset getOrBuild(DatasetFingerprint fingerprint, Supplier<ConformedDataset> builder) {
        CompletableFuture<ConformedDataset> created = new CompletableFuture<>();
        CompletableFuture<ConformedDataset> existing = datasets.putIfAbsent(fingerprint, created);
        if (existing != null) {
            hits.incrementAndGet();
            log.info("Conformed dataset cache hit for fingerprint {}", fingerprint);
            return await(existing);
        }

        misses.incrementAndGet();
        log.info("Conformed dataset cache miss for fingerprint {}, building", fingerprint);
        try {
            ConformedDataset dataset = builder.get();
            created.complete(dataset);
            return dataset;
        } catch (RuntimeException | Error e) {
            datasets.remove(fingerprint, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    private static ConformedDataset await(CompletableFuture<ConformedDataset> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /** 已构建完成的数据集，不存在或仍在构建时返回null */
    public ConformedDataset get(DatasetFingerprint fingerprint) {
        CompletableFuture<ConformedDataset> future = datasets.get(fingerprint);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return null;
        }
        return future.join();
    }

    public boolean invalidate(DatasetFingerprint fingerprint) {
        boolean removed = datasets.remove(fingerprint) != null;
        if (removed) {
            log.info("Invalidated conformed dataset {}", fingerprint);
        }
        return removed;
    }

    public void clear() {
        int size = datasets.size();
        datasets.clear();
        log.info("Conformed dataset cache cleared, {} entries removed", size);
    }

    public int size() { return datasets.size(); }
    public long getHitCount() { return hits.get(); }
    public long getMissCount() { return misses.get(); }
}
