package com.windfarm.conformance.source;

import com.windfarm.conformance.exception.SourceReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * 数据压缩包解压。
 *
 * 数据目录不存在而同名zip存在时，将 &lt;dir&gt;.zip 解压到 &lt;dir&gt;；目录已存在时不做任何事。
 * 先解压到临时目录再整体改名，中途失败不会留下半成品目录。
 */
public class ArchiveExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArchiveExtractor.class);

    /**
     * @param dataDir 数据目录
     * @return 是否执行了解压
     * @throws SourceReadException 目录和压缩包都不存在，或解压失败
     */
    public boolean extractIfMissing(Path dataDir) {
        if (Files.isDirectory(dataDir)) {
            log.debug("Data directory {} exists, extraction skipped", dataDir);
            return false;
        }
        Path archive = dataDir.resolveSibling(dataDir.getFileName() + ".zip");
        if (!Files.isRegularFile(archive)) {
            throw new SourceReadException(dataDir, "Data directory not found and no archive " + archive.getFileName());
        }

        Path staging = dataDir.resolveSibling(dataDir.getFileName() + ".extracting");
        try {
            deleteRecursively(staging);
            Files.createDirectories(staging);
            int entries = unzip(archive, staging);
            Files.move(staging, dataDir, StandardCopyOption.ATOMIC_MOVE);
            log.info("Extracted {} entries from {} into {}", entries, archive, dataDir);
            return true;
        } catch (IOException e) {
            try {
                deleteRecursively(staging);
            } catch (IOException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            throw new SourceReadException(archive, "Failed to extract archive", e);
        }
    }

    private static int unzip(Path archive, Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        int count = 0;
        try (InputStream in = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path resolved = root.resolve(entry.getName()).normalize();
                if (!resolved.startsWith(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(resolved);
                } else {
                    Files.createDirectories(resolved.getParent());
                    Files.copy(zip, resolved, StandardCopyOption.REPLACE_EXISTING);
                    count++;
                }
                zip.closeEntry();
            }
        }
        return count;
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        if (Files.isDirectory(path)) {
            try (var children = Files.list(path)) {
                for (Path child : (Iterable<Path>) children::iterator) {
                    deleteRecursively(child);
                }
            }
        }
        Files.delete(path);
    }
}
