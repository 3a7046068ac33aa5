package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.exception.SourceReadException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;

/**
 * 数据集指纹：原始输入文件内容与生效配置的SHA-256摘要。
 * 文件按路径排序、配置按键排序参与摘要，与传入顺序无关。
 */
public final class DatasetFingerprint {

    private final String digest;

    private DatasetFingerprint(String digest) {
        this.digest = digest;
    }

    public static DatasetFingerprint of(Collection<Path> files, Properties configuration) {
        MessageDigest sha = newDigest();

        List<Path> sorted = new ArrayList<>();
        for (Path file : files) {
            sorted.add(file.toAbsolutePath().normalize());
        }
        sorted.sort(null);

        byte[] buffer = new byte[8192];
        for (Path file : sorted) {
            sha.update(file.getFileName().toString().getBytes(StandardCharsets.UTF_8));
            sha.update((byte) 0);
            try (InputStream in = Files.newInputStream(file)) {
                int read;
                while ((read = in.read(buffer)) > 0) {
                    sha.update(buffer, 0, read);
                }
            } catch (IOException e) {
                throw new SourceReadException(file, "Failed to fingerprint input file", e);
            }
            sha.update((byte) 0);
        }

        if (configuration != null) {
            for (String key : new TreeSet<>(configuration.stringPropertyNames())) {
                sha.update((key + "=" + configuration.getProperty(key) + "\n").getBytes(StandardCharsets.UTF_8));
            }
        }
        return new DatasetFingerprint(HexFormat.of().formatHex(sha.digest()));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String getDigest() { return digest; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatasetFingerprint)) return false;
        return digest.equals(((DatasetFingerprint) o).digest);
    }

    @Override
    public int hashCode() {
        return digest.hashCode();
    }

    @Override
    public String toString() {
        return digest.substring(0, 12);
    }
}
