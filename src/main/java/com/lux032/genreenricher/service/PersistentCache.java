package com.lux032.genreenricher.service;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.util.MetadataUtils;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 来源查询结果的磁盘缓存
 * 每个 key 一个 JSON 文件, 文件名为 key 本身(MD5), 过期时间由缓存统一管理
 */
@Slf4j
public class PersistentCache {

    private static final String SUFFIX = ".json";

    private final Path cacheDirectory;
    private final long ttlMillis;
    private final LongSupplier millisClock;
    private final Gson gson = new Gson();
    private final Object lock = new Object();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * 缓存文件内容
     */
    @Data
    static class CacheEntry {
        private long createdAt;
        private long expiresAt;
        private TrackInfo value;
    }

    public PersistentCache(Path cacheDirectory, Duration ttl) {
        this(cacheDirectory, ttl, System::currentTimeMillis);
    }

    PersistentCache(Path cacheDirectory, Duration ttl, LongSupplier millisClock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.cacheDirectory = cacheDirectory;
        this.ttlMillis = ttl.toMillis();
        this.millisClock = millisClock;

        try {
            Files.createDirectories(cacheDirectory);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create cache directory " + cacheDirectory, e);
        }
        log.info("Persistent cache initialized at {} (ttl={}s)", cacheDirectory, ttl.getSeconds());
    }

    /**
     * 计算缓存 key: MD5(source|artist|title), 大小写不敏感
     */
    public static String buildKey(String source, String artist, String title) {
        String raw = String.join("|", source, artist, title).toLowerCase(Locale.ROOT);
        return MetadataUtils.md5Hex(raw);
    }

    /**
     * 读取缓存
     * @return 未命中、已过期或文件损坏时返回 null
     */
    public TrackInfo get(String key) {
        Path file = fileFor(key);
        synchronized (lock) {
            if (!Files.exists(file)) {
                misses.incrementAndGet();
                return null;
            }
            CacheEntry entry = readEntry(file);
            if (entry == null || entry.getExpiresAt() <= millisClock.getAsLong()) {
                deleteQuietly(file);
                misses.incrementAndGet();
                return null;
            }
            hits.incrementAndGet();
            return entry.getValue();
        }
    }

    /**
     * 写入缓存, 先写临时文件再替换
     */
    public void set(String key, TrackInfo value) {
        long now = millisClock.getAsLong();
        CacheEntry entry = new CacheEntry();
        entry.setCreatedAt(now);
        entry.setExpiresAt(now + ttlMillis);
        entry.setValue(value);

        Path file = fileFor(key);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        synchronized (lock) {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                gson.toJson(entry, writer);
            } catch (IOException e) {
                log.error("Failed to write cache entry {}: {}", key, e.getMessage());
                deleteQuietly(temp);
                return;
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.error("Failed to commit cache entry {}: {}", key, e.getMessage());
                deleteQuietly(temp);
            }
        }
    }

    public boolean delete(String key) {
        synchronized (lock) {
            return deleteQuietly(fileFor(key));
        }
    }

    /**
     * 清空全部缓存
     * @return 删除的条目数
     */
    public int clear() {
        int removed = 0;
        synchronized (lock) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory, "*" + SUFFIX)) {
                for (Path file : stream) {
                    if (deleteQuietly(file)) {
                        removed++;
                    }
                }
            } catch (IOException e) {
                log.error("Failed to clear cache directory {}", cacheDirectory, e);
            }
        }
        log.info("Cleared {} cache entries", removed);
        return removed;
    }

    /**
     * 删除过期和损坏的条目
     * @return 删除的条目数
     */
    public int cleanup() {
        int removed = 0;
        long now = millisClock.getAsLong();
        synchronized (lock) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory, "*" + SUFFIX)) {
                for (Path file : stream) {
                    CacheEntry entry = readEntry(file);
                    if ((entry == null || entry.getExpiresAt() <= now) && deleteQuietly(file)) {
                        removed++;
                    }
                }
            } catch (IOException e) {
                log.error("Failed to clean cache directory {}", cacheDirectory, e);
            }
        }
        if (removed > 0) {
            log.info("Removed {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * 获取缓存统计信息
     */
    public CacheStatistics getStatistics() {
        CacheStatistics stats = new CacheStatistics();
        stats.hits = hits.get();
        stats.misses = misses.get();
        synchronized (lock) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(cacheDirectory, "*" + SUFFIX)) {
                for (Path file : stream) {
                    stats.totalEntries++;
                    stats.totalSizeBytes += Files.size(file);
                }
            } catch (IOException e) {
                log.error("Failed to read cache statistics from {}", cacheDirectory, e);
            }
        }
        return stats;
    }

    private Path fileFor(String key) {
        return cacheDirectory.resolve(key + SUFFIX);
    }

    private CacheEntry readEntry(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, CacheEntry.class);
        } catch (IOException | JsonParseException e) {
            log.warn("Corrupt cache file {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete cache file {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * 缓存统计信息
     */
    public static class CacheStatistics {
        public long totalEntries;
        public long totalSizeBytes;
        public long hits;
        public long misses;

        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        @Override
        public String toString() {
            return String.format("entries=%d, size=%d bytes, hits=%d, misses=%d, hitRate=%.1f%%",
                totalEntries, totalSizeBytes, hits, misses, getHitRate() * 100);
        }
    }
}
