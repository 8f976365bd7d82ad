package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.TrackInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersistentCacheTest {

    @TempDir
    Path tempDir;

    private AtomicLong now;
    private PersistentCache cache;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000_000L);
        cache = new PersistentCache(tempDir.resolve("cache"), Duration.ofHours(1), now::get);
    }

    private static TrackInfo sample() {
        TrackInfo info = new TrackInfo("Discogs");
        info.setGenres(Arrays.asList("Electronic", "Synth-pop"));
        info.setYear("1983");
        info.setAlbum("Power, Corruption & Lies");
        info.setRateLimited(true);
        return info;
    }

    @Test
    void shouldBuildCaseInsensitiveKeys() {
        String key = PersistentCache.buildKey("discogs", "New Order", "Age of Consent");

        assertThat(key).isEqualTo(PersistentCache.buildKey("DISCOGS", "new order", "AGE OF CONSENT"));
        assertThat(key).hasSize(32).isNotEqualTo(PersistentCache.buildKey("lastfm", "New Order", "Age of Consent"));
    }

    @Test
    void shouldStoreAndReadEntries() {
        String key = PersistentCache.buildKey("discogs", "New Order", "Age of Consent");

        cache.set(key, sample());
        TrackInfo cached = cache.get(key);

        assertThat(cached.getGenres()).containsExactly("Electronic", "Synth-pop");
        assertThat(cached.getYear()).isEqualTo("1983");
        assertThat(cached.getAlbum()).isEqualTo("Power, Corruption & Lies");
        assertThat(cached.getSourceApi()).isEqualTo("Discogs");
        assertThat(cached.isRateLimited()).isFalse();
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        cache.set("k", sample());

        now.addAndGet(Duration.ofHours(1).toMillis());

        assertThat(cache.get("k")).isNull();
        assertThat(Files.exists(tempDir.resolve("cache").resolve("k.json"))).isFalse();
    }

    @Test
    void shouldTreatCorruptEntryAsMiss() throws Exception {
        Files.write(tempDir.resolve("cache").resolve("broken.json"), "{oops".getBytes(StandardCharsets.UTF_8));

        assertThat(cache.get("broken")).isNull();
    }

    @Test
    void shouldDeleteAndClearEntries() {
        cache.set("a", sample());
        cache.set("b", sample());
        cache.set("c", sample());

        assertThat(cache.delete("a")).isTrue();
        assertThat(cache.delete("a")).isFalse();
        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.get("b")).isNull();
    }

    @Test
    void shouldCleanupOnlyExpiredEntries() {
        cache.set("old", sample());
        now.addAndGet(Duration.ofMinutes(50).toMillis());
        cache.set("fresh", sample());
        now.addAndGet(Duration.ofMinutes(20).toMillis());

        assertThat(cache.cleanup()).isEqualTo(1);
        assertThat(cache.get("fresh")).isNotNull();
    }

    @Test
    void shouldTrackStatistics() {
        cache.set("a", sample());
        cache.get("a");
        cache.get("missing");

        PersistentCache.CacheStatistics stats = cache.getStatistics();

        assertThat(stats.totalEntries).isEqualTo(1);
        assertThat(stats.totalSizeBytes).isPositive();
        assertThat(stats.hits).isEqualTo(1);
        assertThat(stats.misses).isEqualTo(1);
        assertThat(stats.getHitRate()).isEqualTo(0.5);
    }

    @Test
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> new PersistentCache(tempDir, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
