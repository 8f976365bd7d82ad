package com.lux032.genreenricher.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricsTrackerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldComputeDerivedMetrics() {
        MetricsTracker tracker = new MetricsTracker(tempDir.resolve("metrics.json"));

        tracker.recordApiCall("MusicBrainz", true, 0.5, false);
        tracker.recordApiCall("MusicBrainz", true, 1.5, true);
        tracker.recordApiCall("MusicBrainz", false, 1.0, false);
        tracker.recordApiCall("MusicBrainz", true, 1.0, true);

        MetricsSnapshot snapshot = tracker.getMetrics("MusicBrainz");
        assertThat(snapshot.getTotalCalls()).isEqualTo(4);
        assertThat(snapshot.getSuccessRate()).isCloseTo(0.75, within(1e-9));
        assertThat(snapshot.getAvgLatency()).isCloseTo(1.0, within(1e-9));
        assertThat(snapshot.getRateLimitRatio()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void shouldReturnZerosForUnknownSource() {
        MetricsTracker tracker = new MetricsTracker(tempDir.resolve("metrics.json"));

        assertThat(tracker.getMetrics("Discogs")).isEqualTo(MetricsSnapshot.EMPTY);
    }

    @Test
    void shouldPersistSnakeCaseJsonAfterEveryCall() throws Exception {
        Path file = tempDir.resolve("metrics.json");
        MetricsTracker tracker = new MetricsTracker(file);

        tracker.recordApiCall("Last.fm", true, 0.25);

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        JsonNode lastFm = root.path("Last.fm");
        assertThat(lastFm.path("total_calls").asLong()).isEqualTo(1);
        assertThat(lastFm.path("successful_calls").asLong()).isEqualTo(1);
        assertThat(lastFm.path("failed_calls").asLong()).isZero();
        assertThat(lastFm.path("total_latency").asDouble()).isEqualTo(0.25);
        assertThat(lastFm.path("rate_limit_hits").asLong()).isZero();
        assertThat(Files.exists(tempDir.resolve("metrics.json.tmp"))).isFalse();
    }

    @Test
    void shouldMergeCountersLoadedFromDisk() {
        Path file = tempDir.resolve("metrics.json");
        MetricsTracker first = new MetricsTracker(file);
        first.recordApiCall("Discogs", true, 1.0);
        first.recordApiCall("Discogs", false, 2.0);

        MetricsTracker second = new MetricsTracker(file);
        second.recordApiCall("Discogs", true, 3.0);

        ApiMetrics raw = second.getRawMetrics("Discogs");
        assertThat(raw.getTotalCalls()).isEqualTo(3);
        assertThat(raw.getSuccessfulCalls()).isEqualTo(2);
        assertThat(raw.getFailedCalls()).isEqualTo(1);
        assertThat(raw.getTotalLatency()).isEqualTo(6.0);
    }

    @Test
    void shouldTreatCorruptFileAsEmpty() throws Exception {
        Path file = tempDir.resolve("metrics.json");
        Files.write(file, "{ not json".getBytes(StandardCharsets.UTF_8));

        MetricsTracker tracker = new MetricsTracker(file);

        assertThat(tracker.getSources()).isEmpty();
        tracker.recordApiCall("MusicBrainz", true, 0.1);
        assertThat(tracker.getMetrics("MusicBrainz").getTotalCalls()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreUnknownFieldsInFile() throws Exception {
        Path file = tempDir.resolve("metrics.json");
        String json = "{\"MusicBrainz\": {\"total_calls\": 2, \"successful_calls\": 2, \"failed_calls\": 0,"
            + " \"total_latency\": 1.0, \"rate_limit_hits\": 1, \"legacy\": true}}";
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));

        MetricsTracker tracker = new MetricsTracker(file);

        assertThat(tracker.getMetrics("MusicBrainz").getTotalCalls()).isEqualTo(2);
        assertThat(tracker.getMetrics("MusicBrainz").getRateLimitRatio()).isEqualTo(0.5);
    }

    @Test
    void shouldResetOneOrAllSources() {
        MetricsTracker tracker = new MetricsTracker(tempDir.resolve("metrics.json"));
        tracker.recordApiCall("A", true, 0.1);
        tracker.recordApiCall("B", true, 0.1);

        tracker.resetMetrics("A");
        assertThat(tracker.getSources()).containsExactly("B");

        tracker.resetMetrics(null);
        assertThat(tracker.getSources()).isEmpty();
        assertThat(new MetricsTracker(tempDir.resolve("metrics.json")).getSources()).isEmpty();
    }
}
