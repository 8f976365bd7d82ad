package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.CircuitBreaker;
import com.lux032.genreenricher.pipeline.MetricsTracker;
import com.lux032.genreenricher.source.MusicApi;
import com.lux032.genreenricher.source.SourceRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MusicSourceGatewayTest {

    @Mock
    private MusicApi api;

    @TempDir
    Path tempDir;

    private CircuitBreaker breaker;
    private MetricsTracker metrics;
    private PersistentCache cache;
    private MusicSourceGateway gateway;

    @BeforeEach
    void setUp() {
        when(api.getId()).thenReturn("musicbrainz");
        when(api.getName()).thenReturn("MusicBrainz");
        when(api.isAvailable()).thenReturn(true);

        breaker = new CircuitBreaker("MusicBrainz", 2, Duration.ZERO);
        metrics = new MetricsTracker(tempDir.resolve("metrics.json"));
        cache = new PersistentCache(tempDir.resolve("cache"), Duration.ofHours(1));
        gateway = new MusicSourceGateway(api, breaker, metrics, cache);
    }

    private static TrackInfo rockInfo() {
        TrackInfo info = new TrackInfo("MusicBrainz");
        info.setGenres(Collections.singletonList("Rock"));
        return info;
    }

    @Test
    void shouldRecordSuccessAndCacheResult() throws Exception {
        when(api.getTrackInfo("Queen", "Bohemian Rhapsody")).thenReturn(rockInfo());

        TrackInfo first = gateway.lookup("Queen", "Bohemian Rhapsody");
        TrackInfo second = gateway.lookup("queen", "bohemian rhapsody");

        assertThat(first.getGenres()).containsExactly("Rock");
        assertThat(second.getGenres()).containsExactly("Rock");
        verify(api, times(1)).getTrackInfo(anyString(), anyString());
        assertThat(metrics.getMetrics("MusicBrainz").getTotalCalls()).isEqualTo(1);
        assertThat(metrics.getMetrics("MusicBrainz").getSuccessRate()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordRateLimitedCall() throws Exception {
        TrackInfo info = rockInfo();
        info.setRateLimited(true);
        when(api.getTrackInfo("A", "B")).thenReturn(info);

        gateway.lookup("A", "B");

        assertThat(metrics.getRawMetrics("MusicBrainz").getRateLimitHits()).isEqualTo(1);
    }

    @Test
    void shouldRecordFailureAndRethrow() throws Exception {
        when(api.getTrackInfo("A", "B")).thenThrow(new IOException("503"));

        assertThatThrownBy(() -> gateway.lookup("A", "B")).isInstanceOf(IOException.class).hasMessage("503");

        assertThat(breaker.getFailureCount()).isEqualTo(1);
        assertThat(metrics.getRawMetrics("MusicBrainz").getFailedCalls()).isEqualTo(1);
    }

    @Test
    void shouldCountRateLimitHitOnFailedCall() throws Exception {
        when(api.getTrackInfo("A", "B"))
            .thenThrow(new SourceRequestException("503", new IOException("503"), true));

        assertThatThrownBy(() -> gateway.lookup("A", "B")).isInstanceOf(SourceRequestException.class);

        assertThat(metrics.getRawMetrics("MusicBrainz").getFailedCalls()).isEqualTo(1);
        assertThat(metrics.getRawMetrics("MusicBrainz").getRateLimitHits()).isEqualTo(1);
    }

    @Test
    void shouldWrapUnexpectedRuntimeErrors() throws Exception {
        when(api.getTrackInfo("A", "B")).thenThrow(new IllegalStateException("bad json"));

        assertThatThrownBy(() -> gateway.lookup("A", "B"))
            .isInstanceOf(IOException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(breaker.getFailureCount()).isEqualTo(1);
    }

    @Test
    void shouldSkipCallsWhileBreakerOpen() throws Exception {
        when(api.getTrackInfo("A", "B")).thenThrow(new IOException("down"));
        for (int i = 0; i < 2; i++) {
            try {
                gateway.lookup("A", "B");
            } catch (IOException expected) {
                // 预期失败
            }
        }
        assertThat(breaker.isOpen()).isTrue();

        assertThat(gateway.lookup("A", "B")).isNull();

        verify(api, times(2)).getTrackInfo("A", "B");
        assertThat(metrics.getMetrics("MusicBrainz").getTotalCalls()).isEqualTo(2);
    }

    @Test
    void shouldCloseBreakerOnSuccess() throws Exception {
        when(api.getTrackInfo("A", "B")).thenThrow(new IOException("flaky"));
        when(api.getTrackInfo("C", "D")).thenReturn(rockInfo());

        assertThatThrownBy(() -> gateway.lookup("A", "B")).isInstanceOf(IOException.class);
        gateway.lookup("C", "D");

        assertThat(breaker.getFailureCount()).isZero();
    }

    @Test
    void shouldSkipUnavailableSource() throws Exception {
        when(api.isAvailable()).thenReturn(false);

        assertThat(gateway.lookup("A", "B")).isNull();

        verify(api, never()).getTrackInfo(anyString(), anyString());
    }

    @Test
    void shouldWorkWithoutCache() throws Exception {
        MusicSourceGateway uncached = new MusicSourceGateway(api, breaker, metrics, null);
        when(api.getTrackInfo("A", "B")).thenReturn(null);

        TrackInfo info = uncached.lookup("A", "B");

        assertThat(info.isEmpty()).isTrue();
        assertThat(info.getSourceApi()).isEqualTo("MusicBrainz");
    }
}
