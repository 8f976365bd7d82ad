package com.lux032.genreenricher.source;

import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.RateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MusicBrainzApiTest {

    private final List<FixtureApi> apis = new ArrayList<>();

    @AfterEach
    void tearDown() throws IOException {
        for (FixtureApi api : apis) {
            api.close();
        }
    }

    static String fixture(String name) throws IOException {
        try (InputStream in = MusicBrainzApiTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * 按 URL 片段返回固定响应, 未匹配的 URL 视为 404
     */
    static class FixtureApi extends MusicBrainzApi {
        final Map<String, String> responses = new LinkedHashMap<>();
        final List<String> requested = new ArrayList<>();
        IOException failure;

        FixtureApi(RateLimiter rateLimiter) {
            super(EnricherConfig.defaults(), rateLimiter);
        }

        @Override
        protected String fetch(String url, Map<String, String> headers) throws IOException {
            requested.add(url);
            if (failure != null) {
                throw failure;
            }
            for (Map.Entry<String, String> entry : responses.entrySet()) {
                if (url.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
            return null;
        }
    }

    private FixtureApi api(RateLimiter rateLimiter) {
        FixtureApi api = new FixtureApi(rateLimiter);
        apis.add(api);
        return api;
    }

    @Test
    void shouldReadTagsAndRelease() throws IOException {
        FixtureApi api = api(null);
        api.responses.put("/recording?", fixture("musicbrainz-recording.json"));
        api.responses.put("/release/rel-1", fixture("musicbrainz-release.json"));

        TrackInfo info = api.getTrackInfo("Queen", "Bohemian Rhapsody");

        assertThat(info.getSourceApi()).isEqualTo("MusicBrainz");
        assertThat(info.getGenres()).containsExactly("rock", "classic rock", "progressive rock");
        assertThat(info.getAlbum()).isEqualTo("A Night at the Opera");
        assertThat(info.getYear()).isEqualTo("1975");
        assertThat(api.requested).hasSize(2);
        assertThat(api.requested.get(0)).contains("fmt=json").contains("limit=1");
    }

    @Test
    void shouldFallBackToArtistTags() throws IOException {
        FixtureApi api = api(null);
        api.responses.put("/recording?", fixture("musicbrainz-recording-untagged.json"));
        api.responses.put("/artist/art-1", fixture("musicbrainz-artist.json"));

        TrackInfo info = api.getTrackInfo("Queen", "Untagged Song");

        assertThat(info.getGenres()).containsExactly("glam rock", "rock");
        assertThat(info.getYear()).isNull();
    }

    @Test
    void shouldReturnEmptyWhenNothingFound() throws IOException {
        FixtureApi api = api(null);
        api.responses.put("/recording?", "{\"recordings\": []}");

        TrackInfo info = api.getTrackInfo("Nobody", "Nothing");

        assertThat(info.isEmpty()).isTrue();
    }

    @Test
    void shouldPropagateHttpErrors() {
        FixtureApi api = api(null);
        api.failure = new IOException("MusicBrainz API request failed: 503");

        assertThatThrownBy(() -> api.getTrackInfo("Queen", "Bohemian Rhapsody"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("503");
    }

    @Test
    void shouldFlagRateLimitedRequests() throws IOException {
        RateLimiter rateLimiter = new RateLimiter();
        rateLimiter.createLimit("musicbrainz_search", 1, 10);
        FixtureApi api = api(rateLimiter);
        api.responses.put("/recording?", "{\"recordings\": []}");

        TrackInfo first = api.getTrackInfo("Queen", "One");
        // 取走刚补充的令牌, 下一次请求必须等待
        assertThat(rateLimiter.acquire("musicbrainz_search")).isTrue();
        TrackInfo second = api.getTrackInfo("Queen", "Two");

        assertThat(first.isRateLimited()).isFalse();
        assertThat(second.isRateLimited()).isTrue();
        assertThat(api.requested).hasSize(2);
    }

    @Test
    void shouldMarkFailureAfterWaitingForToken() {
        RateLimiter rateLimiter = new RateLimiter();
        rateLimiter.createLimit("musicbrainz_search", 1, 10);
        assertThat(rateLimiter.acquire("musicbrainz_search")).isTrue();
        FixtureApi api = api(rateLimiter);
        api.failure = new IOException("MusicBrainz API request failed: 503");

        assertThatThrownBy(() -> api.getTrackInfo("Queen", "Bohemian Rhapsody"))
            .isInstanceOfSatisfying(SourceRequestException.class, e -> assertThat(e.isRateLimited()).isTrue())
            .hasMessageContaining("503");
    }

    @Test
    void shouldKeepPlainFailureWithoutWaiting() {
        FixtureApi api = api(null);
        api.failure = new IOException("MusicBrainz API request failed: 503");

        assertThatThrownBy(() -> api.getTrackInfo("Queen", "Bohemian Rhapsody"))
            .isNotInstanceOf(SourceRequestException.class);
    }

    @Test
    void shouldEscapeQuotesInQuery() {
        assertThat(MusicBrainzApi.escapeLucene("12\" Mix")).isEqualTo("12\\\" Mix");
    }
}
