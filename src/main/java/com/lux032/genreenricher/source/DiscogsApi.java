package com.lux032.genreenricher.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.RateLimiter;
import com.lux032.genreenricher.util.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Discogs 数据库客户端
 * 搜索后优先选择标题同时包含艺术家和曲名的 master, 否则使用第一个 release
 */
@Slf4j
public class DiscogsApi extends AbstractHttpMusicApi {

    public static final String ID = "discogs";

    private static final int MAX_GENRES = 5;

    public DiscogsApi(EnricherConfig config, RateLimiter rateLimiter) {
        super(config, rateLimiter);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Discogs";
    }

    @Override
    public boolean isAvailable() {
        return !MetadataUtils.isBlank(config.getDiscogsToken());
    }

    @Override
    protected Map<String, String> requestHeaders() {
        return Collections.singletonMap("Authorization", "Discogs token=" + config.getDiscogsToken());
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String title) throws IOException {
        TrackInfo info = new TrackInfo(getName());
        if (!isAvailable()) {
            log.warn("Discogs token not configured, skipping query");
            return info;
        }

        String searchUrl = String.format("%s/database/search?q=%s&type=release&artist=%s&track=%s&per_page=5",
            config.getDiscogsApiUrl(), encode(artist + " - " + title), encode(artist), encode(title));
        JsonNode searchResult = getJson(info, "search", searchUrl);
        if (searchResult == null) {
            return info;
        }

        String releasePath = selectRelease(searchResult, artist, title);
        if (releasePath == null) {
            log.info("No results found on Discogs for {} - {}", artist, title);
            return info;
        }

        JsonNode release = getJson(info, "lookup", config.getDiscogsApiUrl() + "/" + releasePath);
        if (release != null) {
            applyRelease(release, info);
        }
        return info;
    }

    /**
     * 从搜索结果中选择发行
     * @return 形如 masters/123 或 releases/456 的路径, 没有合适结果时返回 null
     */
    String selectRelease(JsonNode searchResult, String artist, String title) {
        JsonNode results = searchResult.path("results");
        if (!results.isArray() || results.size() == 0) {
            return null;
        }

        String artistLower = artist.toLowerCase(Locale.ROOT);
        String titleLower = title.toLowerCase(Locale.ROOT);
        for (JsonNode item : results) {
            String itemTitle = item.path("title").asText("").toLowerCase(Locale.ROOT);
            if ("master".equals(item.path("type").asText())
                && itemTitle.contains(artistLower) && itemTitle.contains(titleLower)) {
                return "masters/" + item.path("id").asText();
            }
        }
        for (JsonNode item : results) {
            if ("release".equals(item.path("type").asText())) {
                return "releases/" + item.path("id").asText();
            }
        }
        return null;
    }

    /**
     * 读取 genres + styles, 年份优先取 year 字段, 其次 released 日期
     */
    void applyRelease(JsonNode release, TrackInfo info) {
        for (JsonNode genre : release.path("genres")) {
            if (info.getGenres().size() < MAX_GENRES) {
                info.addGenre(genre.asText(null));
            }
        }
        for (JsonNode style : release.path("styles")) {
            if (info.getGenres().size() < MAX_GENRES) {
                info.addGenre(style.asText(null));
            }
        }

        String year = null;
        if (release.path("year").asInt(0) > 0) {
            year = MetadataUtils.extractYear(release.path("year").asText());
        } else if (release.hasNonNull("released")) {
            year = MetadataUtils.extractYear(release.path("released").asText());
        }
        if (year != null) {
            info.setYear(year);
        }

        String album = release.path("title").asText("").trim();
        if (!album.isEmpty()) {
            info.setAlbum(album);
        }
    }
}
