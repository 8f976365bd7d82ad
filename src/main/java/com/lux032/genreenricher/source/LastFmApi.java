package com.lux032.genreenricher.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.RateLimiter;
import com.lux032.genreenricher.util.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Last.fm track.getInfo 客户端
 */
@Slf4j
public class LastFmApi extends AbstractHttpMusicApi {

    public static final String ID = "lastfm";

    // Last.fm 错误码: 6 参数无效(曲目不存在)
    private static final int ERROR_NOT_FOUND = 6;
    private static final int MAX_TAGS = 5;

    public LastFmApi(EnricherConfig config, RateLimiter rateLimiter) {
        super(config, rateLimiter);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Last.fm";
    }

    @Override
    public boolean isAvailable() {
        return !MetadataUtils.isBlank(config.getLastFmApiKey());
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String title) throws IOException {
        TrackInfo info = new TrackInfo(getName());
        if (!isAvailable()) {
            log.warn("Last.fm API key not configured, skipping query");
            return info;
        }

        String url = String.format("%s?method=track.getInfo&api_key=%s&artist=%s&track=%s&autocorrect=1&format=json",
            config.getLastFmApiUrl(), encode(config.getLastFmApiKey()), encode(artist), encode(title));
        JsonNode root = getJson(info, "default", url);
        if (root == null) {
            return info;
        }
        parseTrackInfo(root, info);
        return info;
    }

    /**
     * 解析 track.getInfo 响应
     * @throws IOException 响应携带除"未找到"以外的错误码
     */
    void parseTrackInfo(JsonNode root, TrackInfo info) throws IOException {
        if (root.has("error")) {
            int code = root.path("error").asInt();
            String message = root.path("message").asText("");
            if (code == ERROR_NOT_FOUND) {
                log.info("No track found on Last.fm: {}", message);
                return;
            }
            throw new IOException("Last.fm error " + code + ": " + message);
        }

        JsonNode track = root.path("track");
        JsonNode tags = track.path("toptags").path("tag");
        // 只有一个标签时 Last.fm 返回对象而不是数组
        if (tags.isObject()) {
            info.addGenre(tags.path("name").asText(null));
        } else if (tags.isArray()) {
            int count = 0;
            for (JsonNode tag : tags) {
                if (count++ >= MAX_TAGS) {
                    break;
                }
                info.addGenre(tag.path("name").asText(null));
            }
        }

        String album = track.path("album").path("title").asText("").trim();
        if (!album.isEmpty()) {
            info.setAlbum(album);
        }

        // Last.fm 没有发行日期字段, 用 wiki 发布时间兜底
        String year = MetadataUtils.extractYear(track.path("wiki").path("published").asText(null));
        if (year != null) {
            info.setYear(year);
        }
    }
}
