package com.lux032.genreenricher.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.RateLimiter;
import com.lux032.genreenricher.util.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * MusicBrainz ws/2 客户端
 * 先搜索录音取标签, 再查询首个发行获取专辑和年份, 录音没有标签时退回到艺术家标签
 */
@Slf4j
public class MusicBrainzApi extends AbstractHttpMusicApi {

    public static final String ID = "musicbrainz";

    public MusicBrainzApi(EnricherConfig config, RateLimiter rateLimiter) {
        super(config, rateLimiter);
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "MusicBrainz";
    }

    @Override
    public TrackInfo getTrackInfo(String artist, String title) throws IOException {
        TrackInfo info = new TrackInfo(getName());

        String query = String.format("artist:\"%s\" AND recording:\"%s\"", escapeLucene(artist), escapeLucene(title));
        String searchUrl = String.format("%s/recording?query=%s&fmt=json&limit=1",
            config.getMusicBrainzApiUrl(), encode(query));
        JsonNode searchResult = getJson(info, "search", searchUrl);
        if (searchResult == null) {
            return info;
        }

        JsonNode recording = searchResult.path("recordings").path(0);
        if (recording.isMissingNode()) {
            log.info("No recording found on MusicBrainz for {} - {}", artist, title);
            return info;
        }
        applyTags(recording.path("tags"), info);

        String releaseId = recording.path("releases").path(0).path("id").asText(null);
        if (releaseId != null) {
            String releaseUrl = String.format("%s/release/%s?inc=release-groups&fmt=json",
                config.getMusicBrainzApiUrl(), releaseId);
            JsonNode release = getJson(info, "lookup", releaseUrl);
            if (release != null) {
                applyRelease(release, info);
            }
        }

        if (info.getGenres().isEmpty()) {
            String artistId = recording.path("artist-credit").path(0).path("artist").path("id").asText(null);
            if (artistId != null) {
                String artistUrl = String.format("%s/artist/%s?inc=tags&fmt=json",
                    config.getMusicBrainzApiUrl(), artistId);
                JsonNode artistNode = getJson(info, "lookup", artistUrl);
                if (artistNode != null) {
                    applyTags(artistNode.path("tags"), info);
                }
            }
        }

        log.debug("MusicBrainz result for {} - {}: genres={}, year={}, album={}",
            artist, title, info.getGenres(), info.getYear(), info.getAlbum());
        return info;
    }

    /**
     * 按投票数降序添加标签
     */
    void applyTags(JsonNode tags, TrackInfo info) {
        if (!tags.isArray()) {
            return;
        }
        List<JsonNode> sorted = new ArrayList<>();
        tags.forEach(sorted::add);
        sorted.sort((a, b) -> Integer.compare(b.path("count").asInt(0), a.path("count").asInt(0)));
        for (JsonNode tag : sorted) {
            info.addGenre(tag.path("name").asText(null));
        }
    }

    /**
     * 从发行中取专辑名和年份, 发行日期缺失时使用发行组的首发日期
     */
    void applyRelease(JsonNode release, TrackInfo info) {
        String album = release.path("title").asText("").trim();
        if (!album.isEmpty()) {
            info.setAlbum(album);
        }
        String year = MetadataUtils.extractYear(release.path("date").asText(null));
        if (year == null) {
            year = MetadataUtils.extractYear(release.path("release-group").path("first-release-date").asText(null));
        }
        if (year != null) {
            info.setYear(year);
        }
    }

    static String escapeLucene(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
