package com.lux032.genreenricher.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次多来源查询的合并结果
 */
@Data
public class LookupResult {

    private final String artist;
    private final String title;
    private final List<GenreSignal> signals = new ArrayList<>();
    private final Map<String, SourceStatus> sourceStatuses = new LinkedHashMap<>();
    private final Map<String, String> sourceErrors = new LinkedHashMap<>();
    private String year;
    private String yearSource;
    private String album;
    private String albumSource;

    public void addSignal(GenreSignal signal) {
        signals.add(signal);
    }

    public void markSource(String source, SourceStatus status) {
        sourceStatuses.put(source, status);
    }

    public void markSourceError(String source, String error) {
        sourceStatuses.put(source, SourceStatus.ERROR);
        sourceErrors.put(source, error);
    }

    /**
     * 所有被调用的来源都失败(跳过的来源也算不可用)
     */
    public boolean allSourcesFailed() {
        if (sourceStatuses.isEmpty()) {
            return true;
        }
        return sourceStatuses.values().stream()
            .noneMatch(status -> status == SourceStatus.OK || status == SourceStatus.NO_DATA);
    }

    public long countSources(SourceStatus status) {
        return sourceStatuses.values().stream().filter(s -> s == status).count();
    }

    /**
     * 简短的来源摘要, 例如 "MusicBrainz:OK, Last.fm:ERROR"
     */
    public String sourceSummary() {
        StringBuilder sb = new StringBuilder();
        sourceStatuses.forEach((source, status) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(source).append(':').append(status);
        });
        return sb.toString();
    }
}
