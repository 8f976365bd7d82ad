package com.lux032.genreenricher.model;

import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 信号聚合结果
 * genres 按置信度降序; thresholdUsed 是实际使用的置信度下限(可能因自适应放宽而低于请求值)
 */
@Data
public class AggregatedResult {

    public static final String NO_VALID_GENRES = "no valid genres";

    private final List<String> genres;
    private final double thresholdUsed;
    private final Map<String, Double> candidates;
    private final String failureReason;

    public static AggregatedResult of(List<String> genres, double thresholdUsed, Map<String, Double> candidates) {
        return new AggregatedResult(
            Collections.unmodifiableList(genres),
            thresholdUsed,
            Collections.unmodifiableMap(new LinkedHashMap<>(candidates)),
            null);
    }

    public static AggregatedResult noGenres(String reason, double thresholdUsed) {
        return new AggregatedResult(Collections.emptyList(), thresholdUsed, Collections.emptyMap(), reason);
    }

    public boolean hasGenres() {
        return !genres.isEmpty();
    }

    /**
     * 写入标签时使用的格式
     */
    public String joinedGenres() {
        return String.join(";", genres);
    }
}
