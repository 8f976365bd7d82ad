package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.AggregatedResult;
import com.lux032.genreenricher.model.GenreSignal;
import com.lux032.genreenricher.model.LookupResult;
import com.lux032.genreenricher.model.SourceStatus;
import com.lux032.genreenricher.util.GenreNameUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 流派信号聚合
 * 把多个来源的原始标签清洗成候选流派, 再按置信度挑选最终流派
 */
@Slf4j
public class GenreSignalAggregator {

    public static final int DEFAULT_MAX_TAGS = 100;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.2;
    private static final double RELAXATION_STEP = 0.2;

    private final int maxTags;
    private final double minConfidence;
    private final DynamicThresholdCalculator thresholdCalculator;

    public GenreSignalAggregator() {
        this(DEFAULT_MAX_TAGS, DEFAULT_MIN_CONFIDENCE, null);
    }

    /**
     * @param thresholdCalculator 为 null 时始终使用调用方给出的阈值
     */
    public GenreSignalAggregator(int maxTags, double minConfidence, DynamicThresholdCalculator thresholdCalculator) {
        this.maxTags = maxTags;
        this.minConfidence = minConfidence;
        this.thresholdCalculator = thresholdCalculator;
    }

    /**
     * 合并信号, 同一原始标签保留最高置信度
     */
    public Map<String, Double> mergeSignals(List<GenreSignal> signals) {
        Map<String, Double> merged = new LinkedHashMap<>();
        for (GenreSignal signal : signals) {
            if (signal.getRawTag() != null) {
                merged.merge(signal.getRawTag(), signal.getConfidence(), Math::max);
            }
        }
        return merged;
    }

    /**
     * 清洗原始标签
     * @param rawGenres 原始标签 → 置信度
     * @return 候选流派 → 置信度, 按置信度降序
     */
    public Map<String, Double> processGenres(Map<String, Double> rawGenres) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(rawGenres.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        if (entries.size() > maxTags) {
            entries = entries.subList(0, maxTags);
        }

        Map<String, Double> candidates = new LinkedHashMap<>();
        Map<String, String> namesByKey = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : entries) {
            for (String name : GenreNameUtils.cleanAndSplitGenrePayload(entry.getKey())) {
                String key = name.toLowerCase(Locale.ROOT);
                String existing = namesByKey.get(key);
                if (existing == null) {
                    namesByKey.put(key, name);
                    candidates.put(name, entry.getValue());
                } else if (entry.getValue() > candidates.get(existing)) {
                    candidates.put(existing, entry.getValue());
                }
            }
        }
        return sortByConfidence(candidates);
    }

    /**
     * 挑选置信度不低于阈值的流派
     * @return 按置信度降序, 最多 maxGenres 个, 大小写不敏感去重
     */
    public List<String> selectGenres(Map<String, Double> candidates, double confidence, int maxGenres) {
        List<String> selected = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, Double> entry : sortByConfidence(candidates).entrySet()) {
            if (selected.size() >= maxGenres) {
                break;
            }
            if (entry.getValue() >= confidence && seen.add(entry.getKey().toLowerCase(Locale.ROOT))) {
                selected.add(entry.getKey());
            }
        }
        return selected;
    }

    /**
     * 清洗 + 挑选, 没有流派达到阈值时放宽一次, 仍然没有时取最高的候选
     */
    public AggregatedResult aggregate(Map<String, Double> rawGenres, double confidence, int maxGenres) {
        Map<String, Double> candidates = processGenres(rawGenres);
        if (candidates.isEmpty()) {
            return AggregatedResult.noGenres(AggregatedResult.NO_VALID_GENRES, confidence);
        }

        double threshold = confidence;
        List<String> selected = selectGenres(candidates, threshold, maxGenres);
        if (selected.isEmpty()) {
            threshold = Math.max(0.0, Math.min(minConfidence, confidence - RELAXATION_STEP));
            selected = selectGenres(candidates, threshold, maxGenres);
            log.debug("No genre reached {}, relaxed threshold to {}", confidence, threshold);
        }
        if (selected.isEmpty() && maxGenres > 0) {
            Map.Entry<String, Double> top = candidates.entrySet().iterator().next();
            selected = Collections.singletonList(top.getKey());
            threshold = top.getValue();
            log.debug("Falling back to top candidate {} ({})", top.getKey(), top.getValue());
        }
        return AggregatedResult.of(selected, threshold, candidates);
    }

    /**
     * 聚合一次多来源查询的结果
     * 配置了动态阈值时, 按返回数据的来源数量和置信度分布调整阈值
     */
    public AggregatedResult aggregate(LookupResult lookup, double confidence, int maxGenres) {
        Map<String, Double> rawGenres = mergeSignals(lookup.getSignals());
        if (rawGenres.isEmpty()) {
            return AggregatedResult.noGenres(AggregatedResult.NO_VALID_GENRES, confidence);
        }

        double threshold = confidence;
        if (thresholdCalculator != null) {
            double max = Collections.max(rawGenres.values());
            double min = Collections.min(rawGenres.values());
            int sources = (int) lookup.countSources(SourceStatus.OK);
            threshold = thresholdCalculator.calculate(confidence, sources, max - min);
        }
        return aggregate(rawGenres, threshold, maxGenres);
    }

    private static Map<String, Double> sortByConfidence(Map<String, Double> genres) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(genres.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));
        Map<String, Double> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }
}
