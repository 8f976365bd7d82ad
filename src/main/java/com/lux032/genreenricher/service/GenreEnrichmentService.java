package com.lux032.genreenricher.service;

import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.model.AggregatedResult;
import com.lux032.genreenricher.model.EnrichmentOutcome;
import com.lux032.genreenricher.model.EnrichmentResult;
import com.lux032.genreenricher.model.LookupResult;
import com.lux032.genreenricher.model.SourceStatus;
import com.lux032.genreenricher.model.TrackTags;
import com.lux032.genreenricher.util.I18nUtil;
import com.lux032.genreenricher.util.MetadataUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;

/**
 * 单个文件的流派补全流程: 读标签 → 多来源查询 → 聚合 → 写标签
 */
@Slf4j
public class GenreEnrichmentService {

    private final EnricherConfig config;
    private final TagWriterService tagWriter;
    private final MultiSourceLookupService lookupService;
    private final GenreSignalAggregator aggregator;

    public GenreEnrichmentService(EnricherConfig config, TagWriterService tagWriter,
                                  MultiSourceLookupService lookupService, GenreSignalAggregator aggregator) {
        this.config = config;
        this.tagWriter = tagWriter;
        this.lookupService = lookupService;
        this.aggregator = aggregator;
    }

    /**
     * 处理一个文件
     * @throws IOException 标签读取失败
     * @throws SourceUnavailableException 所有来源都查询失败或不可用
     */
    public EnrichmentResult processFile(File file) throws IOException, SourceUnavailableException {
        TrackTags tags = tagWriter.readTags(file);
        if (!tags.hasArtistAndTitle()) {
            log.warn(I18nUtil.getMessage("enrich.missing.tags", file.getName()));
            EnrichmentResult result = new EnrichmentResult(file, EnrichmentOutcome.MISSING_TAGS);
            result.setOriginalTags(tags);
            result.setMessage("missing artist or title");
            return result;
        }

        LookupResult lookup = lookupService.lookup(tags.getArtist(), tags.getTitle());
        if (lookup.allSourcesFailed()) {
            throw new SourceUnavailableException(String.format("No source available for %s - %s (%s)",
                tags.getArtist(), tags.getTitle(), lookup.sourceSummary()));
        }
        if (lookup.countSources(SourceStatus.ERROR) > 0) {
            log.debug("Partial lookup for {}: {}", file.getName(), lookup.sourceSummary());
        }

        AggregatedResult aggregated = aggregator.aggregate(lookup, config.getConfidence(), config.getMaxGenres());
        if (!aggregated.hasGenres()) {
            log.info(I18nUtil.getMessage("enrich.no.genres", file.getName(), aggregated.getFailureReason()));
            EnrichmentResult result = new EnrichmentResult(file, EnrichmentOutcome.NO_GENRES);
            result.setOriginalTags(tags);
            result.setLookup(lookup);
            result.setAggregated(aggregated);
            result.setMessage(aggregated.getFailureReason());
            return result;
        }

        // 只补全缺失的年份和专辑
        String year = null;
        String album = null;
        if (config.isWriteYearAndAlbum()) {
            if (MetadataUtils.isBlank(tags.getYear()) && lookup.getYear() != null) {
                year = lookup.getYear();
            }
            if (MetadataUtils.isBlank(tags.getAlbum()) && lookup.getAlbum() != null) {
                album = lookup.getAlbum();
            }
        }

        EnrichmentOutcome outcome = EnrichmentOutcome.ANALYZED;
        String message = null;
        if (!config.isDryRun()) {
            try {
                tagWriter.writeTags(file, aggregated.getGenres(), year, album);
                outcome = EnrichmentOutcome.UPDATED;
            } catch (IOException e) {
                log.error(I18nUtil.getMessage("enrich.write.failed", file.getName(), e.getMessage()));
                outcome = EnrichmentOutcome.WRITE_FAILED;
                message = e.getMessage();
            }
        }

        EnrichmentResult result = new EnrichmentResult(file, outcome);
        result.setOriginalTags(tags);
        result.setLookup(lookup);
        result.setAggregated(aggregated);
        result.setWrittenYear(year);
        result.setWrittenAlbum(album);
        result.setMessage(message);
        log.info(I18nUtil.getMessage("enrich.result", file.getName(), aggregated.joinedGenres(),
            String.format("%.2f", aggregated.getThresholdUsed()), outcome));
        return result;
    }
}
