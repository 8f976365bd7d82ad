package com.lux032.genreenricher.core;

import com.lux032.genreenricher.config.EnricherConfig;
import com.lux032.genreenricher.pipeline.CircuitBreaker;
import com.lux032.genreenricher.pipeline.MetricsTracker;
import com.lux032.genreenricher.pipeline.RateLimiter;
import com.lux032.genreenricher.service.BatchProcessor;
import com.lux032.genreenricher.service.DynamicThresholdCalculator;
import com.lux032.genreenricher.service.GenreEnrichmentService;
import com.lux032.genreenricher.service.GenreSignalAggregator;
import com.lux032.genreenricher.service.MultiSourceLookupService;
import com.lux032.genreenricher.service.MusicSourceGateway;
import com.lux032.genreenricher.service.PersistentCache;
import com.lux032.genreenricher.service.TagWriterService;
import com.lux032.genreenricher.source.AbstractHttpMusicApi;
import com.lux032.genreenricher.source.DiscogsApi;
import com.lux032.genreenricher.source.LastFmApi;
import com.lux032.genreenricher.source.MusicBrainzApi;
import com.lux032.genreenricher.util.I18nUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 应用程序生命周期管理器
 * 负责初始化和关闭所有服务
 */
@Slf4j
@Getter
public class ApplicationLifecycleManager {

    private final EnricherConfig config;

    private RateLimiter rateLimiter;
    private MetricsTracker metricsTracker;
    private PersistentCache cache;
    private final List<AbstractHttpMusicApi> musicApis = new ArrayList<>();
    private final List<MusicSourceGateway> gateways = new ArrayList<>();
    private MultiSourceLookupService lookupService;
    private GenreSignalAggregator aggregator;
    private TagWriterService tagWriter;
    private GenreEnrichmentService enrichmentService;
    private BatchProcessor batchProcessor;

    public ApplicationLifecycleManager(EnricherConfig config) {
        this.config = config;
    }

    /**
     * 初始化所有服务
     */
    public void initializeServices() {
        log.info(I18nUtil.getMessage("app.init.services"));

        // Level 0: 初始化国际化
        I18nUtil.init(config.getLanguage());
        log.info(I18nUtil.getMessage("app.init.i18n"), config.getLanguage());

        // Level 1: 限流、指标和缓存
        rateLimiter = new RateLimiter();
        config.getRateLimits().forEach((key, setting) ->
            rateLimiter.createLimit(key, setting.getCapacity(), setting.getFillRate()));
        log.info(I18nUtil.getMessage("app.init.rate.limits"), rateLimiter.getKeys());

        metricsTracker = new MetricsTracker(Paths.get(config.getMetricsFile()));

        if (config.getCacheTtlSeconds() > 0) {
            cache = new PersistentCache(Paths.get(config.getCacheDirectory()),
                Duration.ofSeconds(config.getCacheTtlSeconds()));
            int removed = cache.cleanup();
            log.info(I18nUtil.getMessage("app.init.cache"), config.getCacheDirectory(), removed);
        } else {
            log.info(I18nUtil.getMessage("app.cache.disabled"));
        }

        // Level 2: 数据源, 每个来源一个熔断器
        for (String sourceId : config.getEnabledSources()) {
            AbstractHttpMusicApi api = createApi(sourceId);
            if (api == null) {
                log.warn(I18nUtil.getMessage("app.source.unknown"), sourceId);
                continue;
            }
            if (!api.isAvailable()) {
                log.warn(I18nUtil.getMessage("app.source.unavailable"), api.getName());
            }
            musicApis.add(api);
            CircuitBreaker breaker = new CircuitBreaker(api.getName(), config.getBreakerFailureThreshold(),
                Duration.ofSeconds(config.getBreakerResetTimeoutSeconds()));
            gateways.add(new MusicSourceGateway(api, breaker, metricsTracker, cache));
        }
        log.info(I18nUtil.getMessage("app.init.sources"), gateways.size());

        // Level 3: 查询、聚合与写入
        lookupService = new MultiSourceLookupService(gateways,
            Math.max(1, gateways.size()) * config.getWorkerThreads());

        DynamicThresholdCalculator thresholdCalculator = null;
        if (config.isDynamicThresholdEnabled()) {
            thresholdCalculator = new DynamicThresholdCalculator(
                config.getDynamicThresholdMin(), config.getDynamicThresholdMax());
        }
        aggregator = new GenreSignalAggregator(config.getMaxTags(), config.getMinConfidence(), thresholdCalculator);
        tagWriter = new TagWriterService(config);
        enrichmentService = new GenreEnrichmentService(config, tagWriter, lookupService, aggregator);

        // Level 4: 批处理, 队列熔断器独立于来源熔断器
        CircuitBreaker batchBreaker = new CircuitBreaker("batch", config.getBreakerFailureThreshold(),
            Duration.ofSeconds(config.getBreakerResetTimeoutSeconds()));
        batchProcessor = new BatchProcessor(enrichmentService, batchBreaker,
            config.getWorkerThreads(), config.getMaxBreakerRetries());

        log.info(I18nUtil.getMessage("app.all.services.ready"));
    }

    AbstractHttpMusicApi createApi(String sourceId) {
        switch (sourceId.toLowerCase()) {
            case MusicBrainzApi.ID:
                return new MusicBrainzApi(config, rateLimiter);
            case LastFmApi.ID:
                return new LastFmApi(config, rateLimiter);
            case DiscogsApi.ID:
                return new DiscogsApi(config, rateLimiter);
            default:
                return null;
        }
    }

    /**
     * 输出每个来源的调用指标
     */
    public void logMetrics() {
        if (metricsTracker == null) {
            return;
        }
        for (String source : metricsTracker.getSources()) {
            log.info(I18nUtil.getMessage("app.metrics.source"), source, metricsTracker.getMetrics(source));
        }
    }

    /**
     * 关闭所有服务
     */
    public void shutdown() {
        log.info(I18nUtil.getMessage("app.shutting.down"));

        try {
            // 按依赖关系逆序关闭服务
            if (batchProcessor != null) {
                batchProcessor.stop();
            }

            if (lookupService != null) {
                lookupService.shutdown();
            }

            for (AbstractHttpMusicApi api : musicApis) {
                try {
                    api.close();
                } catch (IOException e) {
                    log.warn(I18nUtil.getMessage("app.shutdown.source.error"), api.getName(), e);
                }
            }

            if (cache != null) {
                log.info(I18nUtil.getMessage("app.cache.statistics"), cache.getStatistics());
            }

            log.info(I18nUtil.getMessage("app.shutdown.complete"));
        } catch (Exception e) {
            log.error(I18nUtil.getMessage("app.shutdown.error"), e);
        }
    }
}
