package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.pipeline.CircuitBreaker;
import com.lux032.genreenricher.pipeline.MetricsTracker;
import com.lux032.genreenricher.source.MusicApi;
import com.lux032.genreenricher.source.SourceRequestException;
import com.lux032.genreenricher.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 单个来源的访问入口
 * 先查缓存, 再经过该来源自己的熔断器调用 API, 调用结果记入指标
 * 令牌由 API 客户端在每个 HTTP 请求前获取
 */
@Slf4j
public class MusicSourceGateway {

    private final MusicApi api;
    private final CircuitBreaker circuitBreaker;
    private final MetricsTracker metricsTracker;
    private final PersistentCache cache;

    /**
     * @param cache 为 null 时不使用缓存
     */
    public MusicSourceGateway(MusicApi api, CircuitBreaker circuitBreaker,
                              MetricsTracker metricsTracker, PersistentCache cache) {
        this.api = api;
        this.circuitBreaker = circuitBreaker;
        this.metricsTracker = metricsTracker;
        this.cache = cache;
    }

    /**
     * 查询曲目信息
     * @return 来源未配置或熔断器打开时返回 null
     * @throws IOException 来源调用失败, 已计入熔断器和指标
     */
    public TrackInfo lookup(String artist, String title) throws IOException {
        if (!api.isAvailable()) {
            return null;
        }

        String cacheKey = PersistentCache.buildKey(api.getId(), artist, title);
        if (cache != null) {
            TrackInfo cached = cache.get(cacheKey);
            if (cached != null) {
                log.debug("Cache hit for {}: {} - {}", api.getName(), artist, title);
                return cached;
            }
        }

        if (!circuitBreaker.allowRequest()) {
            log.debug("Circuit breaker [{}] open, skipping {} - {}", circuitBreaker.getName(), artist, title);
            return null;
        }

        long start = System.nanoTime();
        TrackInfo info;
        try {
            info = api.getTrackInfo(artist, title);
        } catch (IOException | RuntimeException e) {
            recordFailure(start, e);
            if (e instanceof IOException) {
                throw (IOException) e;
            }
            throw new IOException(api.getName() + " lookup failed: " + e.getMessage(), e);
        }

        if (info == null) {
            info = TrackInfo.empty(api.getName());
        }
        metricsTracker.recordApiCall(api.getName(), true, elapsedSeconds(start), info.isRateLimited());
        circuitBreaker.recordSuccess();
        if (cache != null) {
            cache.set(cacheKey, info);
        }
        return info;
    }

    private void recordFailure(long start, Exception e) {
        boolean rateLimited = e instanceof SourceRequestException && ((SourceRequestException) e).isRateLimited();
        metricsTracker.recordApiCall(api.getName(), false, elapsedSeconds(start), rateLimited);
        log.warn(I18nUtil.getMessage("source.call.failed", api.getName(), e.getMessage()));
        if (circuitBreaker.recordFailure()) {
            log.error(I18nUtil.getMessage("source.breaker.opened", api.getName(), circuitBreaker.getFailureCount()));
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    public MusicApi getApi() {
        return api;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
