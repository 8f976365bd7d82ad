package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.GenreSignal;
import com.lux032.genreenricher.model.LookupResult;
import com.lux032.genreenricher.model.SourceStatus;
import com.lux032.genreenricher.model.TrackInfo;
import com.lux032.genreenricher.source.DiscogsApi;
import com.lux032.genreenricher.source.LastFmApi;
import com.lux032.genreenricher.source.MusicBrainzApi;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 并行查询所有来源, 把结果合并成一个 LookupResult
 */
@Slf4j
public class MultiSourceLookupService {

    /**
     * 年份和专辑的来源优先级
     */
    static final List<String> METADATA_PRIORITY = Arrays.asList(DiscogsApi.ID, MusicBrainzApi.ID, LastFmApi.ID);

    private static final double POSITION_DECAY = 0.1;
    private static final double MIN_POSITION_CONFIDENCE = 0.5;

    private final List<MusicSourceGateway> gateways;
    private final ExecutorService executor;

    /**
     * @param parallelism 同时进行的来源查询数上限
     */
    public MultiSourceLookupService(List<MusicSourceGateway> gateways, int parallelism) {
        this.gateways = new ArrayList<>(gateways);
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), r -> {
            Thread t = new Thread(r, "source-lookup-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 查询曲目, 单个来源失败只影响该来源的状态
     */
    public LookupResult lookup(String artist, String title) {
        LookupResult result = new LookupResult(artist, title);

        List<Future<TrackInfo>> futures = new ArrayList<>();
        for (MusicSourceGateway gateway : gateways) {
            futures.add(executor.submit(() -> gateway.lookup(artist, title)));
        }

        String bestYearSource = null;
        String bestAlbumSource = null;
        for (int i = 0; i < gateways.size(); i++) {
            MusicSourceGateway gateway = gateways.get(i);
            String source = gateway.getApi().getName();
            TrackInfo info;
            try {
                info = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} lookup", source);
                for (int j = i; j < futures.size(); j++) {
                    futures.get(j).cancel(true);
                    result.markSource(gateways.get(j).getApi().getName(), SourceStatus.SKIPPED);
                }
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (!(cause instanceof IOException)) {
                    log.error("Unexpected error from {} lookup", source, cause);
                }
                result.markSourceError(source, String.valueOf(cause.getMessage()));
                continue;
            }

            if (info == null) {
                result.markSource(source, SourceStatus.SKIPPED);
                continue;
            }
            if (info.isEmpty()) {
                result.markSource(source, SourceStatus.NO_DATA);
                continue;
            }
            result.markSource(source, SourceStatus.OK);

            List<String> genres = info.getGenres();
            for (int position = 0; position < genres.size(); position++) {
                result.addSignal(new GenreSignal(genres.get(position), source, positionConfidence(position)));
            }

            String sourceId = gateway.getApi().getId();
            if (info.getYear() != null && outranks(sourceId, bestYearSource)) {
                result.setYear(info.getYear());
                result.setYearSource(source);
                bestYearSource = sourceId;
            }
            if (info.getAlbum() != null && outranks(sourceId, bestAlbumSource)) {
                result.setAlbum(info.getAlbum());
                result.setAlbumSource(source);
                bestAlbumSource = sourceId;
            }
        }

        log.debug("Lookup {} - {}: {}", artist, title, result.sourceSummary());
        return result;
    }

    /**
     * 排在前面的标签置信度更高: 1.0, 0.9, 0.8 ... 最低 0.5
     */
    static double positionConfidence(int position) {
        return Math.max(MIN_POSITION_CONFIDENCE, 1.0 - POSITION_DECAY * position);
    }

    static boolean outranks(String candidate, String current) {
        if (current == null) {
            return true;
        }
        return rank(candidate) < rank(current);
    }

    private static int rank(String sourceId) {
        int index = METADATA_PRIORITY.indexOf(sourceId);
        return index < 0 ? METADATA_PRIORITY.size() : index;
    }

    public List<MusicSourceGateway> getGateways() {
        return new ArrayList<>(gateways);
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
