package com.lux032.genreenricher.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * API 调用指标统计, 每次记录后整体写回 JSON 文件
 * 调用量受限流器约束, 每次读改写的开销可以接受
 */
@Slf4j
public class MetricsTracker {

    private static final TypeReference<Map<String, ApiMetrics>> METRICS_TYPE = new TypeReference<>() {};

    private final Path metricsFile;
    private final ObjectMapper objectMapper;
    private final Map<String, ApiMetrics> metrics = new TreeMap<>();
    private final Object lock = new Object();

    public MetricsTracker(Path metricsFile) {
        this.metricsFile = metricsFile;
        this.objectMapper = new ObjectMapper();
        loadMetrics();
    }

    /**
     * 从磁盘加载, 与内存中同名来源的计数合并
     * 文件损坏或不可读时按空处理
     */
    private void loadMetrics() {
        if (metricsFile == null || !Files.exists(metricsFile)) {
            return;
        }
        try {
            Map<String, ApiMetrics> saved = objectMapper.readValue(metricsFile.toFile(), METRICS_TYPE);
            synchronized (lock) {
                if (saved != null) {
                    saved.forEach((source, m) -> {
                        if (m != null) {
                            metrics.computeIfAbsent(source, k -> new ApiMetrics()).merge(m);
                        }
                    });
                }
            }
            log.info("Loaded API metrics for {} sources from {}", metrics.size(), metricsFile);
        } catch (IOException e) {
            log.error("Failed to load metrics from {}: {}", metricsFile, e.getMessage());
        }
    }

    /**
     * 必须在持有 lock 时调用
     */
    private void saveMetrics() {
        if (metricsFile == null) {
            return;
        }
        try {
            Path parent = metricsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tempFile = metricsFile.resolveSibling(metricsFile.getFileName() + ".tmp");
            objectMapper.writeValue(tempFile.toFile(), metrics);
            Files.move(tempFile, metricsFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("Failed to save metrics to {}: {}", metricsFile, e.getMessage());
        }
    }

    /**
     * 记录一次 API 调用
     * @param source 来源名称
     * @param success 是否成功
     * @param latencySeconds 耗时(秒)
     * @param rateLimited 是否被限流
     */
    public void recordApiCall(String source, boolean success, double latencySeconds, boolean rateLimited) {
        synchronized (lock) {
            metrics.computeIfAbsent(source, k -> new ApiMetrics())
                .record(success, latencySeconds, rateLimited);
            saveMetrics();
        }
    }

    public void recordApiCall(String source, boolean success, double latencySeconds) {
        recordApiCall(source, success, latencySeconds, false);
    }

    /**
     * 获取来源的派生指标, 未知来源全部为 0
     */
    public MetricsSnapshot getMetrics(String source) {
        synchronized (lock) {
            return MetricsSnapshot.of(metrics.get(source));
        }
    }

    /**
     * 获取原始计数器副本
     */
    public ApiMetrics getRawMetrics(String source) {
        synchronized (lock) {
            ApiMetrics m = metrics.get(source);
            return m == null ? new ApiMetrics() : m.copy();
        }
    }

    /**
     * 重置指标
     * @param source 来源名称, null 表示全部
     */
    public void resetMetrics(String source) {
        synchronized (lock) {
            if (source != null) {
                metrics.remove(source);
            } else {
                metrics.clear();
            }
            saveMetrics();
        }
    }

    public List<String> getSources() {
        synchronized (lock) {
            return new ArrayList<>(metrics.keySet());
        }
    }
}
