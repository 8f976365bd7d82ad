package com.lux032.genreenricher.pipeline;

import lombok.Data;

/**
 * 某个来源的派生指标
 */
@Data
public class MetricsSnapshot {

    public static final MetricsSnapshot EMPTY = new MetricsSnapshot(0, 0.0, 0.0, 0.0);

    private final long totalCalls;
    private final double successRate;
    private final double avgLatency;
    private final double rateLimitRatio;

    static MetricsSnapshot of(ApiMetrics metrics) {
        if (metrics == null || metrics.getTotalCalls() == 0) {
            return EMPTY;
        }
        double total = metrics.getTotalCalls();
        return new MetricsSnapshot(
            metrics.getTotalCalls(),
            metrics.getSuccessfulCalls() / total,
            metrics.getTotalLatency() / total,
            metrics.getRateLimitHits() / total);
    }

    @Override
    public String toString() {
        return String.format("calls=%d, success=%.1f%%, avgLatency=%.3fs, rateLimited=%.1f%%",
            totalCalls, successRate * 100, avgLatency, rateLimitRatio * 100);
    }
}
