package com.lux032.genreenricher.service;

import lombok.extern.slf4j.Slf4j;

/**
 * 根据数据质量调整流派置信度阈值
 * 来源越多阈值越低, 置信度分布越分散阈值越高
 */
@Slf4j
public class DynamicThresholdCalculator {

    private final double minThreshold;
    private final double maxThreshold;

    public DynamicThresholdCalculator(double minThreshold, double maxThreshold) {
        if (minThreshold > maxThreshold) {
            throw new IllegalArgumentException(
                String.format("minThreshold %.2f > maxThreshold %.2f", minThreshold, maxThreshold));
        }
        this.minThreshold = minThreshold;
        this.maxThreshold = maxThreshold;
    }

    /**
     * @param baseThreshold 基础阈值
     * @param sourceCount 返回数据的来源数量
     * @param confidenceSpread 候选置信度的最大值与最小值之差
     */
    public double calculate(double baseThreshold, int sourceCount, double confidenceSpread) {
        double threshold;
        if (sourceCount >= 3) {
            threshold = baseThreshold * 0.8;
        } else if (sourceCount == 2) {
            threshold = baseThreshold;
        } else {
            threshold = baseThreshold * 1.2;
        }

        if (confidenceSpread > 0.5) {
            threshold += 0.1;
        } else if (confidenceSpread < 0.2) {
            threshold -= 0.1;
        }

        threshold = Math.max(minThreshold, Math.min(maxThreshold, threshold));
        log.debug("Dynamic threshold {} (sources={}, spread={})", threshold, sourceCount, confidenceSpread);
        return threshold;
    }

    public double getMinThreshold() {
        return minThreshold;
    }

    public double getMaxThreshold() {
        return maxThreshold;
    }
}
