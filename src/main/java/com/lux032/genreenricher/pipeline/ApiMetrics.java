package com.lux032.genreenricher.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个来源的 API 调用计数器, 只增不减
 * JSON 字段名与持久化文件保持一致
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiMetrics {

    @JsonProperty("total_calls")
    private long totalCalls;

    @JsonProperty("successful_calls")
    private long successfulCalls;

    @JsonProperty("failed_calls")
    private long failedCalls;

    @JsonProperty("total_latency")
    private double totalLatency; // 秒

    @JsonProperty("rate_limit_hits")
    private long rateLimitHits;

    void record(boolean success, double latencySeconds, boolean rateLimited) {
        totalCalls++;
        totalLatency += latencySeconds;
        if (success) {
            successfulCalls++;
        } else {
            failedCalls++;
        }
        if (rateLimited) {
            rateLimitHits++;
        }
    }

    /**
     * 把另一份计数累加到当前对象
     */
    void merge(ApiMetrics other) {
        totalCalls += other.totalCalls;
        successfulCalls += other.successfulCalls;
        failedCalls += other.failedCalls;
        totalLatency += other.totalLatency;
        rateLimitHits += other.rateLimitHits;
    }

    ApiMetrics copy() {
        ApiMetrics copy = new ApiMetrics();
        copy.merge(this);
        return copy;
    }
}
