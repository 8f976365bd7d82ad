package com.lux032.genreenricher.pipeline;

import lombok.Getter;

/**
 * 令牌桶状态
 * 令牌数、容量和填充速率都以定点整数(百万分之一)保存
 * 所有方法都不是线程安全的,由 {@link RateLimiter} 的锁保护
 */
@Getter
class TokenBucket {

    static final long SCALE = 1_000_000L; // 6 位小数精度
    static final long NANOS_PER_SECOND = 1_000_000_000L;

    private final String key;
    private final long capacity;   // 定点
    private final long fillRate;   // 定点, 每秒
    private long tokens;           // 定点
    private long lastUpdateNanos;
    // 不足一个微令牌的余量, 单位: 微令牌 * 纳秒 / 秒
    private long carry;

    TokenBucket(String key, long capacity, long fillRate, long nowNanos) {
        this.key = key;
        this.capacity = capacity;
        this.fillRate = fillRate;
        this.tokens = capacity; // 创建时装满
        this.lastUpdateNanos = nowNanos;
        this.carry = 0;
    }

    static long toFixed(double value) {
        return (long) (value * SCALE);
    }

    static double fromFixed(long value) {
        return (double) value / SCALE;
    }

    /**
     * 根据经过的时间补充令牌,上限为容量
     */
    void refill(long nowNanos) {
        long elapsed = nowNanos - lastUpdateNanos;
        lastUpdateNanos = nowNanos;
        if (elapsed <= 0 || fillRate == 0) {
            return;
        }

        long missing = capacity - tokens;
        if (missing <= 0) {
            carry = 0;
            return;
        }

        // elapsed * fillRate 可能溢出,溢出时说明早已填满
        if (elapsed > (Long.MAX_VALUE - carry) / fillRate) {
            tokens = capacity;
            carry = 0;
            return;
        }

        long product = elapsed * fillRate + carry;
        long added = product / NANOS_PER_SECOND;
        if (added >= missing) {
            tokens = capacity;
            carry = 0;
        } else {
            tokens += added;
            carry = product % NANOS_PER_SECOND;
        }
    }

    /**
     * 尝试扣除令牌
     * @return 令牌足够时扣除并返回 true
     */
    boolean tryConsume(long amount) {
        if (tokens >= amount) {
            tokens -= amount;
            return true;
        }
        return false;
    }

    /**
     * 凑够指定数量令牌还需要等待的纳秒数
     */
    long nanosUntilAvailable(long amount) {
        long deficit = amount - tokens;
        if (deficit <= 0) {
            return 0;
        }
        // deficit / fillRate 秒, 向上取整到纳秒
        double seconds = (double) deficit / fillRate;
        return (long) Math.ceil(seconds * NANOS_PER_SECOND);
    }
}
