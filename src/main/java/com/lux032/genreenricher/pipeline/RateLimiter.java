package com.lux032.genreenricher.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 令牌桶限流器
 * 每个 key (来源 + 操作) 对应一个令牌桶,控制对外部 API 的调用频率
 *
 * 等待令牌时会先释放锁再睡眠,一个 key 的等待不会阻塞其他 key 的 acquire
 * 未配置的 key 直接放行(fail-open)
 */
@Slf4j
public class RateLimiter {

    private static final long SAFETY_MARGIN_NANOS = 100_000L; // 0.1ms

    private final Map<String, TokenBucket> buckets = new HashMap<>();
    private final Object lock = new Object();
    private final LongSupplier nanoClock;

    public RateLimiter() {
        this(System::nanoTime);
    }

    RateLimiter(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    /**
     * 创建(或重置)一个令牌桶,创建后桶是满的
     * @param key 限流 key
     * @param capacity 最大令牌数(突发容量)
     * @param fillRate 每秒补充的令牌数
     */
    public void createLimit(String key, double capacity, double fillRate) {
        if (capacity < 0 || fillRate < 0) {
            log.warn("Negative rate limit for {} (capacity={}, fillRate={}), clamping to zero", key, capacity, fillRate);
        }
        long fixedCapacity = TokenBucket.toFixed(Math.max(0.0, capacity));
        long fixedRate = TokenBucket.toFixed(Math.max(0.0, fillRate));

        synchronized (lock) {
            buckets.put(key, new TokenBucket(key, fixedCapacity, fixedRate, nanoClock.getAsLong()));
        }
        log.debug("Rate limit created: {} capacity={} fillRate={}/s", key, capacity, fillRate);
    }

    /**
     * 获取一个令牌,令牌不足时阻塞等待
     */
    public boolean acquire(String key) {
        return acquire(key, 1.0, true);
    }

    /**
     * 尝试获取令牌
     * @param key 限流 key
     * @param tokens 需要的令牌数
     * @param wait 令牌不足时是否等待
     * @return 获取成功返回 true; wait=false 且令牌不足时返回 false
     * @throws IllegalArgumentException tokens 为负数或 NaN
     */
    public boolean acquire(String key, double tokens, boolean wait) {
        if (Double.isNaN(tokens) || tokens < 0) {
            throw new IllegalArgumentException("tokens must be a non-negative number: " + tokens);
        }
        long needed = TokenBucket.toFixed(tokens);

        while (true) {
            long sleepNanos;
            synchronized (lock) {
                TokenBucket bucket = buckets.get(key);
                if (bucket == null) {
                    log.warn("No rate limit bucket found for key: {}, allowing call", key);
                    return true;
                }

                bucket.refill(nanoClock.getAsLong());
                if (bucket.tryConsume(needed)) {
                    return true;
                }
                if (!wait) {
                    return false;
                }
                if (needed > bucket.getCapacity() || bucket.getFillRate() == 0) {
                    // 永远凑不够,等待没有意义
                    log.warn("Rate limit {} can never satisfy {} tokens (capacity={}, fillRate={})",
                        key, tokens, TokenBucket.fromFixed(bucket.getCapacity()),
                        TokenBucket.fromFixed(bucket.getFillRate()));
                    return false;
                }
                sleepNanos = bucket.nanosUntilAvailable(needed) + SAFETY_MARGIN_NANOS;
            }

            // 睡眠时不持有锁
            try {
                log.trace("Rate limit {} exhausted, waiting {} ms", key, sleepNanos / 1_000_000);
                TimeUnit.NANOSECONDS.sleep(sleepNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for rate limit {}", key);
                return false;
            }
        }
    }

    /**
     * 获取当前令牌数(会先按时间补充)
     * @return 令牌数, key 不存在时返回 null
     */
    public Double getTokenCount(String key) {
        synchronized (lock) {
            TokenBucket bucket = buckets.get(key);
            if (bucket == null) {
                return null;
            }
            bucket.refill(nanoClock.getAsLong());
            return TokenBucket.fromFixed(bucket.getTokens());
        }
    }

    public boolean hasLimit(String key) {
        synchronized (lock) {
            return buckets.containsKey(key);
        }
    }

    public List<String> getKeys() {
        synchronized (lock) {
            return new ArrayList<>(buckets.keySet());
        }
    }
}
