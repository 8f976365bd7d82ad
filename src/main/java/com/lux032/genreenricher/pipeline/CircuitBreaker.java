package com.lux032.genreenricher.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * 熔断器
 * 统计自上次成功以来的连续失败次数,达到阈值后熔断,停止向失败的依赖派发请求
 * 任何一次成功都会清零计数并关闭熔断器
 *
 * 熔断后经过 resetTimeout, allowRequest() 放行一次试探请求(半开),
 * 同时重新开始冷却计时; resetTimeout 为 0 时只有成功才能关闭熔断器
 */
@Slf4j
public class CircuitBreaker {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final int failureThreshold;
    private final long resetTimeoutMillis;
    private final LongSupplier millisClock;
    private final Object lock = new Object();

    private int failures;
    private boolean open;
    private long openedAtMillis;

    public CircuitBreaker() {
        this("default", DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT);
    }

    public CircuitBreaker(String name, int failureThreshold, Duration resetTimeout) {
        this(name, failureThreshold, resetTimeout, System::currentTimeMillis);
    }

    CircuitBreaker(String name, int failureThreshold, Duration resetTimeout, LongSupplier millisClock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1: " + failureThreshold);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMillis = resetTimeout == null ? 0 : Math.max(0, resetTimeout.toMillis());
        this.millisClock = millisClock;
    }

    /**
     * 记录一次失败
     * @return 本次失败导致熔断器打开时返回 true
     */
    public boolean recordFailure() {
        synchronized (lock) {
            failures++;
            if (failures < failureThreshold) {
                return false;
            }
            openedAtMillis = millisClock.getAsLong();
            if (open) {
                // 半开试探失败, 重新冷却
                return false;
            }
            open = true;
            log.warn("Circuit breaker [{}] opened after {} consecutive failures", name, failures);
            return true;
        }
    }

    /**
     * 记录一次成功, 清零计数并关闭熔断器
     */
    public void recordSuccess() {
        synchronized (lock) {
            if (open) {
                log.info("Circuit breaker [{}] closed after successful request", name);
            }
            failures = 0;
            open = false;
        }
    }

    /**
     * 是否允许新的请求
     */
    public boolean allowRequest() {
        synchronized (lock) {
            if (!open) {
                return true;
            }
            if (resetTimeoutMillis > 0) {
                long now = millisClock.getAsLong();
                if (now - openedAtMillis >= resetTimeoutMillis) {
                    openedAtMillis = now;
                    log.info("Circuit breaker [{}] half-open, allowing one trial request", name);
                    return true;
                }
            }
            return false;
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            return open;
        }
    }

    public int getFailureCount() {
        synchronized (lock) {
            return failures;
        }
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getResetTimeout() {
        return Duration.ofMillis(resetTimeoutMillis);
    }

    public String getName() {
        return name;
    }
}
