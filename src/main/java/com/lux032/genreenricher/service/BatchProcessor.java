package com.lux032.genreenricher.service;

import com.lux032.genreenricher.model.BatchSummary;
import com.lux032.genreenricher.model.EnrichmentResult;
import com.lux032.genreenricher.pipeline.CircuitBreaker;
import com.lux032.genreenricher.pipeline.Task;
import com.lux032.genreenricher.pipeline.TaskQueue;
import com.lux032.genreenricher.pipeline.TaskState;
import com.lux032.genreenricher.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 批量处理文件
 * 每个文件一个任务, 多个工作线程从同一个队列取任务
 * 队列的熔断器打开时工作线程退避等待, 连续多次仍未恢复则放弃剩余文件
 */
@Slf4j
public class BatchProcessor {

    static final long BACKOFF_STEP_MILLIS = 5000;
    static final long MAX_BACKOFF_MILLIS = 30000;

    /**
     * 退避等待, 测试中替换为不真正睡眠的实现
     */
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final GenreEnrichmentService enrichmentService;
    private final CircuitBreaker circuitBreaker;
    private final int workerThreads;
    private final int maxBreakerRetries;
    private final Sleeper sleeper;
    private volatile boolean running;

    public BatchProcessor(GenreEnrichmentService enrichmentService, CircuitBreaker circuitBreaker,
                          int workerThreads, int maxBreakerRetries) {
        this(enrichmentService, circuitBreaker, workerThreads, maxBreakerRetries, Thread::sleep);
    }

    BatchProcessor(GenreEnrichmentService enrichmentService, CircuitBreaker circuitBreaker,
                   int workerThreads, int maxBreakerRetries, Sleeper sleeper) {
        this.enrichmentService = enrichmentService;
        this.circuitBreaker = circuitBreaker;
        this.workerThreads = Math.max(1, workerThreads);
        this.maxBreakerRetries = maxBreakerRetries;
        this.sleeper = sleeper;
        if (!circuitBreaker.getResetTimeout().isZero() && !isHalfOpenReachable()) {
            log.warn(I18nUtil.getMessage("batch.breaker.no.half.open", circuitBreaker.getName(),
                circuitBreaker.getResetTimeout().getSeconds(), totalBackoffMillis(maxBreakerRetries) / 1000));
        }
    }

    /**
     * 放弃前的退避总时长是否足以等到熔断器的半开试探
     * resetTimeout 为 0 时熔断器只能靠成功恢复, 返回 false
     */
    boolean isHalfOpenReachable() {
        long resetMillis = circuitBreaker.getResetTimeout().toMillis();
        return resetMillis > 0 && resetMillis <= totalBackoffMillis(maxBreakerRetries);
    }

    /**
     * 处理一批文件, 阻塞直到全部完成、被停止或因熔断放弃
     */
    public BatchSummary processFiles(List<File> files) {
        Set<File> unique = new LinkedHashSet<>(files);
        BatchSummary summary = new BatchSummary(unique.size());
        TaskQueue<EnrichmentResult> queue = new TaskQueue<>(circuitBreaker);
        for (File file : unique) {
            queue.addTask(file.getAbsolutePath(), () -> enrichmentService.processFile(file));
        }

        running = true;
        AtomicBoolean aborted = new AtomicBoolean(false);
        log.info(I18nUtil.getMessage("batch.start", unique.size(), workerThreads));

        ExecutorService executor = Executors.newFixedThreadPool(workerThreads);
        List<Future<?>> workers = new ArrayList<>();
        for (int i = 0; i < workerThreads; i++) {
            workers.add(executor.submit(() -> runWorker(queue, summary, aborted)));
        }

        try {
            for (Future<?> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            log.warn("Batch interrupted, stopping workers");
        } catch (ExecutionException e) {
            running = false;
            log.error("Batch worker crashed", e.getCause());
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        // 停止或放弃后剩下的任务全部取消
        int cancelled = 0;
        for (Task<EnrichmentResult> task : queue.getActiveTasks()) {
            if (task.getState() == TaskState.PENDING && queue.cancelTask(task.getId())) {
                cancelled++;
            }
        }
        summary.addCancelled(cancelled);
        summary.setAborted(aborted.get());
        queue.purgeFinishedTasks();
        running = false;

        log.info(I18nUtil.getMessage("batch.complete", summary.getTotal(), summary.getSuccess(),
            summary.getNoGenres(), summary.getFailed(), summary.getCancelled()));
        return summary;
    }

    private void runWorker(TaskQueue<EnrichmentResult> queue, BatchSummary summary, AtomicBoolean aborted) {
        int openAttempts = 0;
        while (running && !aborted.get()) {
            Task<EnrichmentResult> task = queue.getNextTask();
            if (task == null) {
                if (queue.pendingCount() == 0) {
                    return;
                }
                // 队列还有任务, 说明熔断器处于打开状态
                if (openAttempts >= maxBreakerRetries) {
                    if (aborted.compareAndSet(false, true)) {
                        log.error(I18nUtil.getMessage("batch.breaker.abort", openAttempts));
                    }
                    return;
                }
                long delay = backoffMillis(openAttempts);
                openAttempts++;
                log.warn(I18nUtil.getMessage("batch.breaker.wait", delay / 1000, openAttempts, maxBreakerRetries));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                continue;
            }

            openAttempts = 0;
            try {
                EnrichmentResult result = task.execute();
                queue.completeTask(task, result);
                summary.addResult(result);
            } catch (Exception e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                queue.failTask(task, error);
                summary.addFailure(task.getId(), error);
                log.error(I18nUtil.getMessage("batch.task.failed", task.getId(), error));
            }
            log.info(I18nUtil.getMessage("batch.progress", summary.getProcessed(), summary.getTotal()));
        }
    }

    static long backoffMillis(int attempt) {
        return Math.min(BACKOFF_STEP_MILLIS * (attempt + 1), MAX_BACKOFF_MILLIS);
    }

    static long totalBackoffMillis(int retries) {
        long total = 0;
        for (int attempt = 0; attempt < retries; attempt++) {
            total += backoffMillis(attempt);
        }
        return total;
    }

    /**
     * 请求停止, 正在处理的文件会完成, 未开始的文件被取消
     */
    public void stop() {
        if (running) {
            log.info(I18nUtil.getMessage("batch.stop.requested"));
        }
        running = false;
    }

    public boolean isRunning() {
        return running;
    }
}
