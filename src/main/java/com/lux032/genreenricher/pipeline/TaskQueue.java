package com.lux032.genreenricher.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * 带熔断器的任务队列
 * FIFO 派发, 熔断器打开时整个队列暂停派发, 直到有成功被记录
 * 需要按来源隔离时, 每个来源使用一组独立的熔断器 + 队列
 */
@Slf4j
public class TaskQueue<T> {

    private final CircuitBreaker circuitBreaker;
    private final Deque<Task<T>> queue = new ArrayDeque<>();
    // 任务 ID → 任务, 按加入顺序
    private final Map<String, Task<T>> activeTasks = new LinkedHashMap<>();
    private final Object lock = new Object();
    // 队列中仍为 PENDING 的任务数, 已取消的任务留在队列里等出队时丢弃
    private int pendingTasks;

    public TaskQueue() {
        this(new CircuitBreaker());
    }

    public TaskQueue(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    /**
     * 添加任务
     * @param taskId 任务 ID, 在活动任务中必须唯一
     * @param work 任务体
     * @return 新建的 PENDING 任务
     */
    public Task<T> addTask(String taskId, Callable<T> work) {
        Task<T> task = new Task<>(taskId, work);
        synchronized (lock) {
            if (activeTasks.containsKey(taskId)) {
                throw new IllegalArgumentException("Duplicate task id: " + taskId);
            }
            activeTasks.put(taskId, task);
            queue.addLast(task);
            pendingTasks++;
        }
        log.debug("Task {} added to queue", taskId);
        return task;
    }

    /**
     * 获取下一个待执行任务并标记为 RUNNING
     * @return 熔断器打开或队列为空时返回 null
     */
    public Task<T> getNextTask() {
        if (!circuitBreaker.allowRequest()) {
            log.warn("Circuit breaker [{}] open - dispatch paused", circuitBreaker.getName());
            return null;
        }

        synchronized (lock) {
            Task<T> task;
            while ((task = queue.pollFirst()) != null) {
                // 已取消的任务直接丢弃
                if (task.transitionTo(TaskState.RUNNING)) {
                    pendingTasks--;
                    return task;
                }
            }
            return null;
        }
    }

    /**
     * 完成任务, error 非空时标记为 FAILED 并记录一次熔断失败, 否则标记为 COMPLETED 并记录成功
     * @throws IllegalStateException 任务不在 RUNNING 状态
     */
    public void completeTask(Task<T> task, T result, String error) {
        synchronized (lock) {
            TaskState target = error != null ? TaskState.FAILED : TaskState.COMPLETED;
            TaskState current = task.getState();
            if (!task.transitionTo(target)) {
                throw new IllegalStateException(
                    String.format("Task %s cannot move from %s to %s", task.getId(), current, target));
            }
            task.setOutcome(result, error);

            if (error != null) {
                if (circuitBreaker.recordFailure()) {
                    log.error("Circuit breaker [{}] tripped after failure of task {}: {}",
                        circuitBreaker.getName(), task.getId(), error);
                }
            } else {
                circuitBreaker.recordSuccess();
            }
        }
    }

    public void completeTask(Task<T> task, T result) {
        completeTask(task, result, null);
    }

    public void failTask(Task<T> task, String error) {
        completeTask(task, null, error == null ? "unknown error" : error);
    }

    /**
     * 取消一个尚未派发的任务
     * @return 任务不存在或已开始执行时返回 false
     */
    public boolean cancelTask(String taskId) {
        synchronized (lock) {
            Task<T> task = activeTasks.get(taskId);
            if (task != null && task.transitionTo(TaskState.CANCELLED)) {
                pendingTasks--;
                log.info("Task {} cancelled", taskId);
                return true;
            }
        }
        return false;
    }

    /**
     * 查询任务状态
     * @return 任务不存在时返回 null
     */
    public TaskState getTaskStatus(String taskId) {
        synchronized (lock) {
            Task<T> task = activeTasks.get(taskId);
            return task != null ? task.getState() : null;
        }
    }

    public List<Task<T>> getActiveTasks() {
        synchronized (lock) {
            return new ArrayList<>(activeTasks.values());
        }
    }

    /**
     * 从活动列表中移除已进入终态的任务
     * @return 移除数量
     */
    public int purgeFinishedTasks() {
        synchronized (lock) {
            int before = activeTasks.size();
            activeTasks.values().removeIf(Task::isDone);
            int removed = before - activeTasks.size();
            log.debug("Purged {} finished tasks, {} still active", removed, activeTasks.size());
            return removed;
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pendingTasks;
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
