package com.lux032.genreenricher.pipeline;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * 队列中的一个工作单元
 * 状态只能由 {@link TaskQueue} 修改; 进入终态后生产者只能读取
 */
@Getter
public class Task<T> {

    private final String id;
    private final Callable<T> work;
    private final Instant createdAt;
    private volatile TaskState state;
    private volatile T result;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    Task(String id, Callable<T> work) {
        this.id = id;
        this.work = work;
        this.createdAt = Instant.now();
        this.state = TaskState.PENDING;
    }

    /**
     * 执行任务体
     */
    public T execute() throws Exception {
        return work.call();
    }

    boolean transitionTo(TaskState target) {
        if (!state.canTransitionTo(target)) {
            return false;
        }
        state = target;
        if (target == TaskState.RUNNING) {
            startedAt = Instant.now();
        } else if (target.isTerminal()) {
            finishedAt = Instant.now();
        }
        return true;
    }

    void setOutcome(T result, String error) {
        this.result = result;
        this.error = error;
    }

    public boolean isDone() {
        return state.isTerminal();
    }

    @Override
    public String toString() {
        return String.format("Task{id='%s', state=%s, error='%s'}", id, state, error);
    }
}
