package com.lux032.genreenricher.pipeline;

/**
 * 任务状态
 * PENDING → RUNNING → COMPLETED / FAILED, 或 PENDING → CANCELLED
 */
public enum TaskState {

    PENDING,

    RUNNING,

    COMPLETED,

    FAILED,

    /**
     * 只能在派发(RUNNING)之前取消
     */
    CANCELLED;

    /**
     * 终态不可再变更
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * 检查状态迁移是否合法
     */
    public boolean canTransitionTo(TaskState target) {
        switch (this) {
            case PENDING:
                return target == RUNNING || target == CANCELLED;
            case RUNNING:
                return target == COMPLETED || target == FAILED;
            default:
                return false;
        }
    }
}
