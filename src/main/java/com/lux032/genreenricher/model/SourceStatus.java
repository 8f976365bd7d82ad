package com.lux032.genreenricher.model;

/**
 * 单个来源在一次查询中的状态
 */
public enum SourceStatus {
    OK,
    NO_DATA,
    ERROR,
    /**
     * 熔断器打开, 本次未调用
     */
    SKIPPED
}
