package com.lux032.genreenricher.model;

/**
 * 单个文件的处理结果类型
 * 来源全部不可用属于任务失败, 由异常表示, 不在此枚举中
 */
public enum EnrichmentOutcome {

    /**
     * 流派已写入文件
     */
    UPDATED,

    /**
     * 只分析不写入(dry-run)
     */
    ANALYZED,

    /**
     * 来源有响应, 但清洗后没有有效流派
     */
    NO_GENRES,

    /**
     * 文件缺少艺术家或标题, 无法查询
     */
    MISSING_TAGS,

    /**
     * 查询成功但写入标签失败
     */
    WRITE_FAILED;

    public boolean isSuccess() {
        return this == UPDATED || this == ANALYZED;
    }

    /**
     * 是否应计入批处理的失败数
     */
    public boolean isFailure() {
        return this == WRITE_FAILED;
    }
}
