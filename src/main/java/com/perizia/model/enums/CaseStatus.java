package com.perizia.model.enums;

/**
 * 案件状态
 *
 * @author perizia
 * @since 2025-03-02
 */
public enum CaseStatus {

    /**
     * 空闲，可上传文档或人工定稿
     */
    OPEN,

    /**
     * 正在派发文档抽取任务
     */
    PROCESSING,

    /**
     * 正在生成 AI 报告
     */
    GENERATING,

    /**
     * 已定稿关闭
     */
    CLOSED,

    /**
     * 生成失败，等待人工重试
     */
    ERROR;

    /**
     * 是否为“进行中”状态，超时后由僵尸案件清理任务重置
     */
    public boolean isInFlight() {
        return this == PROCESSING || this == GENERATING;
    }
}
