package com.perizia.service;

/**
 * 报告生成任务
 *
 * @author perizia
 * @since 2025-03-06
 */
public interface ReportGenerationService {

    /**
     * 为案件生成第 1 版 AI 初稿。
     * 版本 1 已存在时视为重复投递直接返回；生成失败时案件置为 ERROR 且不抛出；
     * 协调类错误回滚后抛出，由任务队列决定是否重试。
     *
     * @param caseId   案件ID
     * @param tenantId 租户ID
     */
    void generateReport(Long caseId, Long tenantId);
}
