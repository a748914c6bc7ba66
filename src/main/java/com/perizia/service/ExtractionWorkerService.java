package com.perizia.service;

/**
 * 文档抽取 worker
 *
 * @author perizia
 * @since 2025-03-03
 */
public interface ExtractionWorkerService {

    /**
     * 抽取单个文档并记录结果，结束后总是触发汇聚判定。
     * 已经 SUCCESS 的文档不再抽取，直接进入汇聚判定。
     * 抽取失败只记录在文档上，不抛出；数据库和协调类错误照常抛出交给任务队列。
     *
     * @param documentId 文档ID
     * @param tenantId   租户ID
     */
    void processDocument(Long documentId, Long tenantId);
}
