package com.perizia.service;

import com.perizia.model.entity.ReportVersionDO;

/**
 * 报告版本管理
 * 所有写入都先锁定案件行再计算下一个版本号
 *
 * @author perizia
 * @since 2025-03-05
 */
public interface VersionManagerService {

    /**
     * 新建 AI 初稿版本，案件状态回到 OPEN。
     * 每个案件只有一份 AI 初稿：锁内发现已存在时不再写入，直接返回已有版本。
     *
     * @param caseId      案件ID
     * @param tenantId    租户ID
     * @param text        生成的报告原文，补写丢失的版本记录时为空
     * @param artifactRef 报告文件引用
     * @return 新版本或已有的 AI 初稿
     */
    ReportVersionDO createDraftVersion(Long caseId, Long tenantId, String text, String artifactRef);

    /**
     * 新建初步报告版本，不改变案件状态
     *
     * @param caseId       案件ID
     * @param tenantId     租户ID
     * @param text         初步报告正文
     * @param documentHash 生成时的文档集合摘要
     * @return 新版本
     */
    ReportVersionDO createPreliminaryVersion(Long caseId, Long tenantId, String text, String documentHash);

    /**
     * 定稿：新建定稿版本，关联最近的 AI 初稿生成训练样本对，案件关闭。
     * 没有 AI 初稿时不生成样本对。
     *
     * @param caseId           案件ID
     * @param tenantId         租户ID
     * @param finalArtifactRef 定稿文件引用
     * @return 定稿版本
     */
    ReportVersionDO finalizeCase(Long caseId, Long tenantId, String finalArtifactRef);
}
