package com.perizia.service;

import com.perizia.model.vo.PreliminaryReportVO;

/**
 * 初步报告
 * 文档抽取完成后即可同步生成的简要分析，不渲染文件，也不参与训练样本
 *
 * @author perizia
 * @since 2025-03-10
 */
public interface PreliminaryReportService {

    /**
     * 查询最近一份初步报告以及当前能否生成
     *
     * @param caseId   案件ID
     * @param tenantId 租户ID
     * @return 初步报告，尚未生成时正文为空
     */
    PreliminaryReportVO getPreliminaryReport(Long caseId, Long tenantId);

    /**
     * 生成初步报告。
     * 仍有文档在处理中时拒绝；文档集合与最近一份初步报告相同且未强制时直接返回已有报告。
     *
     * @param caseId   案件ID
     * @param tenantId 租户ID
     * @param force    忽略已有报告重新生成
     * @return 初步报告
     */
    PreliminaryReportVO generatePreliminaryReport(Long caseId, Long tenantId, boolean force);
}
