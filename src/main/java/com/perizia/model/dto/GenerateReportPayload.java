package com.perizia.model.dto;

/**
 * 报告生成任务
 *
 * @param caseId   案件ID
 * @param tenantId 租户ID
 */
public record GenerateReportPayload(Long caseId, Long tenantId) implements TaskPayload {

    @Override
    public String taskName() {
        return TaskNames.GENERATE_REPORT;
    }
}
