package com.perizia.model.dto;

/**
 * 单文档抽取任务
 *
 * @param documentId 文档ID
 * @param tenantId   租户ID
 */
public record ProcessDocumentPayload(Long documentId, Long tenantId) implements TaskPayload {

    @Override
    public String taskName() {
        return TaskNames.PROCESS_DOCUMENT;
    }
}
