package com.perizia.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 任务载荷，task 字段即任务名，同时用作发件箱消息体
 *
 * @author perizia
 * @since 2025-03-03
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "task")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ProcessDocumentPayload.class, name = TaskNames.PROCESS_DOCUMENT),
    @JsonSubTypes.Type(value = GenerateReportPayload.class, name = TaskNames.GENERATE_REPORT)
})
public sealed interface TaskPayload permits ProcessDocumentPayload, GenerateReportPayload {

    Long tenantId();

    @JsonIgnore
    String taskName();
}
